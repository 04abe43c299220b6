package com.herzen.planner.shell;

import com.herzen.planner.parser.ParserDtos.LoadIssue;
import com.herzen.planner.report.CourseReportService;
import com.herzen.planner.service.CourseLoadService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

@Component
public class PlannerShell {
    private static final Logger log = LoggerFactory.getLogger(PlannerShell.class);

    private final CourseLoadService loadService;
    private final CourseReportService reportService;

    public PlannerShell(CourseLoadService loadService, CourseReportService reportService) {
        this.loadService = loadService;
        this.reportService = reportService;
    }

    public void run(BufferedReader in, PrintStream out) throws IOException {
        boolean dataLoaded = false;

        while (true) {
            printMenu(out);
            String choice = in.readLine();
            if (choice == null) break;
            choice = choice.trim();
            log.debug("Menu choice '{}'", choice);

            switch (choice) {
                case "1" -> {
                    out.print("Enter course data file name: ");
                    String fileName = readTrimmed(in);
                    if (fileName == null) return;
                    if (fileName.isEmpty()) {
                        out.println("File name cannot be empty.");
                        continue;
                    }
                    CourseLoadService.LoadResult result = loadService.load(fileName);
                    for (LoadIssue issue : result.issues()) {
                        out.println(issue.message());
                        if (issue.line() > 0) out.println("Offending line: " + issue.content());
                    }
                    if (result.loaded()) {
                        out.println("Courses successfully loaded from file: " + fileName);
                        dataLoaded = true;
                    }
                }
                case "2" -> {
                    if (!dataLoaded) {
                        out.println("Please load the data structure first (option 1).");
                        continue;
                    }
                    out.println();
                    out.println("Here is the list of courses:");
                    out.println(reportService.renderListing());
                }
                case "3" -> {
                    if (!dataLoaded) {
                        out.println("Please load the data structure first (option 1).");
                        continue;
                    }
                    out.print("Please enter the course number (for example, CS200): ");
                    String number = readTrimmed(in);
                    if (number == null) return;
                    if (number.isEmpty()) {
                        out.println("Course number cannot be empty.");
                        continue;
                    }
                    out.println();
                    out.println(reportService.render(reportService.describe(number)));
                }
                case "9" -> {
                    out.println("Thank you for using the ABCU Course Planner. Goodbye!");
                    return;
                }
                default -> out.println("Invalid choice. Please enter 1, 2, 3, or 9.");
            }
        }
    }

    private String readTrimmed(BufferedReader in) throws IOException {
        String line = in.readLine();
        return line == null ? null : line.trim();
    }

    private void printMenu(PrintStream out) {
        out.println();
        out.println("*******************************");
        out.println("Welcome to the ABCU Course Planner");
        out.println("*******************************");
        out.println("1. Load Data Structure");
        out.println("2. Print Course List");
        out.println("3. Print Course");
        out.println("9. Exit");
        out.print("Please enter your choice: ");
    }
}
