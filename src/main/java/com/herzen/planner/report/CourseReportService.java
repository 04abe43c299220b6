package com.herzen.planner.report;

import com.herzen.planner.catalog.CourseTree;
import com.herzen.planner.domain.DomainModels;
import com.herzen.planner.report.ReportModels.CourseReport;
import com.herzen.planner.report.ReportModels.PrerequisiteLine;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class CourseReportService {
    static final String NO_COURSES = "No courses loaded.";

    private final CourseTree tree;

    public CourseReportService(CourseTree tree) {
        this.tree = tree;
    }

    public CourseReport describe(String courseNumber) {
        String key = DomainModels.normalizeCourseNumber(courseNumber);
        Optional<DomainModels.Course> found = tree.find(key);
        if (found.isEmpty()) {
            return new CourseReport(key, false, null, List.of());
        }

        DomainModels.Course course = found.get();
        List<PrerequisiteLine> prerequisites = course.prerequisites().stream()
                .map(DomainModels::normalizeCourseNumber)
                .map(id -> tree.find(id)
                        .map(p -> new PrerequisiteLine(p.courseNumber(), p.courseTitle(), true))
                        .orElseGet(() -> new PrerequisiteLine(id, null, false)))
                .toList();
        return new CourseReport(course.courseNumber(), true, course.courseTitle(), prerequisites);
    }

    public String render(CourseReport report) {
        if (!report.found()) {
            return "Course " + report.courseNumber() + " not found.";
        }

        StringBuilder sb = new StringBuilder();
        sb.append(report.courseNumber()).append(", ").append(report.courseTitle());
        if (report.prerequisites().isEmpty()) {
            sb.append("\nPrerequisites: None");
            return sb.toString();
        }

        sb.append("\nPrerequisites:");
        for (PrerequisiteLine p : report.prerequisites()) {
            sb.append("\n  ").append(p.courseNumber());
            if (p.resolved()) sb.append(", ").append(p.courseTitle());
            else sb.append(" (course not found in data)");
        }
        return sb.toString();
    }

    public List<String> listing() {
        List<String> rows = new ArrayList<>(tree.size());
        tree.forEachInOrder(c -> rows.add(c.courseNumber() + ", " + c.courseTitle()));
        return rows;
    }

    public String renderListing() {
        List<String> rows = listing();
        return rows.isEmpty() ? NO_COURSES : String.join("\n", rows);
    }
}
