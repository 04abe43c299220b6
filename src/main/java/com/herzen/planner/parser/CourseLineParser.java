package com.herzen.planner.parser;

import com.herzen.planner.config.PlannerProperties;
import com.herzen.planner.domain.DomainModels;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import static com.herzen.planner.parser.ParserDtos.*;

@Component
public class CourseLineParser {
    private final Pattern delimiter;

    public CourseLineParser(PlannerProperties properties) {
        this.delimiter = Pattern.compile(Pattern.quote(String.valueOf(properties.delimiter())));
    }

    public ParseResult parse(List<String> lines) {
        List<CourseLineDoc> docs = new ArrayList<>();
        List<LoadIssue> issues = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int lineNo = i + 1;
            if (line == null || line.trim().isEmpty()) continue;

            // -1 keeps trailing empty fields, so "CS101," has an (empty) title
            String[] fields = delimiter.split(line, -1);
            if (fields.length < 2) {
                issues.add(new LoadIssue(LoadIssueCodes.LINE_FORMAT,
                        "File format error on line " + lineNo + ": fewer than two fields.", lineNo, line));
                continue;
            }

            String number = DomainModels.normalizeCourseNumber(fields[0]);
            String title = fields[1].trim();
            List<String> prerequisites = Arrays.stream(fields, 2, fields.length)
                    .map(DomainModels::normalizeCourseNumber)
                    .filter(p -> !p.isEmpty())
                    .toList();
            docs.add(new CourseLineDoc(number, title, prerequisites, lineNo, line));
        }
        return new ParseResult(docs, issues);
    }

    public record ParseResult(List<CourseLineDoc> docs, List<LoadIssue> issues) {}
}
