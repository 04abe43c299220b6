package com.herzen.planner.validation;

import com.herzen.planner.parser.LoadIssueCodes;
import com.herzen.planner.parser.ParserDtos.CourseLineDoc;
import com.herzen.planner.parser.ParserDtos.LoadIssue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class CourseLineValidator {
    public ValidationResult validate(List<CourseLineDoc> docs) {
        List<CourseLineDoc> accepted = new ArrayList<>();
        List<LoadIssue> issues = new ArrayList<>();

        docs.forEach(d -> {
            if (d.courseNumber().isEmpty() || d.courseTitle().isEmpty()) {
                issues.add(new LoadIssue(LoadIssueCodes.MISSING_FIELD,
                        "File format warning on line " + d.line() + ": missing course number or title.", d.line(), d.content()));
            } else {
                accepted.add(d);
            }
        });
        return new ValidationResult(accepted, issues);
    }

    public record ValidationResult(List<CourseLineDoc> accepted, List<LoadIssue> issues) {}
}
