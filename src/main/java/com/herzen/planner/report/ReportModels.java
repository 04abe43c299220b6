package com.herzen.planner.report;

import java.util.List;

public class ReportModels {
    public record CourseReport(String courseNumber, boolean found, String courseTitle,
                               List<PrerequisiteLine> prerequisites) {}

    public record PrerequisiteLine(String courseNumber, String courseTitle, boolean resolved) {}
}
