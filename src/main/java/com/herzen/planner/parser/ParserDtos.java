package com.herzen.planner.parser;

import java.util.List;

public class ParserDtos {
    public record CourseLineDoc(String courseNumber, String courseTitle, List<String> prerequisites,
                                int line, String content) {}

    public record LoadIssue(String code, String message, int line, String content) {}
}
