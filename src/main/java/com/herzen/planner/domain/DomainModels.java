package com.herzen.planner.domain;

import java.util.List;
import java.util.Locale;

public class DomainModels {
    public record Course(String courseNumber, String courseTitle, List<String> prerequisites) {
        public Course {
            prerequisites = prerequisites == null ? List.of() : List.copyOf(prerequisites);
        }
    }

    public static String normalizeCourseNumber(String raw) {
        return raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
    }
}
