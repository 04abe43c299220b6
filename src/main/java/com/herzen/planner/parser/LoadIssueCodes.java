package com.herzen.planner.parser;

public final class LoadIssueCodes {
    public static final String SOURCE_UNAVAILABLE = "SOURCE_UNAVAILABLE";
    public static final String LINE_FORMAT = "LINE_FORMAT";
    public static final String MISSING_FIELD = "MISSING_FIELD";

    private LoadIssueCodes() {}
}
