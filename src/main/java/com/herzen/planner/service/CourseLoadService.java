package com.herzen.planner.service;

import com.herzen.planner.catalog.CourseTree;
import com.herzen.planner.config.PlannerProperties;
import com.herzen.planner.domain.DomainModels;
import com.herzen.planner.parser.CourseLineParser;
import com.herzen.planner.parser.LoadIssueCodes;
import com.herzen.planner.parser.ParserDtos.CourseLineDoc;
import com.herzen.planner.parser.ParserDtos.LoadIssue;
import com.herzen.planner.validation.CourseLineValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class CourseLoadService {
    private static final Logger log = LoggerFactory.getLogger(CourseLoadService.class);

    private final CourseLineParser parser;
    private final CourseLineValidator validator;
    private final CourseTree tree;
    private final PlannerProperties properties;

    public CourseLoadService(CourseLineParser parser,
                             CourseLineValidator validator,
                             CourseTree tree,
                             PlannerProperties properties) {
        this.parser = parser;
        this.validator = validator;
        this.tree = tree;
        this.properties = properties;
    }

    public LoadResult load(String fileName) {
        tree.clear();
        if (fileName == null) {
            log.warn("No course data file given");
            return sourceUnavailable(null);
        }

        List<String> lines;
        try {
            lines = readLines(Path.of(fileName));
        } catch (IOException | UncheckedIOException | InvalidPathException e) {
            log.warn("Cannot read course data from '{}': {}", fileName, e.toString());
            return sourceUnavailable(fileName);
        }
        return populate(fileName, lines);
    }

    public LoadResult load(String sourceName, List<String> lines) {
        tree.clear();
        return populate(sourceName, lines);
    }

    private LoadResult sourceUnavailable(String fileName) {
        LoadIssue issue = new LoadIssue(LoadIssueCodes.SOURCE_UNAVAILABLE, "Error opening file: " + fileName, 0, fileName);
        return new LoadResult(fileName, false, 0, List.of(issue));
    }

    // undecodable bytes become U+FFFD instead of failing the whole file
    private List<String> readLines(Path path) throws IOException {
        CharsetDecoder decoder = properties.charset().newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder))) {
            return reader.lines().toList();
        }
    }

    private LoadResult populate(String sourceName, List<String> lines) {
        CourseLineParser.ParseResult parseResult = parser.parse(lines);
        CourseLineValidator.ValidationResult validation = validator.validate(parseResult.docs());

        for (CourseLineDoc doc : validation.accepted()) {
            tree.insertOrUpdate(new DomainModels.Course(doc.courseNumber(), doc.courseTitle(), doc.prerequisites()));
        }

        List<LoadIssue> issues = new ArrayList<>(parseResult.issues());
        issues.addAll(validation.issues());
        issues.sort(Comparator.comparingInt(LoadIssue::line));
        issues.forEach(i -> log.debug("Skipped line {} of '{}' [{}]: {}", i.line(), sourceName, i.code(), i.content()));

        log.info("Loaded {} courses from '{}' ({} lines skipped)", tree.size(), sourceName, issues.size());
        return new LoadResult(sourceName, true, tree.size(), List.copyOf(issues));
    }

    public record LoadResult(String sourceName, boolean loaded, int courseCount, List<LoadIssue> issues) {}
}
