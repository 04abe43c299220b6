package com.herzen.planner;

import com.herzen.planner.catalog.CourseTree;
import com.herzen.planner.domain.DomainModels.Course;
import com.herzen.planner.parser.LoadIssueCodes;
import com.herzen.planner.service.CourseLoadService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CourseLoadServiceTest {
    @Autowired
    private CourseLoadService loadService;
    @Autowired
    private CourseTree tree;

    @TempDir
    Path tempDir;

    @Test
    void skipsMalformedLinesAndKeepsLoading() {
        var result = loadService.load("inline", List.of(
                "CS101",
                "CS101,",
                "CS102,Intro,CS100,",
                "CS100,Basics"
        ));

        assertTrue(result.loaded());
        assertEquals(2, result.courseCount());
        assertEquals(2, result.issues().size());

        var format = result.issues().get(0);
        assertEquals(LoadIssueCodes.LINE_FORMAT, format.code());
        assertEquals(1, format.line());
        assertEquals("CS101", format.content());

        var missing = result.issues().get(1);
        assertEquals(LoadIssueCodes.MISSING_FIELD, missing.code());
        assertEquals(2, missing.line());
        assertEquals("CS101,", missing.content());

        assertTrue(tree.find("CS101").isEmpty());
        assertEquals(List.of("CS100"), tree.find("CS102").orElseThrow().prerequisites());
    }

    @Test
    void trimsFieldsAndNormalizesCourseNumbers() {
        var result = loadService.load("inline", List.of(
                "  cs200 , Data Structures , cs100 ,  , math201\r",
                "",
                "   ",
                ",No Number"
        ));

        assertEquals(1, result.courseCount());
        Course course = tree.find("CS200").orElseThrow();
        assertEquals("Data Structures", course.courseTitle());
        assertEquals(List.of("CS100", "MATH201"), course.prerequisites());

        assertEquals(1, result.issues().size());
        assertEquals(4, result.issues().get(0).line());
    }

    @Test
    void laterDuplicateLineOverwritesEarlierOne() {
        var result = loadService.load("inline", List.of(
                "CS100,Old Title,MATH101",
                "CS100,New Title"
        ));

        assertEquals(1, result.courseCount());
        Course course = tree.find("CS100").orElseThrow();
        assertEquals("New Title", course.courseTitle());
        assertTrue(course.prerequisites().isEmpty());
    }

    @Test
    void reloadingSameFileIsIdempotent() throws IOException {
        Path file = tempDir.resolve("courses.csv");
        Files.write(file, List.of(
                "CSCI300,Introduction to Algorithms,CSCI200,MATH201",
                "CSCI100,Introduction to Computer Science",
                "CSCI200,Data Structures,CSCI101",
                "MATH201,Discrete Mathematics"
        ), StandardCharsets.UTF_8);

        var first = loadService.load(file.toString());
        List<Course> firstListing = tree.inOrder();
        var second = loadService.load(file.toString());
        List<Course> secondListing = tree.inOrder();

        assertTrue(first.loaded());
        assertTrue(second.loaded());
        assertEquals(4, second.courseCount());
        assertEquals(firstListing, secondListing);
        assertEquals(List.of("CSCI100", "CSCI200", "CSCI300", "MATH201"),
                secondListing.stream().map(Course::courseNumber).toList());
    }

    @Test
    void newLoadDoesNotKeepCoursesFromPreviousOne() {
        loadService.load("first", List.of("CS100,Intro", "CS200,Data Structures"));
        loadService.load("second", List.of("MATH201,Discrete Mathematics"));

        assertEquals(1, tree.size());
        assertTrue(tree.find("CS100").isEmpty());
    }

    @Test
    void undecodableBytesDoNotAbortTheLoad() throws IOException {
        Path file = tempDir.resolve("latin1.csv");
        Files.write(file, "CS100,Intro\nCS200,Caf\u00e9 Theory,CS100\n".getBytes(StandardCharsets.ISO_8859_1));

        var result = loadService.load(file.toString());

        assertTrue(result.loaded());
        assertTrue(result.issues().isEmpty());
        assertEquals(2, result.courseCount());
        assertEquals("Intro", tree.find("CS100").orElseThrow().courseTitle());
        Course cafe = tree.find("CS200").orElseThrow();
        assertTrue(cafe.courseTitle().startsWith("Caf"));
        assertEquals(List.of("CS100"), cafe.prerequisites());
    }

    @Test
    void nullFileNameIsReportedAsSourceUnavailable() {
        loadService.load("seed", List.of("CS100,Intro"));

        var result = assertDoesNotThrow(() -> loadService.load((String) null));

        assertFalse(result.loaded());
        assertEquals(LoadIssueCodes.SOURCE_UNAVAILABLE, result.issues().get(0).code());
        assertTrue(tree.isEmpty());
    }

    @Test
    void missingFileReportsSourceUnavailableAndLeavesStoreEmpty() {
        loadService.load("seed", List.of("CS100,Intro"));

        var result = loadService.load(tempDir.resolve("does-not-exist.csv").toString());

        assertFalse(result.loaded());
        assertEquals(0, result.courseCount());
        assertEquals(1, result.issues().size());
        assertEquals(LoadIssueCodes.SOURCE_UNAVAILABLE, result.issues().get(0).code());
        assertTrue(tree.isEmpty());
    }
}
