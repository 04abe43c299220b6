package com.herzen.planner.catalog;

import com.herzen.planner.domain.DomainModels.Course;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

// keys are compared verbatim, callers pass upper-cased course numbers
@Component
public class CourseTree {
    private Node root;
    private int size;

    public void insertOrUpdate(Course course) {
        Objects.requireNonNull(course, "course");
        String key = Objects.requireNonNull(course.courseNumber(), "courseNumber");

        if (root == null) {
            root = new Node(course);
            size++;
            return;
        }

        Node current = root;
        while (true) {
            int cmp = key.compareTo(current.course.courseNumber());
            if (cmp == 0) {
                current.course = new Course(current.course.courseNumber(), course.courseTitle(), course.prerequisites());
                return;
            }
            if (cmp < 0) {
                if (current.lower == null) {
                    current.lower = new Node(course);
                    size++;
                    return;
                }
                current = current.lower;
            } else {
                if (current.higher == null) {
                    current.higher = new Node(course);
                    size++;
                    return;
                }
                current = current.higher;
            }
        }
    }

    public Optional<Course> find(String courseNumber) {
        if (courseNumber == null) return Optional.empty();
        Node current = root;
        while (current != null) {
            int cmp = courseNumber.compareTo(current.course.courseNumber());
            if (cmp == 0) return Optional.of(current.course);
            current = cmp < 0 ? current.lower : current.higher;
        }
        return Optional.empty();
    }

    public void forEachInOrder(Consumer<? super Course> visit) {
        Objects.requireNonNull(visit, "visit");
        Deque<Node> pending = new ArrayDeque<>();
        Node current = root;
        while (current != null || !pending.isEmpty()) {
            while (current != null) {
                pending.push(current);
                current = current.lower;
            }
            Node next = pending.pop();
            visit.accept(next.course);
            current = next.higher;
        }
    }

    public List<Course> inOrder() {
        List<Course> courses = new ArrayList<>(size);
        forEachInOrder(courses::add);
        return courses;
    }

    public void clear() {
        root = null;
        size = 0;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    private static final class Node {
        private Course course;
        private Node lower;
        private Node higher;

        private Node(Course course) {
            this.course = course;
        }
    }
}
