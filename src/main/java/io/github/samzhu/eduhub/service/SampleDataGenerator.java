package io.github.samzhu.eduhub.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.github.samzhu.eduhub.config.EduhubProperties;
import io.github.samzhu.eduhub.config.EduhubProperties.SampleDataConfig;
import io.github.samzhu.eduhub.document.Assignment;
import io.github.samzhu.eduhub.document.Course;
import io.github.samzhu.eduhub.document.CourseLevel;
import io.github.samzhu.eduhub.document.Enrollment;
import io.github.samzhu.eduhub.document.EnrollmentStatus;
import io.github.samzhu.eduhub.document.Lesson;
import io.github.samzhu.eduhub.document.Submission;
import io.github.samzhu.eduhub.document.User;
import io.github.samzhu.eduhub.document.UserRole;
import io.github.samzhu.eduhub.util.DisplayIds;

/**
 * 範例資料產生器。
 *
 * <p>產生順序與參照關係：
 * <pre>
 * users (25% 講師 INST_nnn，其餘學生 STU_nnn)
 *   └─ courses → 只參照已產生的講師
 *        ├─ lessons     → 只參照已產生的課程，order 在課程內從 1 遞增
 *        ├─ assignments → 只參照已產生的課程
 *        └─ enrollments → (學生, 課程) 不重複，最多嘗試 maxPairAttempts 次，找不到就略過該筆
 *             └─ submissions → 作業所屬課程必須有選課記錄，學生取自該課程的選課
 * </pre>
 *
 * <p>只產生資料，不寫入資料庫。亂數由 {@link Random} 決定，設定種子時結果可重現。
 */
@Component
public class SampleDataGenerator {

    private static final Logger log = LoggerFactory.getLogger(SampleDataGenerator.class);

    private static final List<String> GIVEN_NAMES = List.of(
        "Alex", "Jordan", "Taylor", "Casey", "Morgan", "Riley", "Avery", "Blake", "Cameron", "Drew");
    private static final List<String> FAMILY_NAMES = List.of(
        "Parker", "Reed", "Brooks", "Hayes", "Cooper", "Bailey", "Ellis", "Gray", "Ward", "Stone");
    private static final List<String> EMAIL_DOMAINS = List.of("example.org", "test.com", "demo.edu", "sample.net");
    private static final List<String> SKILLS = List.of(
        "Python", "Java", "React", "Vue", "Angular", "Node.js", "MongoDB", "PostgreSQL", "Docker", "AWS");
    private static final List<String> INSTRUCTOR_FOCUS = List.of(
        "software development", "data analysis", "web technologies");
    private static final List<String> STUDENT_FOCUS = List.of(
        "programming", "technology", "software engineering");

    static final List<String> COURSE_TITLES = List.of(
        "Complete Python Programming",
        "Modern Web Development",
        "Data Science Fundamentals",
        "JavaScript for Beginners",
        "Database Management Systems",
        "React Application Development",
        "Backend Development with Node",
        "Introduction to Machine Learning");
    private static final List<String> CATEGORIES = List.of(
        "Programming", "Web Development", "Data Science", "Software Engineering");

    private static final List<String> LESSON_TOPICS = List.of(
        "Course Introduction", "Core Concepts", "Data Structures", "Algorithms", "Best Practices",
        "Error Handling", "Testing Strategies", "Performance Optimization", "Advanced Techniques", "Final Project");
    private static final List<String> ASSIGNMENT_TYPES = List.of(
        "Quiz", "Project", "Exercise", "Case Study", "Lab Work");
    private static final List<Integer> MAX_POINTS = List.of(70, 85, 100);

    private final Random random;
    private final Clock clock;
    private final SampleDataConfig config;

    public SampleDataGenerator(Random sampleDataRandom, Clock clock, EduhubProperties properties) {
        this.random = sampleDataRandom;
        this.clock = clock;
        this.config = properties.sampleData();
    }

    /**
     * 依設定的筆數產生一組完整範例資料。
     */
    public SampleDataSet generate() {
        List<User> users = buildUsers(config.users());
        List<User> instructors = users.stream().filter(u -> UserRole.INSTRUCTOR.value().equals(u.role())).toList();
        List<User> students = users.stream().filter(u -> UserRole.STUDENT.value().equals(u.role())).toList();

        List<Course> courses = buildCourses(config.courses(), instructors);
        List<Lesson> lessons = buildLessons(config.lessons(), courses);
        List<Assignment> assignments = buildAssignments(config.assignments(), courses);
        List<Enrollment> enrollments = buildEnrollments(config.enrollments(), students, courses);
        List<Submission> submissions = buildSubmissions(config.submissions(), assignments, enrollments);

        SampleDataSet dataSet = new SampleDataSet(users, courses, lessons, assignments, enrollments, submissions);
        log.info("Sample data generated: {}", dataSet.counts());
        return dataSet;
    }

    List<User> buildUsers(int count) {
        List<User> users = new ArrayList<>();
        int instructorCount = count / 4;
        for (int i = 0; i < instructorCount; i++) {
            String given = pick(GIVEN_NAMES);
            String family = pick(FAMILY_NAMES);
            users.add(new User(
                null,
                DisplayIds.format(UserRole.INSTRUCTOR.idPrefix(), i + 1),
                given.toLowerCase() + "." + family.toLowerCase() + ".inst" + (i + 1) + "@" + pick(EMAIL_DOMAINS),
                given,
                family,
                UserRole.INSTRUCTOR.value(),
                daysAgo(90, 900),
                new User.Profile(
                    "Professional instructor specializing in " + pick(INSTRUCTOR_FOCUS),
                    "https://avatars.example.com/instructor_" + (i + 1) + ".png",
                    sample(SKILLS, between(4, 7))),
                true
            ));
        }
        for (int i = 0; i < count - instructorCount; i++) {
            String given = pick(GIVEN_NAMES);
            String family = pick(FAMILY_NAMES);
            users.add(new User(
                null,
                DisplayIds.format(UserRole.STUDENT.idPrefix(), i + 1),
                given.toLowerCase() + "." + family.toLowerCase() + i + "@" + pick(EMAIL_DOMAINS),
                given,
                family,
                UserRole.STUDENT.value(),
                daysAgo(10, 450),
                new User.Profile(
                    "Eager learner focusing on " + pick(STUDENT_FOCUS),
                    "https://avatars.example.com/student_" + (i + 1) + ".png",
                    sample(SKILLS, between(2, 5))),
                true
            ));
        }
        return users;
    }

    List<Course> buildCourses(int count, List<User> instructors) {
        if (instructors.isEmpty()) {
            log.warn("No instructors generated, skipping courses");
            return List.of();
        }
        List<Course> courses = new ArrayList<>();
        for (int i = 0; i < Math.min(count, COURSE_TITLES.size()); i++) {
            String title = COURSE_TITLES.get(i);
            courses.add(new Course(
                null,
                DisplayIds.format("COURSE", i + 1),
                title,
                "Comprehensive training in " + title.toLowerCase() + " with practical applications and real-world projects.",
                pick(instructors).userId(),
                pick(CATEGORIES),
                pick(Arrays.asList(CourseLevel.values())).value(),
                between(30, 90),
                between(120, 480),
                Arrays.stream(title.split(" ")).filter(word -> word.length() > 3).map(String::toLowerCase).toList(),
                daysAgo(10, 220),
                daysAgo(1, 50),
                random.nextBoolean()
            ));
        }
        return courses;
    }

    List<Lesson> buildLessons(int count, List<Course> courses) {
        if (courses.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> nextOrder = new HashMap<>();
        List<Lesson> lessons = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Course course = pick(courses);
            String topic = pick(LESSON_TOPICS);
            int order = nextOrder.merge(course.courseId(), 1, Integer::sum);
            lessons.add(new Lesson(
                null,
                DisplayIds.format("LESSON", i + 1),
                course.courseId(),
                topic + " - " + course.title(),
                "This lesson explores " + topic.toLowerCase() + " with detailed explanations and practical examples.",
                between(25, 55),
                order,
                "https://videos.example.com/lesson_" + (i + 1) + ".mp4",
                List.of("lesson_" + (i + 1) + "_notes.pdf", "lesson_" + (i + 1) + "_code.zip"),
                daysAgo(5, 120)
            ));
        }
        return lessons;
    }

    List<Assignment> buildAssignments(int count, List<Course> courses) {
        if (courses.isEmpty()) {
            return List.of();
        }
        List<Assignment> assignments = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Course course = pick(courses);
            String type = pick(ASSIGNMENT_TYPES);
            assignments.add(new Assignment(
                null,
                DisplayIds.format("ASSIGN", i + 1),
                course.courseId(),
                type + ": " + course.title(),
                "Complete this " + type.toLowerCase() + " to demonstrate mastery of course concepts.",
                clock.instant().plus(Duration.ofDays(between(14, 45))),
                pick(MAX_POINTS),
                "Follow the guidelines to complete this " + type.toLowerCase() + ". Submit all required components.",
                daysAgo(7, 90)
            ));
        }
        return assignments;
    }

    /**
     * 產生選課記錄。第 i 筆的 ID 固定為 {@code ENROLL_(i+1)}，略過的筆數會留下空號。
     */
    List<Enrollment> buildEnrollments(int count, List<User> students, List<Course> courses) {
        if (students.isEmpty() || courses.isEmpty()) {
            return List.of();
        }
        Set<String> usedPairs = new HashSet<>();
        List<Enrollment> enrollments = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            User student = null;
            Course course = null;
            for (int attempt = 0; attempt < config.maxPairAttempts(); attempt++) {
                User candidateStudent = pick(students);
                Course candidateCourse = pick(courses);
                if (usedPairs.add(candidateStudent.userId() + "|" + candidateCourse.courseId())) {
                    student = candidateStudent;
                    course = candidateCourse;
                    break;
                }
            }
            if (student == null) {
                log.debug("No unused (student, course) pair found for slot {}, skipped", i + 1);
                continue;
            }
            EnrollmentStatus status = pick(Arrays.asList(EnrollmentStatus.values()));
            enrollments.add(new Enrollment(
                null,
                DisplayIds.format("ENROLL", i + 1),
                student.userId(),
                course.courseId(),
                daysAgo(7, 90),
                status.value(),
                between(15, 100),
                status == EnrollmentStatus.COMPLETED ? daysAgo(1, 50) : null
            ));
        }
        return enrollments;
    }

    /**
     * 產生繳交記錄。作業所屬課程沒有選課記錄時，該筆不產生。
     */
    List<Submission> buildSubmissions(int count, List<Assignment> assignments, List<Enrollment> enrollments) {
        if (assignments.isEmpty()) {
            return List.of();
        }
        List<Submission> submissions = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Assignment assignment = pick(assignments);
            List<Enrollment> courseEnrollments = enrollments.stream()
                .filter(e -> e.courseId().equals(assignment.courseId()))
                .toList();
            if (courseEnrollments.isEmpty()) {
                continue;
            }
            Enrollment enrollment = pick(courseEnrollments);
            submissions.add(new Submission(
                null,
                DisplayIds.format("SUB", i + 1),
                assignment.assignmentId(),
                enrollment.studentId(),
                daysAgo(1, 30),
                "Submission for " + assignment.title() + ". All requirements have been met.",
                List.of("submission_" + (i + 1) + ".pdf", "source_code_" + (i + 1) + ".py"),
                random.nextBoolean() ? between(55, 100) : null,
                random.nextBoolean() ? "Well done! Good understanding demonstrated." : null,
                random.nextBoolean() ? daysAgo(1, 15) : null
            ));
        }
        return submissions;
    }

    private <T> T pick(List<T> values) {
        return values.get(random.nextInt(values.size()));
    }

    private List<String> sample(List<String> values, int size) {
        List<String> shuffled = new ArrayList<>(values);
        Collections.shuffle(shuffled, random);
        return List.copyOf(shuffled.subList(0, Math.min(size, shuffled.size())));
    }

    /**
     * 亂數整數，上下限皆包含。
     */
    private int between(int min, int max) {
        return min + random.nextInt(max - min + 1);
    }

    private Instant daysAgo(int min, int max) {
        return clock.instant().minus(Duration.ofDays(between(min, max)));
    }
}
