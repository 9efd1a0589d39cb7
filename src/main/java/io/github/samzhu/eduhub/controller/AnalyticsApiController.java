package io.github.samzhu.eduhub.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.eduhub.dto.analytics.AdvancedAnalytics;
import io.github.samzhu.eduhub.dto.analytics.CategoryEnrollmentStats;
import io.github.samzhu.eduhub.dto.analytics.CourseDetail;
import io.github.samzhu.eduhub.dto.analytics.EnrolledStudent;
import io.github.samzhu.eduhub.dto.analytics.InstructorAnalytics;
import io.github.samzhu.eduhub.dto.analytics.StudentPerformance;
import io.github.samzhu.eduhub.service.CourseAnalyticsService;

/**
 * Read-only analytics API.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/v1/analytics/categories} - Enrollment statistics by course category</li>
 *   <li>{@code GET /api/v1/analytics/students} - Student performance</li>
 *   <li>{@code GET /api/v1/analytics/instructors} - Instructor revenue and students</li>
 *   <li>{@code GET /api/v1/analytics/advanced} - Monthly trends, popular categories, engagement</li>
 *   <li>{@code GET /api/v1/analytics/courses/{courseId}} - Course with instructor profile</li>
 *   <li>{@code GET /api/v1/analytics/courses/{courseId}/students} - Students enrolled in a course</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/analytics")
public class AnalyticsApiController {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsApiController.class);

    private final CourseAnalyticsService analyticsService;

    public AnalyticsApiController(CourseAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/categories")
    public ResponseEntity<List<CategoryEnrollmentStats>> getCategoryStatistics() {
        log.debug("API request: category statistics");
        return ResponseEntity.ok(analyticsService.getCourseEnrollmentStatistics());
    }

    @GetMapping("/students")
    public ResponseEntity<List<StudentPerformance>> getStudentPerformance() {
        log.debug("API request: student performance");
        return ResponseEntity.ok(analyticsService.getStudentPerformanceAnalysis());
    }

    @GetMapping("/instructors")
    public ResponseEntity<List<InstructorAnalytics>> getInstructorAnalytics() {
        log.debug("API request: instructor analytics");
        return ResponseEntity.ok(analyticsService.getInstructorAnalytics());
    }

    @GetMapping("/advanced")
    public ResponseEntity<AdvancedAnalytics> getAdvancedAnalytics() {
        log.debug("API request: advanced analytics");
        return ResponseEntity.ok(analyticsService.getAdvancedAnalytics());
    }

    /**
     * Course detail with the instructor's public profile, 404 when the course or instructor is missing.
     */
    @GetMapping("/courses/{courseId}")
    public ResponseEntity<CourseDetail> getCourseDetail(@PathVariable String courseId) {
        log.debug("API request: course detail, courseId={}", courseId);
        return analyticsService.getCourseWithInstructorDetails(courseId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/courses/{courseId}/students")
    public ResponseEntity<List<EnrolledStudent>> getEnrolledStudents(@PathVariable String courseId) {
        log.debug("API request: enrolled students, courseId={}", courseId);
        return ResponseEntity.ok(analyticsService.findEnrolledStudentsInCourse(courseId));
    }
}
