package io.github.samzhu.eduhub.service;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.github.samzhu.eduhub.dto.analytics.AdvancedAnalytics;
import io.github.samzhu.eduhub.dto.analytics.CategoryEnrollmentStats;
import io.github.samzhu.eduhub.dto.analytics.InstructorAnalytics;
import io.github.samzhu.eduhub.dto.analytics.StudentPerformance;
import io.github.samzhu.eduhub.dto.diagnostics.DatabaseInfo;

/**
 * 以表格形式將統計結果寫入 log。
 */
@Component
public class AnalyticsReportPrinter {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsReportPrinter.class);

    /**
     * 執行全部統計查詢並輸出。
     *
     * @param analytics 統計服務（資料庫或快照）
     */
    public void printReport(CourseAnalyticsService analytics) {
        printCategoryStatistics(analytics.getCourseEnrollmentStatistics());
        printStudentPerformance(analytics.getStudentPerformanceAnalysis());
        printInstructorAnalytics(analytics.getInstructorAnalytics());
        printAdvancedAnalytics(analytics.getAdvancedAnalytics());
    }

    public void printDatabaseInfo(DatabaseInfo info) {
        log.info("Database: {}", info.databaseName());
        log.info(String.format("%-22s %8s %10s %10s", "Collection", "Count", "Size", "AvgObj"));
        info.collectionStats().forEach((name, stats) ->
            log.info(String.format("%-22s %8d %10d %10d", name, stats.count(), stats.size(), stats.avgObjSize())));
    }

    public void printCounts(String title, Map<String, Integer> counts) {
        log.info("{}:", title);
        counts.forEach((collection, count) -> log.info(String.format("  %-14s %5d", collection, count)));
    }

    void printCategoryStatistics(List<CategoryEnrollmentStats> stats) {
        log.info("Course enrollment statistics by category");
        log.info(String.format("%-22s %8s %12s %10s", "Category", "Courses", "Enrollments", "AvgPrice"));
        for (CategoryEnrollmentStats row : stats) {
            log.info(String.format("%-22s %8d %12d %10s",
                row.category(), row.totalCourses(), row.totalEnrollments(), format(row.averagePrice())));
        }
    }

    void printStudentPerformance(List<StudentPerformance> performance) {
        log.info("Student performance");
        log.info(String.format("%-10s %-22s %8s %12s %8s", "Student", "Name", "AvgGrade", "Submissions", "Courses"));
        for (StudentPerformance row : performance) {
            log.info(String.format("%-10s %-22s %8s %12d %8d",
                row.studentId(), row.studentName(), format(row.averageGrade()),
                row.totalSubmissions(), row.coursesCount()));
        }
    }

    void printInstructorAnalytics(List<InstructorAnalytics> instructors) {
        log.info("Instructor analytics");
        log.info(String.format("%-10s %-22s %8s %9s %12s", "Instructor", "Name", "Courses", "Students", "Revenue"));
        for (InstructorAnalytics row : instructors) {
            log.info(String.format("%-10s %-22s %8d %9d %12.2f",
                row.instructorId(), row.instructorName(), row.totalCourses(),
                row.totalStudents(), row.totalRevenue()));
        }
    }

    void printAdvancedAnalytics(AdvancedAnalytics analytics) {
        log.info("Monthly enrollment trends");
        analytics.monthlyTrends().forEach(row -> log.info(String.format("  %s-%s  total=%d active=%d completed=%d",
            row.year(), row.month() != null ? String.format("%02d", row.month()) : null,
            row.enrollmentCount(), row.activeEnrollments(), row.completedEnrollments())));
        log.info("Popular categories");
        analytics.popularCategories().forEach(row -> log.info(String.format("  %-22s enrollments=%d courses=%d",
            row.category(), row.totalEnrollments(), row.courseCount())));
        log.info("Engagement by status");
        analytics.engagementMetrics().forEach(row -> log.info(String.format("  %-10s count=%d avgProgress=%s",
            row.status(), row.count(), format(row.averageProgress()))));
    }

    private static String format(Double value) {
        return value == null ? "-" : String.format("%.2f", value);
    }
}
