package io.github.samzhu.eduhub.service;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import io.github.samzhu.eduhub.dto.analytics.AdvancedAnalytics;
import io.github.samzhu.eduhub.dto.analytics.CategoryEnrollmentStats;
import io.github.samzhu.eduhub.dto.analytics.CategoryPopularity;
import io.github.samzhu.eduhub.dto.analytics.CourseDetail;
import io.github.samzhu.eduhub.dto.analytics.EngagementMetric;
import io.github.samzhu.eduhub.dto.analytics.EnrolledStudent;
import io.github.samzhu.eduhub.dto.analytics.InstructorAnalytics;
import io.github.samzhu.eduhub.dto.analytics.MonthlyEnrollmentTrend;
import io.github.samzhu.eduhub.dto.analytics.StudentPerformance;
import io.github.samzhu.eduhub.pipeline.Documents;
import io.github.samzhu.eduhub.pipeline.Pipeline;
import io.github.samzhu.eduhub.pipeline.PipelineExecutor;

/**
 * 跨集合統計服務。
 *
 * <p>每個查詢由 {@link AnalyticsPipelines} 定義 pipeline，交給 {@link PipelineExecutor} 執行後
 * 將結果文件轉為統計記錄：
 * <pre>
 * AnalyticsPipelines ──→ PipelineExecutor ──→ List&lt;Document&gt; ──→ records
 *                        ├─ MongoPipelineExecutor   (資料庫)
 *                        └─ InMemoryPipelineExecutor (匯出檔快照)
 * </pre>
 *
 * <p>讀取失敗時記錄錯誤並回傳空結果，不回傳部分結果。記憶體內執行時，運算式的型別錯誤
 * （如 {@code $concat} 遇到非字串）視同查詢失敗。
 */
@Service
public class CourseAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(CourseAnalyticsService.class);

    private final PipelineExecutor executor;

    public CourseAnalyticsService(PipelineExecutor executor) {
        this.executor = executor;
    }

    /**
     * 類別選課統計，依總選課數降冪。
     */
    public List<CategoryEnrollmentStats> getCourseEnrollmentStatistics() {
        return run("course enrollment statistics", AnalyticsPipelines.courseEnrollmentStatistics(), document ->
            new CategoryEnrollmentStats(
                stringOf(document.get("_id")),
                longOf(document.get("totalCourses")),
                longOf(document.get("totalEnrollments")),
                doubleOrNull(document.get("averagePrice")),
                documents(document.get("courses")).stream()
                    .map(course -> new CategoryEnrollmentStats.CourseEnrollment(
                        stringOf(course.get("courseId")),
                        stringOf(course.get("title")),
                        longOf(course.get("enrollmentCount")),
                        doubleOrNull(course.get("price"))))
                    .toList()));
    }

    /**
     * 學生成績表現，依平均分數降冪（沒有分數的學生排最後）。
     */
    public List<StudentPerformance> getStudentPerformanceAnalysis() {
        return run("student performance", AnalyticsPipelines.studentPerformance(), document ->
            new StudentPerformance(
                stringOf(document.get("_id")),
                stringOf(document.get("studentName")),
                doubleOrNull(document.get("averageGrade")),
                longOf(document.get("totalSubmissions")),
                strings(document.get("coursesParticipated")),
                longOf(document.get("coursesCount"))));
    }

    /**
     * 講師統計，依總營收降冪。
     */
    public List<InstructorAnalytics> getInstructorAnalytics() {
        return run("instructor analytics", AnalyticsPipelines.instructorAnalytics(), document ->
            new InstructorAnalytics(
                stringOf(document.get("_id")),
                stringOf(document.get("instructorName")),
                longOf(document.get("totalCourses")),
                longOf(document.get("totalStudents")),
                doubleOf(document.get("totalRevenue")),
                documents(document.get("courses")).stream()
                    .map(course -> new InstructorAnalytics.CourseRevenue(
                        stringOf(course.get("title")),
                        longOf(course.get("enrollments")),
                        doubleOf(course.get("revenue"))))
                    .toList()));
    }

    /**
     * 進階統計：每月趨勢、類別熱門度、參與度。
     *
     * <p>三組查詢任一失敗時整體回傳空結果。
     */
    public AdvancedAnalytics getAdvancedAnalytics() {
        try {
            List<MonthlyEnrollmentTrend> trends = executor.execute(AnalyticsPipelines.monthlyEnrollmentTrends())
                .stream()
                .map(document -> {
                    Document key = documentOrNull(document.get("_id"));
                    return new MonthlyEnrollmentTrend(
                        key != null ? intOrNull(key.get("year")) : null,
                        key != null ? intOrNull(key.get("month")) : null,
                        longOf(document.get("enrollmentCount")),
                        longOf(document.get("activeEnrollments")),
                        longOf(document.get("completedEnrollments")));
                })
                .toList();
            List<CategoryPopularity> categories = executor.execute(AnalyticsPipelines.popularCategories())
                .stream()
                .map(document -> new CategoryPopularity(
                    stringOf(document.get("_id")),
                    longOf(document.get("totalEnrollments")),
                    longOf(document.get("courseCount"))))
                .toList();
            List<EngagementMetric> engagement = executor.execute(AnalyticsPipelines.engagementMetrics())
                .stream()
                .map(document -> new EngagementMetric(
                    stringOf(document.get("_id")),
                    longOf(document.get("count")),
                    doubleOrNull(document.get("averageProgress"))))
                .toList();
            log.info("Advanced analytics computed: months={}, categories={}, statuses={}",
                trends.size(), categories.size(), engagement.size());
            return new AdvancedAnalytics(trends, categories, engagement);
        } catch (DataAccessException | IllegalArgumentException e) {
            log.error("Failed to compute advanced analytics", e);
            return AdvancedAnalytics.empty();
        }
    }

    /**
     * 課程與講師公開資料。
     *
     * @param courseId 課程 ID
     * @return 課程明細；課程或講師不存在時為空
     */
    public Optional<CourseDetail> getCourseWithInstructorDetails(String courseId) {
        return run("course detail", AnalyticsPipelines.courseWithInstructor(courseId), document -> {
            Document instructor = documentOrNull(document.get("instructor_info"));
            Document profile = instructor != null ? documentOrNull(instructor.get("profile")) : null;
            return new CourseDetail(
                stringOf(document.get("courseId")),
                stringOf(document.get("title")),
                stringOf(document.get("description")),
                stringOf(document.get("category")),
                stringOf(document.get("level")),
                intOrNull(document.get("duration")),
                doubleOrNull(document.get("price")),
                strings(document.get("tags")),
                instructor == null ? null : new CourseDetail.InstructorInfo(
                    stringOf(instructor.get("firstName")),
                    stringOf(instructor.get("lastName")),
                    stringOf(instructor.get("email")),
                    profile != null ? stringOf(profile.get("bio")) : null));
        }).stream().findFirst();
    }

    /**
     * 課程中的選課學生。
     *
     * @param courseId 課程 ID
     * @return 選課學生清單
     */
    public List<EnrolledStudent> findEnrolledStudentsInCourse(String courseId) {
        return run("enrolled students", AnalyticsPipelines.enrolledStudents(courseId), document -> {
            Document student = documentOrNull(document.get("student_info"));
            return new EnrolledStudent(
                stringOf(document.get("enrollmentId")),
                instantOrNull(document.get("enrollmentDate")),
                stringOf(document.get("status")),
                intOrNull(document.get("progress")),
                student == null ? null : new EnrolledStudent.StudentInfo(
                    stringOf(student.get("firstName")),
                    stringOf(student.get("lastName")),
                    stringOf(student.get("email"))));
        });
    }

    private <T> List<T> run(String name, Pipeline pipeline, Function<Document, T> mapper) {
        try {
            List<T> results = executor.execute(pipeline).stream().map(mapper).toList();
            log.info("Analytics query completed: {}, {} results", name, results.size());
            return results;
        } catch (DataAccessException | IllegalArgumentException e) {
            log.error("Analytics query failed: {}", name, e);
            return List.of();
        }
    }

    // ========== 型別轉換 ==========

    static String stringOf(Object value) {
        if (value == null || value instanceof String) {
            return (String) value;
        }
        return String.valueOf(value);
    }

    static Document documentOrNull(Object value) {
        return value instanceof Map<?, ?> map ? Documents.toDocument(map) : null;
    }

    static long longOf(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }

    static double doubleOf(Object value) {
        return value instanceof Number number ? number.doubleValue() : 0.0;
    }

    static Double doubleOrNull(Object value) {
        return value instanceof Number number ? number.doubleValue() : null;
    }

    static Integer intOrNull(Object value) {
        return value instanceof Number number ? number.intValue() : null;
    }

    static Instant instantOrNull(Object value) {
        if (value instanceof Date date) {
            return date.toInstant();
        }
        return value instanceof Instant instant ? instant : null;
    }

    static List<String> strings(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream().filter(String.class::isInstance).map(String.class::cast).toList();
    }

    static List<Document> documents(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
            .map(CourseAnalyticsService::documentOrNull)
            .filter(Objects::nonNull)
            .toList();
    }
}
