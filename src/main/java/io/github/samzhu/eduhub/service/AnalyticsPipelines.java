package io.github.samzhu.eduhub.service;

import static io.github.samzhu.eduhub.pipeline.Expr.field;
import static io.github.samzhu.eduhub.pipeline.Expr.literal;
import static io.github.samzhu.eduhub.pipeline.SortStage.SortKey.asc;
import static io.github.samzhu.eduhub.pipeline.SortStage.SortKey.desc;

import io.github.samzhu.eduhub.document.EntityKind;
import io.github.samzhu.eduhub.pipeline.Accumulator;
import io.github.samzhu.eduhub.pipeline.Expr;
import io.github.samzhu.eduhub.pipeline.NamedFields;
import io.github.samzhu.eduhub.pipeline.Pipeline;

/**
 * 統計查詢使用的 aggregation pipelines。
 *
 * <p>join 後的暫存欄位：
 * <ul>
 *   <li>{@code course_enrollments} - 課程的選課記錄陣列</li>
 *   <li>{@code instructor_info} / {@code student_info} - 用戶文件</li>
 *   <li>{@code assignment_info} - 作業文件</li>
 * </ul>
 */
public final class AnalyticsPipelines {

    private static final String USERS = EntityKind.USER.collection();
    private static final String COURSES = EntityKind.COURSE.collection();
    private static final String ASSIGNMENTS = EntityKind.ASSIGNMENT.collection();
    private static final String ENROLLMENTS = EntityKind.ENROLLMENT.collection();
    private static final String SUBMISSIONS = EntityKind.SUBMISSION.collection();

    private static final Expr ENROLLMENT_COUNT = Expr.size(field("course_enrollments"));

    private AnalyticsPipelines() {
    }

    /**
     * 類別選課統計：courses ⨝ enrollments，依 category 分組，依 totalEnrollments 降冪，同數時依 category 升冪。
     */
    public static Pipeline courseEnrollmentStatistics() {
        return Pipeline.from(COURSES)
            .lookup(ENROLLMENTS, "courseId", "courseId", "course_enrollments")
            .group(field("category"), NamedFields
                .of("totalCourses", Accumulator.count())
                .and("totalEnrollments", Accumulator.sum(ENROLLMENT_COUNT))
                .and("averagePrice", Accumulator.avg(field("price")))
                .and("courses", Accumulator.push(Expr.object(NamedFields
                    .of("courseId", field("courseId"))
                    .and("title", field("title"))
                    .and("enrollmentCount", ENROLLMENT_COUNT)
                    .and("price", field("price"))))))
            .sort(desc("totalEnrollments"), asc("_id"))
            .build();
    }

    /**
     * 學生成績表現：submissions ⨝ assignments ⨝ users，依 studentId 分組，依 averageGrade 降冪，同分時依 studentId 升冪。
     *
     * <p>找不到作業或學生的繳交會被 unwind 丟棄。
     */
    public static Pipeline studentPerformance() {
        return Pipeline.from(SUBMISSIONS)
            .lookup(ASSIGNMENTS, "assignmentId", "assignmentId", "assignment_info")
            .unwind("assignment_info")
            .lookup(USERS, "studentId", "userId", "student_info")
            .unwind("student_info")
            .group(field("studentId"), NamedFields
                .of("studentName", Accumulator.first(displayName("student_info")))
                .and("averageGrade", Accumulator.avg(field("grade")))
                .and("totalSubmissions", Accumulator.count())
                .and("coursesParticipated", Accumulator.addToSet(field("assignment_info.courseId"))))
            .addFields(NamedFields.of("coursesCount", Expr.size(field("coursesParticipated"))))
            .sort(desc("averageGrade"), asc("_id"))
            .build();
    }

    /**
     * 講師統計：courses ⨝ users ⨝ enrollments，依 instructorId 分組，依 totalRevenue 降冪，同額時依 instructorId 升冪。
     */
    public static Pipeline instructorAnalytics() {
        Expr revenue = Expr.multiply(field("price"), ENROLLMENT_COUNT);
        return Pipeline.from(COURSES)
            .lookup(USERS, "instructorId", "userId", "instructor_info")
            .unwind("instructor_info")
            .lookup(ENROLLMENTS, "courseId", "courseId", "course_enrollments")
            .group(field("instructorId"), NamedFields
                .of("instructorName", Accumulator.first(displayName("instructor_info")))
                .and("totalCourses", Accumulator.count())
                .and("totalStudents", Accumulator.sum(ENROLLMENT_COUNT))
                .and("totalRevenue", Accumulator.sum(revenue))
                .and("courses", Accumulator.push(Expr.object(NamedFields
                    .of("title", field("title"))
                    .and("enrollments", ENROLLMENT_COUNT)
                    .and("revenue", revenue)))))
            .sort(desc("totalRevenue"), asc("_id"))
            .build();
    }

    /**
     * 每月選課趨勢：依 enrollmentDate 的 (year, month) 分組，依年月升冪。
     */
    public static Pipeline monthlyEnrollmentTrends() {
        return Pipeline.from(ENROLLMENTS)
            .group(Expr.object(NamedFields
                    .of("year", Expr.year(field("enrollmentDate")))
                    .and("month", Expr.month(field("enrollmentDate")))),
                NamedFields
                    .of("enrollmentCount", Accumulator.count())
                    .and("activeEnrollments", Accumulator.sum(Expr.condEq(field("status"), "active", 1, 0)))
                    .and("completedEnrollments", Accumulator.sum(Expr.condEq(field("status"), "completed", 1, 0))))
            .sort(asc("_id.year"), asc("_id.month"))
            .build();
    }

    /**
     * 類別熱門度：courses ⨝ enrollments，依 category 分組，依 totalEnrollments 降冪，同數時依 category 升冪。
     */
    public static Pipeline popularCategories() {
        return Pipeline.from(COURSES)
            .lookup(ENROLLMENTS, "courseId", "courseId", "course_enrollments")
            .group(field("category"), NamedFields
                .of("totalEnrollments", Accumulator.sum(ENROLLMENT_COUNT))
                .and("courseCount", Accumulator.count()))
            .sort(desc("totalEnrollments"), asc("_id"))
            .build();
    }

    /**
     * 參與度：依 status 分組，計算筆數與平均進度。
     */
    public static Pipeline engagementMetrics() {
        return Pipeline.from(ENROLLMENTS)
            .group(field("status"), NamedFields
                .of("count", Accumulator.count())
                .and("averageProgress", Accumulator.avg(field("progress"))))
            .build();
    }

    /**
     * 單一課程與講師公開資料。找不到講師時沒有結果。
     */
    public static Pipeline courseWithInstructor(String courseId) {
        return Pipeline.from(COURSES)
            .match("courseId", courseId)
            .lookup(USERS, "instructorId", "userId", "instructor_info")
            .unwind("instructor_info")
            .project("courseId", "title", "description", "category", "level", "duration", "price", "tags",
                "instructor_info.firstName", "instructor_info.lastName", "instructor_info.email",
                "instructor_info.profile.bio")
            .build();
    }

    /**
     * 單一課程的選課學生。找不到學生的選課記錄會被丟棄。
     */
    public static Pipeline enrolledStudents(String courseId) {
        return Pipeline.from(ENROLLMENTS)
            .match("courseId", courseId)
            .lookup(USERS, "studentId", "userId", "student_info")
            .unwind("student_info")
            .project("enrollmentId", "enrollmentDate", "status", "progress",
                "student_info.firstName", "student_info.lastName", "student_info.email")
            .build();
    }

    private static Expr displayName(String userField) {
        return Expr.concat(field(userField + ".firstName"), literal(" "), field(userField + ".lastName"));
    }
}
