package io.github.samzhu.eduhub.dto.analytics;

import java.util.List;

/**
 * 講師統計。
 *
 * @param instructorId 講師 ID
 * @param instructorName 顯示名稱
 * @param totalCourses 開課數
 * @param totalStudents 總選課數
 * @param totalRevenue 總營收（各課程 價格 × 選課數 加總）
 * @param courses 各課程明細
 */
public record InstructorAnalytics(
    String instructorId,
    String instructorName,
    long totalCourses,
    long totalStudents,
    double totalRevenue,
    List<CourseRevenue> courses
) {

    public record CourseRevenue(
        String title,
        long enrollments,
        double revenue
    ) {}
}
