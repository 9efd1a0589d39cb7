package io.github.samzhu.eduhub.dto.analytics;

import java.util.List;

/**
 * 類別選課統計。
 *
 * @param category 類別，課程沒有類別時為 null
 * @param totalCourses 課程數
 * @param totalEnrollments 總選課數（各課程選課數加總）
 * @param averagePrice 平均價格，沒有價格資料時為 null
 * @param courses 各課程明細
 */
public record CategoryEnrollmentStats(
    String category,
    long totalCourses,
    long totalEnrollments,
    Double averagePrice,
    List<CourseEnrollment> courses
) {

    /**
     * 單一課程的選課數。
     */
    public record CourseEnrollment(
        String courseId,
        String title,
        long enrollmentCount,
        Double price
    ) {}
}
