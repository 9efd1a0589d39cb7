package io.github.samzhu.eduhub.dto.analytics;

/**
 * 每月選課趨勢，年月依 UTC 計算。
 *
 * @param year 年，選課日期缺少時為 null
 * @param month 月 (1-12)，選課日期缺少時為 null
 * @param enrollmentCount 選課數
 * @param activeEnrollments 狀態為 active 的選課數
 * @param completedEnrollments 狀態為 completed 的選課數
 */
public record MonthlyEnrollmentTrend(
    Integer year,
    Integer month,
    long enrollmentCount,
    long activeEnrollments,
    long completedEnrollments
) {}
