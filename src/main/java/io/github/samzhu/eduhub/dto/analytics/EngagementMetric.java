package io.github.samzhu.eduhub.dto.analytics;

/**
 * 依選課狀態的參與度。
 *
 * @param status 選課狀態
 * @param count 選課數
 * @param averageProgress 平均進度，沒有進度資料時為 null
 */
public record EngagementMetric(
    String status,
    long count,
    Double averageProgress
) {}
