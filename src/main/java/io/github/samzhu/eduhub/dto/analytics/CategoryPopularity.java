package io.github.samzhu.eduhub.dto.analytics;

/**
 * 類別熱門度。
 */
public record CategoryPopularity(
    String category,
    long totalEnrollments,
    long courseCount
) {}
