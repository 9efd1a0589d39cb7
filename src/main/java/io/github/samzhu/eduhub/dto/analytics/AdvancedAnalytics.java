package io.github.samzhu.eduhub.dto.analytics;

import java.util.List;

/**
 * 進階統計，三組彼此獨立的結果。
 *
 * @param monthlyTrends 每月選課趨勢（依年月升冪）
 * @param popularCategories 類別熱門度（依選課數降冪）
 * @param engagementMetrics 依狀態的參與度
 */
public record AdvancedAnalytics(
    List<MonthlyEnrollmentTrend> monthlyTrends,
    List<CategoryPopularity> popularCategories,
    List<EngagementMetric> engagementMetrics
) {

    public static AdvancedAnalytics empty() {
        return new AdvancedAnalytics(List.of(), List.of(), List.of());
    }
}
