package io.github.samzhu.eduhub.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 查詢時間區間工具類。
 *
 * <p>所有計算以注入的 {@link Clock} 為準，一個月固定視為 30 天。
 */
public final class PeriodUtils {

    /** 一個月的天數 */
    public static final int DAYS_PER_MONTH = 30;

    private PeriodUtils() {
        // 工具類不允許實例化
    }

    /**
     * 取得「最近 N 個月」的起始時間。
     *
     * @param clock 時鐘
     * @param monthsBack 月數
     * @return 當前時間減去 30 × monthsBack 天
     */
    public static Instant monthsAgo(Clock clock, int monthsBack) {
        return clock.instant().minus(Duration.ofDays((long) DAYS_PER_MONTH * monthsBack));
    }

    /**
     * 取得從現在起算的 N 天區間。
     *
     * @param clock 時鐘
     * @param days 天數
     * @return [現在, 現在 + days 天]
     */
    public static Window nextDays(Clock clock, int days) {
        Instant now = clock.instant();
        return new Window(now, now.plus(Duration.ofDays(days)));
    }

    /**
     * 時間區間，上下限皆包含。
     */
    public record Window(Instant from, Instant to) {}
}
