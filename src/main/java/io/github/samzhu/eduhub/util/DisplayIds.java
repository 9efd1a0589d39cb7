package io.github.samzhu.eduhub.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 顯示用 ID 工具類。
 *
 * <p>格式為 {@code PREFIX_nnn}，數字部分至少三位補零（如 {@code STU_007}），
 * 超過三位時保留原長度（如 {@code STU_1000}）。
 */
public final class DisplayIds {

    private static final Pattern SUFFIX = Pattern.compile("^(.+)_(\\d+)$");

    private DisplayIds() {
        // 工具類不允許實例化
    }

    /**
     * 組合顯示用 ID。
     *
     * @param prefix 前綴，如 {@code STU}
     * @param number 序號（從 1 開始）
     * @return 如 {@code STU_001}
     */
    public static String format(String prefix, long number) {
        return String.format("%s_%03d", prefix, number);
    }

    /**
     * 取得顯示用 ID 的序號。
     *
     * @param displayId 顯示用 ID
     * @param prefix 預期的前綴
     * @return 序號，格式不符或前綴不同時回傳 0
     */
    public static long parseSuffix(String displayId, String prefix) {
        if (displayId == null) {
            return 0;
        }
        Matcher matcher = SUFFIX.matcher(displayId);
        if (!matcher.matches() || !matcher.group(1).equals(prefix)) {
            return 0;
        }
        try {
            return Long.parseLong(matcher.group(2));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * 符合指定前綴的 ID 正規表示式，供資料庫查詢使用。
     */
    public static String patternFor(String prefix) {
        return "^" + Pattern.quote(prefix) + "_\\d+$";
    }
}
