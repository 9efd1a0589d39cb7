package io.github.samzhu.eduhub.dto.api;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;

import io.github.samzhu.eduhub.document.CourseLevel;

/**
 * 課程部分更新請求，null 欄位表示不變更。
 *
 * @param title 標題
 * @param description 描述
 * @param category 類別
 * @param level 難度
 * @param duration 時數
 * @param price 價格
 */
public record CourseUpdate(
    String title,
    String description,
    String category,

    @Pattern(regexp = CourseLevel.PATTERN, message = "Level must be 'beginner', 'intermediate' or 'advanced'")
    String level,

    @PositiveOrZero(message = "Duration must be positive or zero")
    Integer duration,

    @PositiveOrZero(message = "Price must be positive or zero")
    Double price
) {
}
