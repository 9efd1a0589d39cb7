package io.github.samzhu.eduhub.document;

import java.time.Instant;
import java.util.List;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.index.TextIndexed;
import org.springframework.data.mongodb.core.mapping.Document;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 課程文件。
 *
 * <p>{@code instructorId} 參照 {@link User#userId()}（角色須為講師，但不由資料庫強制）。
 * {@code title} 與 {@code description} 建立全文索引，供關鍵字搜尋。
 * 任何課程更新都會蓋上 {@code updatedAt}。
 */
@Document(collection = "courses")
public record Course(
    @Id String id,

    @NotBlank(message = "Missing required field: courseId")
    @Indexed(unique = true) String courseId,

    @NotBlank(message = "Missing required field: title")
    @Indexed @TextIndexed String title,

    @TextIndexed String description,

    @NotBlank(message = "Missing required field: instructorId")
    @Indexed String instructorId,

    @Indexed String category,

    @Pattern(regexp = CourseLevel.PATTERN, message = "Level must be 'beginner', 'intermediate' or 'advanced'")
    String level,

    @PositiveOrZero(message = "Duration must be positive or zero")
    int duration,

    @PositiveOrZero(message = "Price must be positive or zero")
    double price,

    List<String> tags,
    Instant createdAt,
    Instant updatedAt,
    boolean isPublished
) {
}
