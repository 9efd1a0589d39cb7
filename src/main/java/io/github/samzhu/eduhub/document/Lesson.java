package io.github.samzhu.eduhub.document;

import java.time.Instant;
import java.util.List;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * 課程單元文件。
 *
 * <p>{@code order} 在同一課程內唯一，依新增順序遞增（從 1 開始）。
 */
@Document(collection = "lessons")
public record Lesson(
    @Id String id,

    @NotBlank(message = "Missing required field: lessonId")
    @Indexed(unique = true) String lessonId,

    @NotBlank(message = "Missing required field: courseId")
    @Indexed String courseId,

    @NotBlank(message = "Missing required field: title")
    String title,

    String content,
    int duration,

    @Positive(message = "Order must be positive")
    int order,

    String videoUrl,
    List<String> materials,
    Instant createdAt
) {
}
