package io.github.samzhu.eduhub.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * 作業文件。
 */
@Document(collection = "assignments")
public record Assignment(
    @Id String id,

    @NotBlank(message = "Missing required field: assignmentId")
    @Indexed(unique = true) String assignmentId,

    @NotBlank(message = "Missing required field: courseId")
    @Indexed String courseId,

    @NotBlank(message = "Missing required field: title")
    String title,

    String description,
    @Indexed Instant dueDate,

    @Positive(message = "Max points must be positive")
    int maxPoints,

    String instructions,
    Instant createdAt
) {
}
