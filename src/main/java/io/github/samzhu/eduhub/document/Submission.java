package io.github.samzhu.eduhub.document;

import java.time.Instant;
import java.util.List;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * 作業繳交文件。
 *
 * <p>{@code grade}、{@code feedback}、{@code gradedDate} 在評分前皆為 null。
 * 統計平均分數時，未評分的繳交不計入分子與分母。
 */
@Document(collection = "submissions")
@CompoundIndex(name = "student_assignment_idx", def = "{'studentId': 1, 'assignmentId': 1}")
public record Submission(
    @Id String id,

    @NotBlank(message = "Missing required field: submissionId")
    @Indexed(unique = true) String submissionId,

    @NotBlank(message = "Missing required field: assignmentId")
    String assignmentId,

    @NotBlank(message = "Missing required field: studentId")
    String studentId,

    Instant submissionDate,
    String content,
    List<String> attachments,

    @Min(value = 0, message = "Grade must be between 0 and 100")
    @Max(value = 100, message = "Grade must be between 0 and 100")
    Integer grade,

    String feedback,
    Instant gradedDate
) {
}
