package io.github.samzhu.eduhub.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * 選課記錄文件。
 *
 * <p>(studentId, courseId) 為唯一複合索引，同一學生不可重複選同一門課。
 * courseId 另有單欄索引，供依課程查詢與 {@code $lookup} 使用。
 */
@Document(collection = "enrollments")
@CompoundIndex(name = "student_course_idx", def = "{'studentId': 1, 'courseId': 1}", unique = true)
public record Enrollment(
    @Id String id,

    @NotBlank(message = "Missing required field: enrollmentId")
    @Indexed(unique = true) String enrollmentId,

    @NotBlank(message = "Missing required field: studentId")
    String studentId,

    @NotBlank(message = "Missing required field: courseId")
    @Indexed String courseId,

    @Indexed Instant enrollmentDate,

    @NotBlank(message = "Missing required field: status")
    @Pattern(regexp = EnrollmentStatus.PATTERN, message = "Status must be 'active', 'completed' or 'dropped'")
    String status,

    @Min(value = 0, message = "Progress must be between 0 and 100")
    @Max(value = 100, message = "Progress must be between 0 and 100")
    int progress,

    /** 完成日期，未完成時為 null */
    Instant completionDate
) {
}
