package io.github.samzhu.eduhub.dto.analytics;

import java.time.Instant;

/**
 * 課程中的選課學生。
 */
public record EnrolledStudent(
    String enrollmentId,
    Instant enrollmentDate,
    String status,
    Integer progress,
    StudentInfo student
) {

    public record StudentInfo(
        String firstName,
        String lastName,
        String email
    ) {}
}
