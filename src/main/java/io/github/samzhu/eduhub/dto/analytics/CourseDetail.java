package io.github.samzhu.eduhub.dto.analytics;

import java.util.List;

/**
 * 課程與講師公開資料。
 */
public record CourseDetail(
    String courseId,
    String title,
    String description,
    String category,
    String level,
    Integer duration,
    Double price,
    List<String> tags,
    InstructorInfo instructor
) {

    public record InstructorInfo(
        String firstName,
        String lastName,
        String email,
        String bio
    ) {}
}
