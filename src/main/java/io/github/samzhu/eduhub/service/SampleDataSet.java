package io.github.samzhu.eduhub.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.github.samzhu.eduhub.document.Assignment;
import io.github.samzhu.eduhub.document.Course;
import io.github.samzhu.eduhub.document.Enrollment;
import io.github.samzhu.eduhub.document.EntityKind;
import io.github.samzhu.eduhub.document.Lesson;
import io.github.samzhu.eduhub.document.Submission;
import io.github.samzhu.eduhub.document.User;

/**
 * 一組具參照一致性的範例資料。
 */
public record SampleDataSet(
    List<User> users,
    List<Course> courses,
    List<Lesson> lessons,
    List<Assignment> assignments,
    List<Enrollment> enrollments,
    List<Submission> submissions
) {

    /**
     * 各集合筆數，依 {@link EntityKind} 宣告順序。
     */
    public Map<String, Integer> counts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put(EntityKind.USER.collection(), users.size());
        counts.put(EntityKind.COURSE.collection(), courses.size());
        counts.put(EntityKind.LESSON.collection(), lessons.size());
        counts.put(EntityKind.ASSIGNMENT.collection(), assignments.size());
        counts.put(EntityKind.ENROLLMENT.collection(), enrollments.size());
        counts.put(EntityKind.SUBMISSION.collection(), submissions.size());
        return counts;
    }
}
