package io.github.samzhu.eduhub.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.eduhub.document.Lesson;

/**
 * 課程單元資料存取介面。
 */
public interface LessonRepository extends MongoRepository<Lesson, String> {

    List<Lesson> findByCourseIdOrderByOrderAsc(String courseId);

    /**
     * 取得課程中 {@code order} 最大的單元，用於計算下一個順序。
     *
     * @param courseId 課程 ID
     * @return 最後一個單元（如存在）
     */
    Optional<Lesson> findFirstByCourseIdOrderByOrderDesc(String courseId);

    long deleteByLessonId(String lessonId);
}
