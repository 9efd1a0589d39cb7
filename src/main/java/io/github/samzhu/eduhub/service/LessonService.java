package io.github.samzhu.eduhub.service;

import java.time.Clock;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import io.github.samzhu.eduhub.document.EntityKind;
import io.github.samzhu.eduhub.document.Lesson;
import io.github.samzhu.eduhub.dto.CreateResult;
import io.github.samzhu.eduhub.repository.LessonRepository;
import io.github.samzhu.eduhub.validation.DocumentValidator;

/**
 * 課程單元服務。
 *
 * <p>新單元的 {@code order} 為該課程目前最大 order + 1，課程沒有單元時為 1。
 */
@Service
public class LessonService {

    private static final Logger log = LoggerFactory.getLogger(LessonService.class);

    static final String ID_PREFIX = "LESSON";

    private final LessonRepository lessonRepository;
    private final DisplayIdService displayIdService;
    private final DocumentValidator validator;
    private final Clock clock;

    public LessonService(
            LessonRepository lessonRepository,
            DisplayIdService displayIdService,
            DocumentValidator validator,
            Clock clock) {
        this.lessonRepository = lessonRepository;
        this.displayIdService = displayIdService;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * 在課程最後新增單元，ID 為 {@code LESSON_nnn}。
     *
     * @param courseId 課程 ID（不檢查是否存在）
     * @param title 標題
     * @param content 內容
     * @param duration 時長（分鐘）
     * @param videoUrl 影片連結，可為 null
     * @param materials 教材清單，可為 null
     * @return 建立結果
     */
    public CreateResult addLessonToCourse(String courseId, String title, String content, int duration,
            String videoUrl, List<String> materials) {
        try {
            String lessonId = displayIdService.nextId(EntityKind.LESSON, ID_PREFIX);
            int order = lessonRepository.findFirstByCourseIdOrderByOrderDesc(courseId)
                .map(last -> last.order() + 1)
                .orElse(1);
            Lesson lesson = new Lesson(
                null,
                lessonId,
                courseId,
                title,
                content,
                duration,
                order,
                videoUrl != null ? videoUrl : "",
                materials != null ? List.copyOf(materials) : List.of(),
                clock.instant()
            );
            List<String> errors = validator.validate(lesson);
            if (!errors.isEmpty()) {
                log.warn("Lesson rejected: courseId={}, errors={}", courseId, errors);
                return CreateResult.invalid(errors);
            }
            lessonRepository.insert(lesson);
            log.info("Lesson added: lessonId={}, courseId={}, order={}", lessonId, courseId, order);
            return CreateResult.created(lessonId);
        } catch (DuplicateKeyException e) {
            log.warn("Duplicate lesson: courseId={}, title={}", courseId, title);
            return CreateResult.duplicateKey(e.getMessage());
        } catch (DataAccessException e) {
            log.error("Failed to add lesson: courseId={}", courseId, e);
            return CreateResult.failed(e.getMessage());
        }
    }

    public List<Lesson> findLessonsForCourse(String courseId) {
        log.debug("Querying lessons: courseId={}", courseId);
        try {
            return lessonRepository.findByCourseIdOrderByOrderAsc(courseId);
        } catch (DataAccessException e) {
            log.error("Failed to query lessons: courseId={}", courseId, e);
            return List.of();
        }
    }

    /**
     * 刪除單元（實體刪除）。其他單元的 order 不會重新編號。
     *
     * @param lessonId 單元 ID
     * @return 刪除的文件數
     */
    public long deleteLessonFromCourse(String lessonId) {
        try {
            long deleted = lessonRepository.deleteByLessonId(lessonId);
            log.info("Lesson deleted: lessonId={}, deleted={}", lessonId, deleted);
            return deleted;
        } catch (DataAccessException e) {
            log.error("Failed to delete lesson: lessonId={}", lessonId, e);
            return 0;
        }
    }
}
