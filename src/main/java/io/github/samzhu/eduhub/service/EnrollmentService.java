package io.github.samzhu.eduhub.service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import com.mongodb.client.result.UpdateResult;

import io.github.samzhu.eduhub.document.Enrollment;
import io.github.samzhu.eduhub.document.EnrollmentStatus;
import io.github.samzhu.eduhub.document.EntityKind;
import io.github.samzhu.eduhub.dto.CreateResult;
import io.github.samzhu.eduhub.repository.EnrollmentRepository;

/**
 * 選課服務。
 *
 * <p>處理流程：
 * <pre>
 * registerStudentForCourse(studentId, courseId)
 *   ├─ 已有相同 (studentId, courseId) → ALREADY_ENROLLED（不寫入）
 *   └─ 取得 ENROLL_nnn → 寫入 (active, progress 0)
 *        └─ 併發重複選課由唯一複合索引擋下 → DUPLICATE_KEY
 * </pre>
 *
 * <p>不檢查學生與課程是否存在。
 */
@Service
public class EnrollmentService {

    private static final Logger log = LoggerFactory.getLogger(EnrollmentService.class);

    static final String ID_PREFIX = "ENROLL";

    private final EnrollmentRepository enrollmentRepository;
    private final MongoTemplate mongoTemplate;
    private final DisplayIdService displayIdService;
    private final Clock clock;

    public EnrollmentService(
            EnrollmentRepository enrollmentRepository,
            MongoTemplate mongoTemplate,
            DisplayIdService displayIdService,
            Clock clock) {
        this.enrollmentRepository = enrollmentRepository;
        this.mongoTemplate = mongoTemplate;
        this.displayIdService = displayIdService;
        this.clock = clock;
    }

    /**
     * 學生選課。重複選課不是錯誤，回傳既有的選課 ID。
     *
     * @param studentId 學生 ID
     * @param courseId 課程 ID
     * @return 建立結果
     */
    public CreateResult registerStudentForCourse(String studentId, String courseId) {
        try {
            Optional<Enrollment> existing = enrollmentRepository.findByStudentIdAndCourseId(studentId, courseId);
            if (existing.isPresent()) {
                log.info("Student already enrolled: studentId={}, courseId={}, enrollmentId={}",
                    studentId, courseId, existing.get().enrollmentId());
                return CreateResult.alreadyEnrolled(existing.get().enrollmentId());
            }
            String enrollmentId = displayIdService.nextId(EntityKind.ENROLLMENT, ID_PREFIX);
            Enrollment enrollment = new Enrollment(
                null,
                enrollmentId,
                studentId,
                courseId,
                clock.instant(),
                EnrollmentStatus.ACTIVE.value(),
                0,
                null
            );
            enrollmentRepository.insert(enrollment);
            log.info("Student enrolled: enrollmentId={}, studentId={}, courseId={}",
                enrollmentId, studentId, courseId);
            return CreateResult.created(enrollmentId);
        } catch (DuplicateKeyException e) {
            log.warn("Duplicate enrollment: studentId={}, courseId={}", studentId, courseId);
            return CreateResult.duplicateKey(e.getMessage());
        } catch (DataAccessException e) {
            log.error("Failed to enroll student: studentId={}, courseId={}", studentId, courseId, e);
            return CreateResult.failed(e.getMessage());
        }
    }

    public Optional<Enrollment> findEnrollmentById(String enrollmentId) {
        log.debug("Querying enrollment: enrollmentId={}", enrollmentId);
        try {
            return enrollmentRepository.findByEnrollmentId(enrollmentId);
        } catch (DataAccessException e) {
            log.error("Failed to query enrollment: enrollmentId={}", enrollmentId, e);
            return Optional.empty();
        }
    }

    public List<Enrollment> findEnrollmentsForStudent(String studentId) {
        log.debug("Querying enrollments: studentId={}", studentId);
        try {
            return enrollmentRepository.findByStudentId(studentId);
        } catch (DataAccessException e) {
            log.error("Failed to query enrollments: studentId={}", studentId, e);
            return List.of();
        }
    }

    /**
     * 更新學習進度與狀態。
     *
     * <p>狀態改為 {@code completed} 時同時蓋上 {@code completionDate}。
     *
     * @param enrollmentId 選課 ID
     * @param progress 進度 (0-100)
     * @param status 新狀態，null 表示不變更
     * @return 修改的文件數；進度超出範圍或狀態不合法時為 0
     */
    public long updateEnrollmentProgress(String enrollmentId, int progress, String status) {
        if (progress < 0 || progress > 100) {
            log.warn("Progress out of range: enrollmentId={}, progress={}", enrollmentId, progress);
            return 0;
        }
        Update update = new Update().set("progress", progress);
        if (status != null) {
            Optional<EnrollmentStatus> parsed = EnrollmentStatus.fromValue(status);
            if (parsed.isEmpty()) {
                log.warn("Unknown enrollment status: enrollmentId={}, status={}", enrollmentId, status);
                return 0;
            }
            update.set("status", status);
            if (parsed.get() == EnrollmentStatus.COMPLETED) {
                update.set("completionDate", clock.instant());
            }
        }
        try {
            UpdateResult result = mongoTemplate.updateFirst(
                Query.query(Criteria.where("enrollmentId").is(enrollmentId)), update, Enrollment.class);
            log.info("Enrollment progress updated: enrollmentId={}, progress={}, status={}, modified={}",
                enrollmentId, progress, status, result.getModifiedCount());
            return result.getModifiedCount();
        } catch (DataAccessException e) {
            log.error("Failed to update enrollment: enrollmentId={}", enrollmentId, e);
            return 0;
        }
    }

    /**
     * 刪除選課記錄（實體刪除）。
     *
     * @param enrollmentId 選課 ID
     * @return 刪除的文件數
     */
    public long removeEnrollment(String enrollmentId) {
        try {
            long deleted = enrollmentRepository.deleteByEnrollmentId(enrollmentId);
            log.info("Enrollment removed: enrollmentId={}, deleted={}", enrollmentId, deleted);
            return deleted;
        } catch (DataAccessException e) {
            log.error("Failed to remove enrollment: enrollmentId={}", enrollmentId, e);
            return 0;
        }
    }
}
