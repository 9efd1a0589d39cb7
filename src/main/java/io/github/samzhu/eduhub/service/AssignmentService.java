package io.github.samzhu.eduhub.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import io.github.samzhu.eduhub.document.Assignment;
import io.github.samzhu.eduhub.document.EntityKind;
import io.github.samzhu.eduhub.document.Submission;
import io.github.samzhu.eduhub.dto.CreateResult;
import io.github.samzhu.eduhub.repository.AssignmentRepository;
import io.github.samzhu.eduhub.repository.SubmissionRepository;
import io.github.samzhu.eduhub.util.PeriodUtils;
import io.github.samzhu.eduhub.validation.DocumentValidator;

/**
 * 作業與繳交服務：建立作業、繳交、評分與到期查詢。
 */
@Service
public class AssignmentService {

    private static final Logger log = LoggerFactory.getLogger(AssignmentService.class);

    static final String ASSIGNMENT_PREFIX = "ASSIGN";
    static final String SUBMISSION_PREFIX = "SUB";
    static final int DUE_WINDOW_DAYS = 7;

    private final AssignmentRepository assignmentRepository;
    private final SubmissionRepository submissionRepository;
    private final DisplayIdService displayIdService;
    private final DocumentValidator validator;
    private final Clock clock;

    public AssignmentService(
            AssignmentRepository assignmentRepository,
            SubmissionRepository submissionRepository,
            DisplayIdService displayIdService,
            DocumentValidator validator,
            Clock clock) {
        this.assignmentRepository = assignmentRepository;
        this.submissionRepository = submissionRepository;
        this.displayIdService = displayIdService;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * 建立作業，ID 為 {@code ASSIGN_nnn}。
     *
     * @return 建立結果
     */
    public CreateResult createAssignment(String courseId, String title, String description,
            Instant dueDate, int maxPoints, String instructions) {
        try {
            String assignmentId = displayIdService.nextId(EntityKind.ASSIGNMENT, ASSIGNMENT_PREFIX);
            Assignment assignment = new Assignment(
                null, assignmentId, courseId, title, description, dueDate, maxPoints, instructions, clock.instant());
            List<String> errors = validator.validate(assignment);
            if (!errors.isEmpty()) {
                log.warn("Assignment rejected: courseId={}, errors={}", courseId, errors);
                return CreateResult.invalid(errors);
            }
            assignmentRepository.insert(assignment);
            log.info("Assignment created: assignmentId={}, courseId={}, dueDate={}", assignmentId, courseId, dueDate);
            return CreateResult.created(assignmentId);
        } catch (DuplicateKeyException e) {
            log.warn("Duplicate assignment: courseId={}, title={}", courseId, title);
            return CreateResult.duplicateKey(e.getMessage());
        } catch (DataAccessException e) {
            log.error("Failed to create assignment: courseId={}", courseId, e);
            return CreateResult.failed(e.getMessage());
        }
    }

    /**
     * 繳交作業（未評分），ID 為 {@code SUB_nnn}。
     *
     * @return 建立結果
     */
    public CreateResult submitAssignment(String assignmentId, String studentId, String content,
            List<String> attachments) {
        try {
            String submissionId = displayIdService.nextId(EntityKind.SUBMISSION, SUBMISSION_PREFIX);
            Submission submission = new Submission(
                null,
                submissionId,
                assignmentId,
                studentId,
                clock.instant(),
                content,
                attachments != null ? List.copyOf(attachments) : List.of(),
                null,
                null,
                null
            );
            List<String> errors = validator.validate(submission);
            if (!errors.isEmpty()) {
                log.warn("Submission rejected: assignmentId={}, errors={}", assignmentId, errors);
                return CreateResult.invalid(errors);
            }
            submissionRepository.insert(submission);
            log.info("Assignment submitted: submissionId={}, assignmentId={}, studentId={}",
                submissionId, assignmentId, studentId);
            return CreateResult.created(submissionId);
        } catch (DuplicateKeyException e) {
            log.warn("Duplicate submission: assignmentId={}, studentId={}", assignmentId, studentId);
            return CreateResult.duplicateKey(e.getMessage());
        } catch (DataAccessException e) {
            log.error("Failed to submit assignment: assignmentId={}", assignmentId, e);
            return CreateResult.failed(e.getMessage());
        }
    }

    public Optional<Submission> findSubmissionById(String submissionId) {
        log.debug("Querying submission: submissionId={}", submissionId);
        try {
            return submissionRepository.findBySubmissionId(submissionId);
        } catch (DataAccessException e) {
            log.error("Failed to query submission: submissionId={}", submissionId, e);
            return Optional.empty();
        }
    }

    /**
     * 查詢未來 7 天內（含）到期的作業。
     *
     * @return 作業清單
     */
    public List<Assignment> getAssignmentsDueNextWeek() {
        PeriodUtils.Window window = PeriodUtils.nextDays(clock, DUE_WINDOW_DAYS);
        log.debug("Querying assignments due between {} and {}", window.from(), window.to());
        try {
            return assignmentRepository.findDueBetween(window.from(), window.to());
        } catch (DataAccessException e) {
            log.error("Failed to query due assignments", e);
            return List.of();
        }
    }

    /**
     * 評分。評語為空白時不變更既有評語。
     *
     * @param submissionId 繳交 ID
     * @param grade 分數 (0-100)
     * @param feedback 評語，可為 null
     * @return 修改的文件數；分數超出範圍時為 0
     */
    public long updateAssignmentGrade(String submissionId, int grade, String feedback) {
        if (grade < 0 || grade > 100) {
            log.warn("Grade out of range: submissionId={}, grade={}", submissionId, grade);
            return 0;
        }
        Instant now = clock.instant();
        try {
            long modified = feedback != null && !feedback.isBlank()
                ? submissionRepository.updateGradeAndFeedbackBySubmissionId(submissionId, grade, feedback, now)
                : submissionRepository.updateGradeBySubmissionId(submissionId, grade, now);
            log.info("Grade updated: submissionId={}, grade={}, modified={}", submissionId, grade, modified);
            return modified;
        } catch (DataAccessException e) {
            log.error("Failed to update grade: submissionId={}", submissionId, e);
            return 0;
        }
    }
}
