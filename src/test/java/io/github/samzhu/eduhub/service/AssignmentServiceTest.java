package io.github.samzhu.eduhub.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import io.github.samzhu.eduhub.document.EntityKind;
import io.github.samzhu.eduhub.document.Submission;
import io.github.samzhu.eduhub.dto.CreateResult;
import io.github.samzhu.eduhub.repository.AssignmentRepository;
import io.github.samzhu.eduhub.repository.SubmissionRepository;
import io.github.samzhu.eduhub.validation.DocumentValidator;
import jakarta.validation.Validation;

class AssignmentServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-30T00:00:00Z");

    private AssignmentRepository assignmentRepository;
    private SubmissionRepository submissionRepository;
    private DisplayIdService displayIdService;
    private AssignmentService assignmentService;

    @BeforeEach
    void setUp() {
        assignmentRepository = mock(AssignmentRepository.class);
        submissionRepository = mock(SubmissionRepository.class);
        displayIdService = mock(DisplayIdService.class);
        DocumentValidator validator = new DocumentValidator(Validation.buildDefaultValidatorFactory().getValidator());
        assignmentService = new AssignmentService(assignmentRepository, submissionRepository, displayIdService,
            validator, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void submissionShouldStartUngraded() {
        // Given
        when(displayIdService.nextId(EntityKind.SUBMISSION, "SUB")).thenReturn("SUB_013");
        ArgumentCaptor<Submission> captor = ArgumentCaptor.forClass(Submission.class);

        // When
        CreateResult result = assignmentService.submitAssignment("ASSIGN_001", "STU_001", "My answer",
            List.of("answer.pdf"));

        // Then
        assertThat(result.displayId()).isEqualTo("SUB_013");
        verify(submissionRepository).insert(captor.capture());
        assertThat(captor.getValue().grade()).isNull();
        assertThat(captor.getValue().gradedDate()).isNull();
        assertThat(captor.getValue().submissionDate()).isEqualTo(NOW);
    }

    @Test
    void gradeOutOfRangeShouldBeRejected() {
        assertThat(assignmentService.updateAssignmentGrade("SUB_001", 101, "Great")).isZero();
        assertThat(assignmentService.updateAssignmentGrade("SUB_001", -1, null)).isZero();
        verifyNoInteractions(submissionRepository);
    }

    @Test
    void gradeWithFeedbackShouldStoreBoth() {
        // Given
        when(submissionRepository.updateGradeAndFeedbackBySubmissionId("SUB_001", 92, "Great work", NOW))
            .thenReturn(1L);

        // When
        long modified = assignmentService.updateAssignmentGrade("SUB_001", 92, "Great work");

        // Then
        assertThat(modified).isEqualTo(1);
        verify(submissionRepository, never()).updateGradeBySubmissionId(anyString(), anyInt(), any());
    }

    @Test
    void gradeWithoutFeedbackShouldKeepExistingFeedback() {
        // Given
        when(submissionRepository.updateGradeBySubmissionId("SUB_001", 75, NOW)).thenReturn(1L);

        // When
        long modified = assignmentService.updateAssignmentGrade("SUB_001", 75, " ");

        // Then
        assertThat(modified).isEqualTo(1);
        verify(submissionRepository, never())
            .updateGradeAndFeedbackBySubmissionId(anyString(), anyInt(), anyString(), any());
    }

    @Test
    void dueNextWeekShouldQueryFromNowToSevenDaysAhead() {
        // When
        assignmentService.getAssignmentsDueNextWeek();

        // Then
        verify(assignmentRepository).findDueBetween(NOW, Instant.parse("2025-07-07T00:00:00Z"));
    }
}
