package io.github.samzhu.eduhub.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import com.mongodb.client.result.UpdateResult;

import io.github.samzhu.eduhub.document.Enrollment;
import io.github.samzhu.eduhub.document.EntityKind;
import io.github.samzhu.eduhub.dto.CreateResult;
import io.github.samzhu.eduhub.repository.EnrollmentRepository;

class EnrollmentServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-30T00:00:00Z");

    private EnrollmentRepository enrollmentRepository;
    private MongoTemplate mongoTemplate;
    private DisplayIdService displayIdService;
    private EnrollmentService enrollmentService;

    @BeforeEach
    void setUp() {
        enrollmentRepository = mock(EnrollmentRepository.class);
        mongoTemplate = mock(MongoTemplate.class);
        displayIdService = mock(DisplayIdService.class);
        enrollmentService = new EnrollmentService(enrollmentRepository, mongoTemplate, displayIdService,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldEnrollAsActiveWithZeroProgress() {
        // Given
        when(enrollmentRepository.findByStudentIdAndCourseId("STU_001", "COURSE_001")).thenReturn(Optional.empty());
        when(displayIdService.nextId(EntityKind.ENROLLMENT, "ENROLL")).thenReturn("ENROLL_016");
        ArgumentCaptor<Enrollment> captor = ArgumentCaptor.forClass(Enrollment.class);

        // When
        CreateResult result = enrollmentService.registerStudentForCourse("STU_001", "COURSE_001");

        // Then
        assertThat(result).isEqualTo(CreateResult.created("ENROLL_016"));
        verify(enrollmentRepository).insert(captor.capture());
        assertThat(captor.getValue().status()).isEqualTo("active");
        assertThat(captor.getValue().progress()).isZero();
        assertThat(captor.getValue().enrollmentDate()).isEqualTo(NOW);
        assertThat(captor.getValue().completionDate()).isNull();
    }

    @Test
    void duplicateRegistrationShouldReturnExistingEnrollment() {
        // Given
        Enrollment existing = new Enrollment(null, "ENROLL_003", "STU_001", "COURSE_001", NOW, "active", 40, null);
        when(enrollmentRepository.findByStudentIdAndCourseId("STU_001", "COURSE_001"))
            .thenReturn(Optional.of(existing));

        // When
        CreateResult result = enrollmentService.registerStudentForCourse("STU_001", "COURSE_001");

        // Then
        assertThat(result.status()).isEqualTo(CreateResult.Status.ALREADY_ENROLLED);
        assertThat(result.displayId()).isEqualTo("ENROLL_003");
        verify(enrollmentRepository, never()).insert(any(Enrollment.class));
        verifyNoInteractions(displayIdService);
    }

    @Test
    void concurrentDuplicateShouldReportDuplicateKey() {
        // Given
        when(enrollmentRepository.findByStudentIdAndCourseId("STU_001", "COURSE_001")).thenReturn(Optional.empty());
        when(displayIdService.nextId(EntityKind.ENROLLMENT, "ENROLL")).thenReturn("ENROLL_017");
        when(enrollmentRepository.insert(any(Enrollment.class)))
            .thenThrow(new DuplicateKeyException("E11000 duplicate key error index: studentId_1_courseId_1"));

        // When
        CreateResult result = enrollmentService.registerStudentForCourse("STU_001", "COURSE_001");

        // Then
        assertThat(result.status()).isEqualTo(CreateResult.Status.DUPLICATE_KEY);
    }

    @Test
    void completingShouldSetCompletionDate() {
        // Given
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(Enrollment.class)))
            .thenReturn(UpdateResult.acknowledged(1, 1L, null));
        ArgumentCaptor<Update> captor = ArgumentCaptor.forClass(Update.class);

        // When
        long modified = enrollmentService.updateEnrollmentProgress("ENROLL_001", 100, "completed");

        // Then
        assertThat(modified).isEqualTo(1);
        verify(mongoTemplate).updateFirst(any(Query.class), captor.capture(), eq(Enrollment.class));
        assertThat(captor.getValue().getUpdateObject().get("$set", Document.class))
            .containsEntry("progress", 100)
            .containsEntry("status", "completed")
            .containsKey("completionDate");
    }

    @Test
    void progressOutOfRangeShouldBeRejected() {
        assertThat(enrollmentService.updateEnrollmentProgress("ENROLL_001", 101, null)).isZero();
        assertThat(enrollmentService.updateEnrollmentProgress("ENROLL_001", -1, null)).isZero();
        verifyNoInteractions(mongoTemplate);
    }

    @Test
    void unknownStatusShouldBeRejected() {
        assertThat(enrollmentService.updateEnrollmentProgress("ENROLL_001", 50, "paused")).isZero();
        verifyNoInteractions(mongoTemplate);
    }

    @Test
    void removeShouldReturnDeletedCount() {
        // Given
        when(enrollmentRepository.deleteByEnrollmentId("ENROLL_001")).thenReturn(1L);

        // When & Then
        assertThat(enrollmentService.removeEnrollment("ENROLL_001")).isEqualTo(1);
    }
}
