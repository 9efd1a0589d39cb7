package io.github.samzhu.eduhub.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import com.mongodb.client.result.UpdateResult;

import io.github.samzhu.eduhub.document.EntityKind;
import io.github.samzhu.eduhub.document.User;
import io.github.samzhu.eduhub.dto.CreateResult;
import io.github.samzhu.eduhub.repository.UserRepository;
import io.github.samzhu.eduhub.validation.DocumentValidator;
import jakarta.validation.Validation;

class UserServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-30T00:00:00Z");

    private UserRepository userRepository;
    private MongoTemplate mongoTemplate;
    private DisplayIdService displayIdService;
    private UserService userService;

    @BeforeEach
    void setUp() {
        userRepository = mock(UserRepository.class);
        mongoTemplate = mock(MongoTemplate.class);
        displayIdService = mock(DisplayIdService.class);
        DocumentValidator validator = new DocumentValidator(Validation.buildDefaultValidatorFactory().getValidator());
        userService = new UserService(userRepository, mongoTemplate, displayIdService, validator,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldRegisterStudentWithNextDisplayId() {
        // Given
        when(displayIdService.nextId(EntityKind.USER, "STU")).thenReturn("STU_021");
        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);

        // When
        CreateResult result = userService.registerNewStudent("new.student@example.org", "New", "Student",
            "Learning Java", List.of("Java"));

        // Then
        assertThat(result.isCreated()).isTrue();
        assertThat(result.displayId()).isEqualTo("STU_021");
        verify(userRepository).insert(captor.capture());
        User saved = captor.getValue();
        assertThat(saved.role()).isEqualTo("student");
        assertThat(saved.isActive()).isTrue();
        assertThat(saved.dateJoined()).isEqualTo(NOW);
        assertThat(saved.profile().avatar()).isEqualTo("https://avatars.example.com/student_21.png");
    }

    @Test
    void shouldRegisterInstructorWithInstructorPrefix() {
        // Given
        when(displayIdService.nextId(EntityKind.USER, "INST")).thenReturn("INST_006");

        // When
        CreateResult result = userService.registerNewInstructor("new.inst@example.org", "New", "Instructor",
            "Teaches data science", null);

        // Then
        assertThat(result.displayId()).isEqualTo("INST_006");
    }

    @Test
    void invalidEmailShouldBeRejectedWithoutInsert() {
        // Given
        when(displayIdService.nextId(EntityKind.USER, "STU")).thenReturn("STU_001");

        // When
        CreateResult result = userService.registerNewStudent("invalid-email", "Bad", "Email", "bio", List.of());

        // Then
        assertThat(result.status()).isEqualTo(CreateResult.Status.INVALID);
        assertThat(result.messages()).containsExactly("Invalid email format");
        verify(userRepository, never()).insert(any(User.class));
    }

    @Test
    void duplicateEmailShouldReportDuplicateKey() {
        // Given
        when(displayIdService.nextId(EntityKind.USER, "STU")).thenReturn("STU_002");
        when(userRepository.insert(any(User.class)))
            .thenThrow(new DuplicateKeyException("E11000 duplicate key error index: email_1"));

        // When
        CreateResult result = userService.registerNewStudent("taken@example.org", "Dup", "User", "bio", null);

        // Then
        assertThat(result.status()).isEqualTo(CreateResult.Status.DUPLICATE_KEY);
        assertThat(result.messages()).singleElement().asString().contains("E11000");
    }

    @Test
    void idAllocationFailureShouldReportFailed() {
        // Given
        when(displayIdService.nextId(EntityKind.USER, "STU"))
            .thenThrow(new DataAccessResourceFailureException("timeout"));

        // When
        CreateResult result = userService.registerNewStudent("a@example.org", "A", "B", "bio", null);

        // Then
        assertThat(result.status()).isEqualTo(CreateResult.Status.FAILED);
        verifyNoInteractions(userRepository);
    }

    @Test
    void deactivatedUserShouldStillBeRetrievable() {
        // Given
        User inactive = new User(null, "STU_003", "c@example.org", "C", "D", "student", NOW, null, false);
        when(userRepository.deactivateByUserId("STU_003")).thenReturn(1L);
        when(userRepository.findByUserId("STU_003")).thenReturn(Optional.of(inactive));

        // When
        long modified = userService.deactivateUser("STU_003");
        Optional<User> found = userService.findUserById("STU_003");

        // Then
        assertThat(modified).isEqualTo(1);
        assertThat(found).hasValueSatisfying(user -> assertThat(user.isActive()).isFalse());
    }

    @Test
    void profileUpdateShouldOnlySetProvidedFields() {
        // Given
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(User.class)))
            .thenReturn(UpdateResult.acknowledged(1, 1L, null));
        ArgumentCaptor<Update> captor = ArgumentCaptor.forClass(Update.class);

        // When
        long modified = userService.updateUserProfile("STU_001", "New bio", null, null);

        // Then
        assertThat(modified).isEqualTo(1);
        verify(mongoTemplate).updateFirst(any(Query.class), captor.capture(), eq(User.class));
        assertThat(captor.getValue().getUpdateObject().get("$set", Document.class))
            .containsOnlyKeys("profile.bio");
    }

    @Test
    void profileUpdateWithoutFieldsShouldNotWrite() {
        // When
        long modified = userService.updateUserProfile("STU_001", null, null, null);

        // Then
        assertThat(modified).isZero();
        verifyNoInteractions(mongoTemplate);
    }

    @Test
    void recentUsersShouldUseSixMonthCutoffByDefault() {
        // Given
        when(userRepository.findByDateJoinedGreaterThanEqual(any())).thenReturn(List.of());

        // When
        userService.getUsersJoinedRecently();

        // Then
        verify(userRepository).findByDateJoinedGreaterThanEqual(Instant.parse("2025-01-01T00:00:00Z"));
    }

    @Test
    void queryFailureShouldReturnEmptyList() {
        // Given
        when(userRepository.findActiveByRole(anyString()))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // When & Then
        assertThat(userService.findAllActiveStudents()).isEmpty();
    }
}
