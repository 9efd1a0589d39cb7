package io.github.samzhu.eduhub.validation;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.eduhub.document.Course;
import io.github.samzhu.eduhub.document.User;
import jakarta.validation.Validation;

class DocumentValidatorTest {

    private DocumentValidator validator;

    @BeforeEach
    void setUp() {
        validator = new DocumentValidator(Validation.buildDefaultValidatorFactory().getValidator());
    }

    @Test
    void validUserShouldPass() {
        // Given
        User user = user("STU_001", "jane.doe@example.org", "student");

        // When & Then
        assertThat(validator.validate(user)).isEmpty();
    }

    @Test
    void shouldReportInvalidEmailAndRole() {
        // Given
        User user = user("STU_001", "not-an-email", "admin");

        // When
        List<String> messages = validator.validate(user);

        // Then
        assertThat(messages).hasSize(2).contains("Invalid email format").isSorted();
    }

    @Test
    void shouldReportMissingRequiredFields() {
        // Given
        User user = new User(null, null, "jane@example.org", " ", "Doe", "student",
            Instant.now(), null, true);

        // When
        List<String> messages = validator.validate(user);

        // Then
        assertThat(messages).containsExactly("Missing required field: firstName", "Missing required field: userId");
    }

    @Test
    void shouldRejectNegativeCoursePrice() {
        // Given
        Course course = new Course(null, "COURSE_001", "Java", "desc", "INST_001", "Programming",
            "beginner", 40, -1.0, List.of(), Instant.now(), Instant.now(), false);

        // When & Then
        assertThat(validator.validate(course)).hasSize(1);
    }

    private static User user(String userId, String email, String role) {
        return new User(null, userId, email, "Jane", "Doe", role, Instant.now(),
            new User.Profile("bio", "https://avatars.example.com/student_1.png", List.of("Java")), true);
    }
}
