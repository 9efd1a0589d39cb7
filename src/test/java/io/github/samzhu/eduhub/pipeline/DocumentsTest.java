package io.github.samzhu.eduhub.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bson.Document;
import org.junit.jupiter.api.Test;

class DocumentsTest {

    @Test
    void shouldResolveNestedPath() {
        // Given
        Document document = new Document("instructor_info",
            new Document("profile", new Document("bio", "Teaches Java")));

        // When & Then
        assertThat(Documents.resolve(document, "instructor_info.profile.bio")).isEqualTo("Teaches Java");
        assertThat(Documents.resolve(document, "instructor_info.email")).isNull();
        assertThat(Documents.contains(document, "instructor_info.profile")).isTrue();
        assertThat(Documents.contains(document, "instructor_info.email")).isFalse();
    }

    @Test
    void shouldCollectValuesThroughArrays() {
        // Given
        Document document = new Document("course_enrollments", List.of(
            new Document("studentId", "STU_001"),
            new Document("studentId", "STU_002")));

        // When
        Object values = Documents.resolve(document, "course_enrollments.studentId");

        // Then
        assertThat(values).isEqualTo(List.of("STU_001", "STU_002"));
    }

    @Test
    void withShouldNotModifyOriginal() {
        // Given
        Document original = new Document("a", new Document("b", 1));

        // When
        Document updated = Documents.with(original, "a.c", 2);

        // Then
        assertThat(updated.get("a", Document.class)).containsEntry("b", 1).containsEntry("c", 2);
        assertThat(original.get("a", Document.class)).doesNotContainKey("c");
    }

    @Test
    void shouldTreatIntegerAndDoubleAsEqual() {
        assertThat(Documents.valuesEqual(1, 1.0)).isTrue();
        assertThat(Documents.valuesEqual(1L, 2)).isFalse();
        assertThat(Documents.normalizeKey(3)).isEqualTo(Documents.normalizeKey(3L));
    }

    @Test
    void shouldTreatInstantAndDateAsEqual() {
        // Given
        Instant instant = Instant.parse("2025-03-01T10:00:00Z");

        // When & Then
        assertThat(Documents.valuesEqual(instant, Date.from(instant))).isTrue();
        assertThat(Documents.normalizeKey(instant)).isEqualTo(Date.from(instant));
    }

    @Test
    void shouldOrderNullBelowNumbersAndNumbersBelowStrings() {
        assertThat(Documents.compare(null, 0)).isNegative();
        assertThat(Documents.compare(5, "a")).isNegative();
        assertThat(Documents.compare(2.5, 2)).isPositive();
        assertThat(Documents.compare(null, null)).isZero();
    }

    @Test
    void plainMapsShouldBehaveLikeDocuments() {
        // Given
        Map<Object, Object> profile = new LinkedHashMap<>();
        profile.put("bio", "Java mentor");
        profile.put(1, "numeric key");
        Map<String, Object> user = Map.of("userId", "INST_001", "profile", profile);

        // When
        Document converted = Documents.toDocument(profile);

        // Then
        assertThat(Documents.resolve(user, "profile.bio")).isEqualTo("Java mentor");
        assertThat(Documents.contains(user, "profile.avatar")).isFalse();
        assertThat(converted).containsEntry("1", "numeric key").containsEntry("bio", "Java mentor");
        assertThat(Documents.compare(profile, new Document("bio", "Java mentor").append("1", "numeric key")))
            .isZero();
        assertThat(Documents.compare(Map.of("a", 1), Map.of("b", 1))).isNegative();
    }
}
