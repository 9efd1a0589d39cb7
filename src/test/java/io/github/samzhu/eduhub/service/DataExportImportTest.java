package io.github.samzhu.eduhub.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.eduhub.dto.analytics.EngagementMetric;
import io.github.samzhu.eduhub.pipeline.InMemoryPipelineExecutor;

class DataExportImportTest {

    private static final Instant ENROLLED = Instant.parse("2025-01-15T08:30:00Z");

    @TempDir
    Path tempDir;

    private DataExportService exportService;
    private DataImportService importService;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        exportService = new DataExportService(null, objectMapper);
        importService = new DataImportService(objectMapper);
    }

    @Test
    void shouldWriteObjectIdsAndDatesAsStrings() throws IOException {
        // Given
        ObjectId id = new ObjectId();
        Path file = tempDir.resolve("export/sample_data.json");

        // When
        Map<String, Integer> counts = exportService.writeSnapshot(
            Map.of("enrollments", List.of(enrollment(id, "active", 40))), file);

        // Then
        assertThat(counts).containsEntry("enrollments", 1);
        String json = Files.readString(file);
        assertThat(json).contains("\"" + id.toHexString() + "\"").contains("\"2025-01-15T08:30:00Z\"");
    }

    @Test
    void importedSnapshotShouldRestoreDatesAndSupportAnalytics() {
        // Given
        Path file = tempDir.resolve("sample_data.json");
        Map<String, List<Document>> snapshot = new LinkedHashMap<>();
        snapshot.put("enrollments", List.of(
            enrollment(new ObjectId(), "active", 20),
            enrollment(new ObjectId(), "active", 60)));
        exportService.writeSnapshot(snapshot, file);

        // When
        Map<String, List<Document>> imported = importService.readSnapshot(file);

        // Then
        Document first = imported.get("enrollments").get(0);
        assertThat(first.get("enrollmentDate")).isEqualTo(Date.from(ENROLLED));
        assertThat(first.get("completionDate")).isNull();
        assertThat(first.get("_id")).isInstanceOf(String.class);

        CourseAnalyticsService analytics = new CourseAnalyticsService(new InMemoryPipelineExecutor(imported));
        assertThat(analytics.getAdvancedAnalytics().engagementMetrics())
            .containsExactly(new EngagementMetric("active", 2, 40.0));
        assertThat(analytics.getAdvancedAnalytics().monthlyTrends()).singleElement()
            .satisfies(trend -> assertThat(trend.month()).isEqualTo(1));
    }

    @Test
    void everyFieldValueShouldSurviveExportAndImport() {
        // Given
        Path file = tempDir.resolve("full_snapshot.json");
        Document user = new Document("_id", new ObjectId())
            .append("userId", "STU_001")
            .append("email", "jane.doe@example.com")
            .append("firstName", "Jane")
            .append("lastName", "Doe")
            .append("role", "student")
            .append("dateJoined", Date.from(Instant.parse("2024-11-02T10:15:30Z")))
            .append("profile", Map.of(
                "bio", "Backend developer",
                "avatar", "https://avatars.example.com/student_1.png",
                "skills", List.of("Java", "MongoDB")))
            .append("isActive", true);
        Document course = new Document("_id", new ObjectId())
            .append("courseId", "COURSE_001")
            .append("title", "Data Modeling")
            .append("instructorId", "INST_001")
            .append("category", "Data Science")
            .append("level", "intermediate")
            .append("duration", 40)
            .append("price", 149.99)
            .append("tags", List.of("nosql", "schema"))
            .append("createdAt", Date.from(Instant.parse("2024-12-01T00:00:00Z")))
            .append("updatedAt", Date.from(Instant.parse("2025-02-01T12:00:00Z")))
            .append("isPublished", false);
        Document submission = new Document("_id", new ObjectId())
            .append("submissionId", "SUB_001")
            .append("assignmentId", "ASSIGN_001")
            .append("studentId", "STU_001")
            .append("submissionDate", Date.from(ENROLLED))
            .append("attachments", List.of("submission_1.pdf", "source_code_1.py"))
            .append("grade", null)
            .append("feedback", null)
            .append("gradedDate", null);
        Map<String, List<Document>> snapshot = new LinkedHashMap<>();
        snapshot.put("users", List.of(user));
        snapshot.put("courses", List.of(course));
        snapshot.put("submissions", List.of(submission));
        exportService.writeSnapshot(snapshot, file);

        // When
        Map<String, List<Document>> imported = importService.readSnapshot(file);

        // Then
        assertThat(imported).containsOnlyKeys("users", "courses", "submissions");
        assertThat(imported.get("users")).containsExactly(withHexId(user));
        assertThat(imported.get("courses")).containsExactly(withHexId(course));
        assertThat(imported.get("submissions")).containsExactly(withHexId(submission));
        assertThat(imported.get("submissions").get(0)).containsKey("grade");
    }

    @Test
    void missingFileShouldYieldEmptySnapshot() {
        assertThat(importService.readSnapshot(tempDir.resolve("missing.json"))).isEmpty();
    }

    @Test
    void unparseableTimestampShouldBeKeptAsText() {
        // When
        Document restored = DataImportService.restore(
            Map.<String, Object>of("enrollmentDate", "last tuesday"), List.of("enrollmentDate"));

        // Then
        assertThat(restored.get("enrollmentDate")).isEqualTo("last tuesday");
    }

    private static Document withHexId(Document source) {
        return new Document(source).append("_id", source.getObjectId("_id").toHexString());
    }

    private static Document enrollment(ObjectId id, String status, int progress) {
        return new Document("_id", id)
            .append("enrollmentId", "ENROLL_" + id.toHexString().substring(18))
            .append("studentId", "STU_001")
            .append("courseId", "COURSE_001")
            .append("enrollmentDate", Date.from(ENROLLED))
            .append("status", status)
            .append("progress", progress)
            .append("completionDate", null);
    }
}
