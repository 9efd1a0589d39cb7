package io.github.samzhu.eduhub.pipeline;

import static io.github.samzhu.eduhub.pipeline.Expr.field;
import static io.github.samzhu.eduhub.pipeline.SortStage.SortKey.asc;
import static io.github.samzhu.eduhub.pipeline.SortStage.SortKey.desc;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.bson.Document;
import org.junit.jupiter.api.Test;

class PipelineTest {

    private static final Map<String, List<Document>> DATA = Map.of(
        "courses", List.of(
            new Document("courseId", "COURSE_001").append("category", "Programming").append("price", 100),
            new Document("courseId", "COURSE_002").append("category", "Programming").append("price", 200),
            new Document("courseId", "COURSE_003").append("price", 50)),
        "enrollments", List.of(
            new Document("enrollmentId", "ENROLL_001").append("courseId", "COURSE_001"),
            new Document("enrollmentId", "ENROLL_002").append("courseId", "COURSE_001"),
            new Document("enrollmentId", "ENROLL_003").append("courseId", "COURSE_002")));

    private final InMemoryPipelineExecutor executor = new InMemoryPipelineExecutor(DATA);

    @Test
    void lookupShouldAttachMatchingDocuments() {
        // Given
        Pipeline pipeline = Pipeline.from("courses")
            .lookup("enrollments", "courseId", "courseId", "course_enrollments")
            .build();

        // When
        List<Document> results = executor.execute(pipeline);

        // Then
        assertThat(results).extracting(d -> ((List<?>) d.get("course_enrollments")).size())
            .containsExactly(2, 1, 0);
    }

    @Test
    void lookupAgainstMissingCollectionShouldYieldEmptyArrays() {
        // Given
        Pipeline pipeline = Pipeline.from("courses")
            .lookup("reviews", "courseId", "courseId", "course_reviews")
            .build();

        // When
        List<Document> results = executor.execute(pipeline);

        // Then
        assertThat(results).hasSize(3)
            .allSatisfy(d -> assertThat(d.getList("course_reviews", Object.class)).isEmpty());
    }

    @Test
    void unwindShouldDropDocumentsWithoutMatches() {
        // Given
        Pipeline pipeline = Pipeline.from("courses")
            .lookup("enrollments", "courseId", "courseId", "course_enrollments")
            .unwind("course_enrollments")
            .build();

        // When
        List<Document> results = executor.execute(pipeline);

        // Then
        assertThat(results).extracting(d -> d.getString("courseId"))
            .containsExactly("COURSE_001", "COURSE_001", "COURSE_002");
    }

    @Test
    void unwindPreservingShouldKeepDocumentsWithoutMatches() {
        // Given
        Pipeline pipeline = Pipeline.from("courses")
            .lookup("enrollments", "courseId", "courseId", "course_enrollments")
            .unwindPreserving("course_enrollments")
            .build();

        // When
        List<Document> results = executor.execute(pipeline);

        // Then
        assertThat(results).hasSize(4);
        assertThat(results.get(3)).containsEntry("courseId", "COURSE_003").doesNotContainKey("course_enrollments");
    }

    @Test
    void groupShouldReportMissingKeyAsNullBucket() {
        // Given
        Pipeline pipeline = Pipeline.from("courses")
            .group(field("category"), NamedFields
                .of("count", Accumulator.count())
                .and("averagePrice", Accumulator.avg(field("price"))))
            .build();

        // When
        List<Document> results = executor.execute(pipeline);

        // Then
        assertThat(results).hasSize(2);
        assertThat(results.get(0)).containsEntry("_id", "Programming").containsEntry("count", 2L)
            .containsEntry("averagePrice", 150.0);
        assertThat(results.get(1)).containsEntry("_id", null).containsEntry("count", 1L)
            .containsEntry("averagePrice", 50.0);
    }

    @Test
    void avgOfNoNumericValuesShouldBeNull() {
        // Given
        Pipeline pipeline = Pipeline.from("enrollments")
            .group(field("courseId"), NamedFields.of("averageProgress", Accumulator.avg(field("progress"))))
            .build();

        // When
        List<Document> results = executor.execute(pipeline);

        // Then
        assertThat(results).allSatisfy(d -> assertThat(d.get("averageProgress")).isNull());
    }

    @Test
    void sortShouldBeStableAndPlaceNullLastWhenDescending() {
        // Given
        Pipeline pipeline = Pipeline.from("courses")
            .sort(desc("category"))
            .build();

        // When
        List<Document> results = executor.execute(pipeline);

        // Then
        assertThat(results).extracting(d -> d.getString("courseId"))
            .containsExactly("COURSE_001", "COURSE_002", "COURSE_003");
    }

    @Test
    void sortShouldSupportMultipleKeys() {
        // Given
        Pipeline pipeline = Pipeline.from("courses")
            .sort(asc("category"), desc("price"))
            .build();

        // When
        List<Document> results = executor.execute(pipeline);

        // Then
        assertThat(results).extracting(d -> d.getString("courseId"))
            .containsExactly("COURSE_003", "COURSE_002", "COURSE_001");
    }

    @Test
    void projectShouldKeepOnlyListedPaths() {
        // Given
        Pipeline pipeline = Pipeline.from("courses")
            .match("courseId", "COURSE_001")
            .project("courseId")
            .build();

        // When
        List<Document> results = executor.execute(pipeline);

        // Then
        assertThat(results).containsExactly(new Document("courseId", "COURSE_001"));
    }

    @Test
    void addFieldsShouldComputeFromOriginalDocument() {
        // Given
        Pipeline pipeline = Pipeline.from("courses")
            .lookup("enrollments", "courseId", "courseId", "course_enrollments")
            .addFields(NamedFields
                .of("enrollmentCount", Expr.size(field("course_enrollments")))
                .and("revenue", Expr.multiply(field("price"), Expr.size(field("course_enrollments")))))
            .project("enrollmentCount", "revenue")
            .build();

        // When
        List<Document> results = executor.execute(pipeline);

        // Then
        assertThat(results.get(0)).containsEntry("enrollmentCount", 2).containsEntry("revenue", 200L);
        assertThat(results.get(2)).containsEntry("enrollmentCount", 0).containsEntry("revenue", 0L);
    }

    @Test
    void shouldRenderMongoStages() {
        // Given
        Pipeline pipeline = Pipeline.from("enrollments")
            .match("courseId", "COURSE_001")
            .lookup("users", "studentId", "userId", "student_info")
            .unwind("student_info")
            .group(field("status"), NamedFields.of("count", Accumulator.count()))
            .sort(desc("count"))
            .build();

        // When
        List<Document> stages = pipeline.toDocuments();

        // Then
        assertThat(stages).containsExactly(
            Document.parse("{ '$match': { 'courseId': 'COURSE_001' } }"),
            Document.parse("{ '$lookup': { 'from': 'users', 'localField': 'studentId', "
                + "'foreignField': 'userId', 'as': 'student_info' } }"),
            Document.parse("{ '$unwind': { 'path': '$student_info', 'preserveNullAndEmptyArrays': false } }"),
            Document.parse("{ '$group': { '_id': '$status', 'count': { '$sum': 1 } } }"),
            Document.parse("{ '$sort': { 'count': -1 } }"));
        assertThat(pipeline.toAggregation().getPipeline().getOperations()).hasSize(5);
    }
}
