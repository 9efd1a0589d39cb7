package io.github.samzhu.eduhub.document;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 六種實體的封閉集合。
 *
 * <p>每種實體對應一個文件類別、集合名稱、顯示用 ID 欄位與時間欄位。
 * 時間欄位用於匯出時轉為 ISO-8601 字串、匯入時還原為日期。
 * 匯出與清空資料時依宣告順序處理（被參照者在前）。
 */
public enum EntityKind {

    USER(User.class, "users", "userId", List.of("dateJoined")),
    COURSE(Course.class, "courses", "courseId", List.of("createdAt", "updatedAt")),
    LESSON(Lesson.class, "lessons", "lessonId", List.of("createdAt")),
    ASSIGNMENT(Assignment.class, "assignments", "assignmentId", List.of("dueDate", "createdAt")),
    ENROLLMENT(Enrollment.class, "enrollments", "enrollmentId", List.of("enrollmentDate", "completionDate")),
    SUBMISSION(Submission.class, "submissions", "submissionId", List.of("submissionDate", "gradedDate"));

    private final Class<?> documentType;
    private final String collection;
    private final String idField;
    private final List<String> timestampFields;

    EntityKind(Class<?> documentType, String collection, String idField, List<String> timestampFields) {
        this.documentType = documentType;
        this.collection = collection;
        this.idField = idField;
        this.timestampFields = timestampFields;
    }

    public Class<?> documentType() {
        return documentType;
    }

    public String collection() {
        return collection;
    }

    public String idField() {
        return idField;
    }

    public List<String> timestampFields() {
        return timestampFields;
    }

    public static Optional<EntityKind> fromCollection(String collection) {
        return Arrays.stream(values()).filter(k -> k.collection.equals(collection)).findFirst();
    }
}
