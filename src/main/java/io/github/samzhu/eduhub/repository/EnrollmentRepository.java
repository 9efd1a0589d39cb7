package io.github.samzhu.eduhub.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.eduhub.document.Enrollment;

/**
 * 選課記錄資料存取介面。
 *
 * <p>(studentId, courseId) 有唯一複合索引，重複選課在資料庫端也會被拒絕。
 * 進度與狀態為部分更新，由 {@link io.github.samzhu.eduhub.service.EnrollmentService} 透過 MongoTemplate 完成。
 */
public interface EnrollmentRepository extends MongoRepository<Enrollment, String> {

    Optional<Enrollment> findByEnrollmentId(String enrollmentId);

    Optional<Enrollment> findByStudentIdAndCourseId(String studentId, String courseId);

    List<Enrollment> findByStudentId(String studentId);

    long deleteByEnrollmentId(String enrollmentId);
}
