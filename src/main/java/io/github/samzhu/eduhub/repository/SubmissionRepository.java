package io.github.samzhu.eduhub.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;

import io.github.samzhu.eduhub.document.Submission;

/**
 * 作業繳交資料存取介面。
 */
public interface SubmissionRepository extends MongoRepository<Submission, String> {

    Optional<Submission> findBySubmissionId(String submissionId);

    List<Submission> findByStudentId(String studentId);

    // ========== 更新操作 (@Query + @Update) ==========

    /**
     * 評分（不變更評語）。
     *
     * @param submissionId 繳交 ID
     * @param grade 分數 (0-100)
     * @param now 評分時間
     * @return 更新的文件數
     */
    @Query("{ 'submissionId': ?0 }")
    @Update("{ '$set': { 'grade': ?1, 'gradedDate': ?2 } }")
    long updateGradeBySubmissionId(String submissionId, int grade, Instant now);

    /**
     * 評分並寫入評語。
     *
     * @param submissionId 繳交 ID
     * @param grade 分數 (0-100)
     * @param feedback 評語
     * @param now 評分時間
     * @return 更新的文件數
     */
    @Query("{ 'submissionId': ?0 }")
    @Update("{ '$set': { 'grade': ?1, 'feedback': ?2, 'gradedDate': ?3 } }")
    long updateGradeAndFeedbackBySubmissionId(String submissionId, int grade, String feedback, Instant now);
}
