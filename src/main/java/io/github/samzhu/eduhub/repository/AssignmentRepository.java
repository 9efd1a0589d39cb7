package io.github.samzhu.eduhub.repository;

import java.time.Instant;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import io.github.samzhu.eduhub.document.Assignment;

/**
 * 作業資料存取介面。
 */
public interface AssignmentRepository extends MongoRepository<Assignment, String> {

    /**
     * 查詢到期日落在區間內的作業，上下限皆包含。
     *
     * @param from 起始時間
     * @param to 結束時間
     * @return 作業清單
     */
    @Query("{ 'dueDate': { '$gte': ?0, '$lte': ?1 } }")
    List<Assignment> findDueBetween(Instant from, Instant to);
}
