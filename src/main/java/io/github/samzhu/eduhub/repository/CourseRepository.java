package io.github.samzhu.eduhub.repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.core.query.TextCriteria;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;

import io.github.samzhu.eduhub.document.Course;

/**
 * 課程資料存取介面。
 *
 * <p>更新操作一律同時蓋上 {@code updatedAt}。
 *
 * @see io.github.samzhu.eduhub.document.Course
 */
public interface CourseRepository extends MongoRepository<Course, String> {

    // ========== 基本查詢 (Derived Query Methods) ==========

    Optional<Course> findByCourseId(String courseId);

    List<Course> findByCategory(String category);

    /**
     * 查詢含有任一指定標籤的課程（{@code $in}）。
     *
     * @param tags 標籤清單
     * @return 課程清單
     */
    List<Course> findByTagsIn(Collection<String> tags);

    /**
     * 全文搜尋（使用 title + description 的 text index）。
     *
     * @param criteria 搜尋條件
     * @return 符合的課程
     */
    List<Course> findAllBy(TextCriteria criteria);

    // ========== 複合條件查詢 (@Query) ==========

    /**
     * 依價格區間查詢，上下限皆包含。
     *
     * @param minimum 最低價格
     * @param maximum 最高價格
     * @return 課程清單
     */
    @Query("{ 'price': { '$gte': ?0, '$lte': ?1 } }")
    List<Course> findByPriceRange(double minimum, double maximum);

    /**
     * 標題不分大小寫的正規表示式查詢，呼叫端負責跳脫使用者輸入。
     *
     * @param pattern 正規表示式
     * @return 課程清單
     */
    @Query("{ 'title': { '$regex': ?0, '$options': 'i' } }")
    List<Course> findByTitleMatching(String pattern);

    // ========== 更新操作 (@Query + @Update) ==========

    /**
     * 發佈課程。
     *
     * @param courseId 課程 ID
     * @param now 當前時間
     * @return 更新的文件數
     */
    @Query("{ 'courseId': ?0 }")
    @Update("{ '$set': { 'isPublished': true, 'updatedAt': ?1 } }")
    long markPublishedByCourseId(String courseId, Instant now);

    /**
     * 加入標籤，已存在的標籤不會重複（{@code $addToSet} + {@code $each}）。
     *
     * @param courseId 課程 ID
     * @param tags 要加入的標籤
     * @param now 當前時間
     * @return 更新的文件數
     */
    @Query("{ 'courseId': ?0 }")
    @Update("{ '$addToSet': { 'tags': { '$each': ?1 } }, '$set': { 'updatedAt': ?2 } }")
    long addTagsByCourseId(String courseId, List<String> tags, Instant now);
}
