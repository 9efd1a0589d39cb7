package io.github.samzhu.eduhub.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;

import io.github.samzhu.eduhub.document.User;

/**
 * 用戶資料存取介面。
 *
 * <p>提供對 {@code users} 集合的 CRUD 操作，以顯示用 ID ({@code userId}) 查詢。
 * 用戶不做實體刪除，停用透過 {@link #deactivateByUserId(String)} 完成。
 *
 * @see io.github.samzhu.eduhub.document.User
 */
public interface UserRepository extends MongoRepository<User, String> {

    // ========== 基本查詢 (Derived Query Methods) ==========

    /**
     * 根據顯示用 ID 查詢用戶（包含已停用的用戶）。
     *
     * @param userId 顯示用 ID，如 {@code STU_001}
     * @return 用戶（如存在）
     */
    Optional<User> findByUserId(String userId);

    /**
     * 查詢指定時間（含）之後加入的用戶。
     *
     * @param cutoff 起始時間
     * @return 用戶清單
     */
    List<User> findByDateJoinedGreaterThanEqual(Instant cutoff);

    // ========== 複合條件查詢 (@Query) ==========

    /**
     * 查詢指定角色中仍啟用的用戶。
     *
     * @param role 角色值，{@code student} 或 {@code instructor}
     * @return 啟用中的用戶清單
     */
    @Query("{ 'role': ?0, 'isActive': true }")
    List<User> findActiveByRole(String role);

    // ========== 更新操作 (@Query + @Update) ==========

    /**
     * 停用用戶（軟刪除），文件仍保留可查詢。
     *
     * @param userId 顯示用 ID
     * @return 更新的文件數
     */
    @Query("{ 'userId': ?0 }")
    @Update("{ '$set': { 'isActive': false } }")
    long deactivateByUserId(String userId);
}
