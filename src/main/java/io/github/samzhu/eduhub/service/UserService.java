package io.github.samzhu.eduhub.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import com.mongodb.client.result.UpdateResult;

import io.github.samzhu.eduhub.document.EntityKind;
import io.github.samzhu.eduhub.document.User;
import io.github.samzhu.eduhub.document.UserRole;
import io.github.samzhu.eduhub.dto.CreateResult;
import io.github.samzhu.eduhub.repository.UserRepository;
import io.github.samzhu.eduhub.util.DisplayIds;
import io.github.samzhu.eduhub.util.PeriodUtils;
import io.github.samzhu.eduhub.validation.DocumentValidator;

/**
 * 用戶服務：註冊、查詢、更新簡介與停用。
 *
 * <p>錯誤處理：
 * <ul>
 *   <li>驗證失敗 → {@link CreateResult.Status#INVALID}，不寫入</li>
 *   <li>違反唯一索引（userId / email）→ {@link CreateResult.Status#DUPLICATE_KEY}</li>
 *   <li>其他資料庫錯誤 → {@link CreateResult.Status#FAILED}，更新類操作回傳 0，查詢回傳空清單</li>
 * </ul>
 */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    static final int DEFAULT_MONTHS_BACK = 6;

    private final UserRepository userRepository;
    private final MongoTemplate mongoTemplate;
    private final DisplayIdService displayIdService;
    private final DocumentValidator validator;
    private final Clock clock;

    public UserService(
            UserRepository userRepository,
            MongoTemplate mongoTemplate,
            DisplayIdService displayIdService,
            DocumentValidator validator,
            Clock clock) {
        this.userRepository = userRepository;
        this.mongoTemplate = mongoTemplate;
        this.displayIdService = displayIdService;
        this.validator = validator;
        this.clock = clock;
    }

    // ========== 建立 ==========

    /**
     * 註冊新學生，ID 為 {@code STU_nnn}。
     *
     * @param email 電子郵件（唯一）
     * @param firstName 名
     * @param lastName 姓
     * @param bio 自我介紹
     * @param skills 技能清單，可為 null
     * @return 建立結果
     */
    public CreateResult registerNewStudent(String email, String firstName, String lastName,
            String bio, List<String> skills) {
        return register(UserRole.STUDENT, email, firstName, lastName, bio, skills);
    }

    /**
     * 註冊新講師，ID 為 {@code INST_nnn}。
     */
    public CreateResult registerNewInstructor(String email, String firstName, String lastName,
            String bio, List<String> skills) {
        return register(UserRole.INSTRUCTOR, email, firstName, lastName, bio, skills);
    }

    private CreateResult register(UserRole role, String email, String firstName, String lastName,
            String bio, List<String> skills) {
        String userId;
        try {
            userId = displayIdService.nextId(EntityKind.USER, role.idPrefix());
        } catch (DataAccessException e) {
            log.error("Failed to allocate user id: role={}", role.value(), e);
            return CreateResult.failed(e.getMessage());
        }
        long number = DisplayIds.parseSuffix(userId, role.idPrefix());
        User user = new User(
            null,
            userId,
            email,
            firstName,
            lastName,
            role.value(),
            clock.instant(),
            new User.Profile(bio, "https://avatars.example.com/" + role.value() + "_" + number + ".png",
                skills != null ? List.copyOf(skills) : List.of()),
            true
        );
        return validateAndInsertUser(user);
    }

    /**
     * 驗證後寫入用戶。
     *
     * <p>檢查必填欄位（userId、email、firstName、lastName、role）、email 格式與角色值。
     *
     * @param user 用戶文件
     * @return 建立結果
     */
    public CreateResult validateAndInsertUser(User user) {
        List<String> errors = validator.validate(user);
        if (!errors.isEmpty()) {
            log.warn("User rejected: userId={}, errors={}", user.userId(), errors);
            return CreateResult.invalid(errors);
        }
        try {
            userRepository.insert(user);
            log.info("User registered: userId={}, role={}", user.userId(), user.role());
            return CreateResult.created(user.userId());
        } catch (DuplicateKeyException e) {
            log.warn("Duplicate user: userId={}, email={}", user.userId(), user.email());
            return CreateResult.duplicateKey(e.getMessage());
        } catch (DataAccessException e) {
            log.error("Failed to insert user: userId={}", user.userId(), e);
            return CreateResult.failed(e.getMessage());
        }
    }

    // ========== 查詢 ==========

    public List<User> findAllActiveStudents() {
        log.debug("Querying active students");
        try {
            return userRepository.findActiveByRole(UserRole.STUDENT.value());
        } catch (DataAccessException e) {
            log.error("Failed to query active students", e);
            return List.of();
        }
    }

    /**
     * 依顯示用 ID 查詢用戶，已停用的用戶也查得到。
     *
     * @param userId 顯示用 ID
     * @return 用戶（如存在）
     */
    public Optional<User> findUserById(String userId) {
        log.debug("Querying user: userId={}", userId);
        try {
            return userRepository.findByUserId(userId);
        } catch (DataAccessException e) {
            log.error("Failed to query user: userId={}", userId, e);
            return Optional.empty();
        }
    }

    public List<User> getUsersJoinedRecently() {
        return getUsersJoinedRecently(DEFAULT_MONTHS_BACK);
    }

    /**
     * 查詢最近 N 個月（每月 30 天）內加入的用戶。
     *
     * @param monthsBack 月數
     * @return 用戶清單
     */
    public List<User> getUsersJoinedRecently(int monthsBack) {
        Instant cutoff = PeriodUtils.monthsAgo(clock, monthsBack);
        log.debug("Querying users joined since {}", cutoff);
        try {
            return userRepository.findByDateJoinedGreaterThanEqual(cutoff);
        } catch (DataAccessException e) {
            log.error("Failed to query recent users: monthsBack={}", monthsBack, e);
            return List.of();
        }
    }

    // ========== 更新 ==========

    /**
     * 部分更新用戶簡介，只有非 null 的欄位會被寫入。
     *
     * @param userId 顯示用 ID
     * @param bio 自我介紹
     * @param skills 技能清單
     * @param avatar 頭像 URL
     * @return 修改的文件數，沒有任何欄位時為 0 且不寫入
     */
    public long updateUserProfile(String userId, String bio, List<String> skills, String avatar) {
        Update update = new Update();
        if (bio != null) {
            update.set("profile.bio", bio);
        }
        if (skills != null) {
            update.set("profile.skills", skills);
        }
        if (avatar != null) {
            update.set("profile.avatar", avatar);
        }
        if (update.getUpdateObject().isEmpty()) {
            log.warn("No profile fields to update: userId={}", userId);
            return 0;
        }
        try {
            UpdateResult result = mongoTemplate.updateFirst(
                Query.query(Criteria.where("userId").is(userId)), update, User.class);
            log.info("Profile updated: userId={}, modified={}", userId, result.getModifiedCount());
            return result.getModifiedCount();
        } catch (DataAccessException e) {
            log.error("Failed to update profile: userId={}", userId, e);
            return 0;
        }
    }

    // ========== 停用 ==========

    /**
     * 停用用戶（軟刪除），用戶仍可透過 {@link #findUserById(String)} 查詢。
     *
     * @param userId 顯示用 ID
     * @return 修改的文件數
     */
    public long deactivateUser(String userId) {
        try {
            long modified = userRepository.deactivateByUserId(userId);
            log.info("User deactivated: userId={}, modified={}", userId, modified);
            return modified;
        } catch (DataAccessException e) {
            log.error("Failed to deactivate user: userId={}", userId, e);
            return 0;
        }
    }
}
