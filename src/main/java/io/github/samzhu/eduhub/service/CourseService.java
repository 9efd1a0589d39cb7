package io.github.samzhu.eduhub.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.TextCriteria;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import com.mongodb.client.result.UpdateResult;

import io.github.samzhu.eduhub.document.Course;
import io.github.samzhu.eduhub.document.EntityKind;
import io.github.samzhu.eduhub.dto.CreateResult;
import io.github.samzhu.eduhub.dto.api.CourseUpdate;
import io.github.samzhu.eduhub.repository.CourseRepository;
import io.github.samzhu.eduhub.validation.DocumentValidator;

/**
 * 課程服務：建立、查詢、發佈、更新與標籤管理。
 *
 * <p>所有更新操作都會蓋上 {@code updatedAt}。
 */
@Service
public class CourseService {

    private static final Logger log = LoggerFactory.getLogger(CourseService.class);

    static final String ID_PREFIX = "COURSE";

    private final CourseRepository courseRepository;
    private final MongoTemplate mongoTemplate;
    private final DisplayIdService displayIdService;
    private final DocumentValidator validator;
    private final Clock clock;

    public CourseService(
            CourseRepository courseRepository,
            MongoTemplate mongoTemplate,
            DisplayIdService displayIdService,
            DocumentValidator validator,
            Clock clock) {
        this.courseRepository = courseRepository;
        this.mongoTemplate = mongoTemplate;
        this.displayIdService = displayIdService;
        this.validator = validator;
        this.clock = clock;
    }

    // ========== 建立 ==========

    /**
     * 建立新課程（未發佈），ID 為 {@code COURSE_nnn}。
     *
     * <p>不檢查 {@code instructorId} 是否存在。
     *
     * @return 建立結果
     */
    public CreateResult createNewCourse(String title, String description, String instructorId,
            String category, String level, int duration, double price, List<String> tags) {
        try {
            String courseId = displayIdService.nextId(EntityKind.COURSE, ID_PREFIX);
            Instant now = clock.instant();
            Course course = new Course(
                null,
                courseId,
                title,
                description,
                instructorId,
                category,
                level,
                duration,
                price,
                tags != null ? List.copyOf(tags) : List.of(),
                now,
                now,
                false
            );
            List<String> errors = validator.validate(course);
            if (!errors.isEmpty()) {
                log.warn("Course rejected: title={}, errors={}", title, errors);
                return CreateResult.invalid(errors);
            }
            courseRepository.insert(course);
            log.info("Course created: courseId={}, instructorId={}", courseId, instructorId);
            return CreateResult.created(courseId);
        } catch (DuplicateKeyException e) {
            log.warn("Duplicate course: title={}", title);
            return CreateResult.duplicateKey(e.getMessage());
        } catch (DataAccessException e) {
            log.error("Failed to create course: title={}", title, e);
            return CreateResult.failed(e.getMessage());
        }
    }

    // ========== 查詢 ==========

    public Optional<Course> findCourseById(String courseId) {
        log.debug("Querying course: courseId={}", courseId);
        try {
            return courseRepository.findByCourseId(courseId);
        } catch (DataAccessException e) {
            log.error("Failed to query course: courseId={}", courseId, e);
            return Optional.empty();
        }
    }

    public List<Course> getCoursesByCategory(String category) {
        log.debug("Querying courses by category: {}", category);
        try {
            return courseRepository.findByCategory(category);
        } catch (DataAccessException e) {
            log.error("Failed to query courses by category: {}", category, e);
            return List.of();
        }
    }

    /**
     * 標題部分比對（不分大小寫）。輸入視為一般文字，不作為正規表示式解讀。
     *
     * @param query 搜尋字串
     * @return 課程清單
     */
    public List<Course> searchCoursesByTitle(String query) {
        log.debug("Searching courses by title: {}", query);
        try {
            return courseRepository.findByTitleMatching(Pattern.quote(query));
        } catch (DataAccessException e) {
            log.error("Failed to search courses by title: {}", query, e);
            return List.of();
        }
    }

    /**
     * 以 text index（title + description）進行關鍵字搜尋。
     *
     * @param keywords 關鍵字，任一符合即可
     * @return 課程清單
     */
    public List<Course> searchCoursesByText(String... keywords) {
        log.debug("Text search on courses: {}", (Object) keywords);
        try {
            return courseRepository.findAllBy(TextCriteria.forDefaultLanguage().matchingAny(keywords));
        } catch (DataAccessException e) {
            log.error("Failed to run text search on courses", e);
            return List.of();
        }
    }

    /**
     * 價格區間查詢，上下限皆包含。
     */
    public List<Course> findCoursesByPriceRange(double minimum, double maximum) {
        log.debug("Querying courses by price range: {} - {}", minimum, maximum);
        try {
            return courseRepository.findByPriceRange(minimum, maximum);
        } catch (DataAccessException e) {
            log.error("Failed to query courses by price range", e);
            return List.of();
        }
    }

    public List<Course> findCoursesWithTags(List<String> tags) {
        log.debug("Querying courses with tags: {}", tags);
        try {
            return courseRepository.findByTagsIn(tags);
        } catch (DataAccessException e) {
            log.error("Failed to query courses by tags: {}", tags, e);
            return List.of();
        }
    }

    // ========== 更新 ==========

    public long markCourseAsPublished(String courseId) {
        try {
            long modified = courseRepository.markPublishedByCourseId(courseId, clock.instant());
            log.info("Course published: courseId={}, modified={}", courseId, modified);
            return modified;
        } catch (DataAccessException e) {
            log.error("Failed to publish course: courseId={}", courseId, e);
            return 0;
        }
    }

    /**
     * 部分更新課程，只寫入非 null 的欄位，並一律蓋上 {@code updatedAt}。
     *
     * @param courseId 課程 ID
     * @param changes 變更內容
     * @return 修改的文件數；驗證失敗時為 0
     */
    public long updateCourse(String courseId, CourseUpdate changes) {
        List<String> errors = validator.validate(changes);
        if (!errors.isEmpty()) {
            log.warn("Course update rejected: courseId={}, errors={}", courseId, errors);
            return 0;
        }
        Update update = new Update().set("updatedAt", clock.instant());
        setIfPresent(update, "title", changes.title());
        setIfPresent(update, "description", changes.description());
        setIfPresent(update, "category", changes.category());
        setIfPresent(update, "level", changes.level());
        setIfPresent(update, "duration", changes.duration());
        setIfPresent(update, "price", changes.price());
        try {
            UpdateResult result = mongoTemplate.updateFirst(
                Query.query(Criteria.where("courseId").is(courseId)), update, Course.class);
            log.info("Course updated: courseId={}, modified={}", courseId, result.getModifiedCount());
            return result.getModifiedCount();
        } catch (DataAccessException e) {
            log.error("Failed to update course: courseId={}", courseId, e);
            return 0;
        }
    }

    /**
     * 加入標籤（集合聯集，不會產生重複標籤）。
     *
     * @param courseId 課程 ID
     * @param tags 要加入的標籤
     * @return 修改的文件數
     */
    public long addTagsToCourse(String courseId, List<String> tags) {
        try {
            long modified = courseRepository.addTagsByCourseId(courseId, tags, clock.instant());
            log.info("Tags added: courseId={}, tags={}, modified={}", courseId, tags, modified);
            return modified;
        } catch (DataAccessException e) {
            log.error("Failed to add tags: courseId={}", courseId, e);
            return 0;
        }
    }

    private static void setIfPresent(Update update, String field, Object value) {
        if (value != null) {
            update.set(field, value);
        }
    }
}
