package io.github.samzhu.eduhub.service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.TextIndexDefinition.TextIndexDefinitionBuilder;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import io.github.samzhu.eduhub.document.Course;
import io.github.samzhu.eduhub.document.EntityKind;
import io.github.samzhu.eduhub.util.PeriodUtils;

/**
 * 查詢效能分析（離線使用），以 {@code explain} 取得查詢計畫，或量測常用查詢的耗時。
 *
 * <p>常用的檢查項目：
 * <ul>
 *   <li>{@code queryPlanner.winningPlan} - 是否使用索引 (IXSCAN) 或全表掃描 (COLLSCAN)</li>
 *   <li>{@code executionStats.totalDocsExamined} - 掃描文件數</li>
 *   <li>{@code executionStats.executionTimeMillis} - 執行時間</li>
 * </ul>
 */
@Service
public class QueryPerformanceService {

    private static final Logger log = LoggerFactory.getLogger(QueryPerformanceService.class);

    public static final String DEFAULT_VERBOSITY = "executionStats";

    public static final String COURSE_TITLE_SEARCH = "courseTitleSearch";
    public static final String RECENT_ENROLLMENTS = "recentEnrollments";
    public static final String UPCOMING_ASSIGNMENTS = "upcomingAssignments";

    static final String TITLE_SEARCH_TERM = "Course";
    static final int UPCOMING_DAYS = 7;

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public QueryPerformanceService(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    public Optional<Document> analyzeQueryPerformance(String collection, Document filter) {
        return analyzeQueryPerformance(collection, filter, DEFAULT_VERBOSITY);
    }

    /**
     * 對 find 查詢執行 explain。
     *
     * @param collection 集合名稱
     * @param filter 查詢條件
     * @param verbosity {@code queryPlanner}、{@code executionStats} 或 {@code allPlansExecution}
     * @return explain 結果；失敗時為空
     */
    public Optional<Document> analyzeQueryPerformance(String collection, Document filter, String verbosity) {
        Document command = new Document("explain", new Document("find", collection).append("filter", filter))
            .append("verbosity", verbosity);
        try {
            Document result = mongoTemplate.executeCommand(command);
            log.info("Explain completed: collection={}, filter={}, verbosity={}", collection, filter.toJson(), verbosity);
            return Optional.of(result);
        } catch (DataAccessException e) {
            log.error("Explain failed: collection={}, filter={}", collection, filter.toJson(), e);
            return Optional.empty();
        }
    }

    /**
     * 量測三個常用查詢的耗時，並確保 courses 的全文索引 (title, description) 存在。
     *
     * <ol>
     *   <li>{@value #COURSE_TITLE_SEARCH} - 標題不分大小寫的正規表示式查詢</li>
     *   <li>{@value #RECENT_ENROLLMENTS} - 最近 30 天的選課記錄</li>
     *   <li>{@value #UPCOMING_ASSIGNMENTS} - 7 天內到期的作業</li>
     * </ol>
     *
     * @return 查詢名稱 → 耗時（毫秒），依執行順序；任一查詢失敗時為空
     */
    public Map<String, Long> optimizeSlowQueries() {
        Map<String, Long> timings = new LinkedHashMap<>();
        PeriodUtils.Window upcoming = PeriodUtils.nextDays(clock, UPCOMING_DAYS);
        try {
            timings.put(COURSE_TITLE_SEARCH, timeQuery(EntityKind.COURSE,
                Query.query(Criteria.where("title").regex(TITLE_SEARCH_TERM, "i"))));
            ensureCourseTextIndex();
            timings.put(RECENT_ENROLLMENTS, timeQuery(EntityKind.ENROLLMENT,
                Query.query(Criteria.where("enrollmentDate").gte(PeriodUtils.monthsAgo(clock, 1)))));
            timings.put(UPCOMING_ASSIGNMENTS, timeQuery(EntityKind.ASSIGNMENT,
                Query.query(Criteria.where("dueDate").gte(upcoming.from()).lte(upcoming.to()))));
        } catch (DataAccessException e) {
            log.error("Query timing failed after {} queries", timings.size(), e);
            return Map.of();
        }
        log.info("Query timing completed: {}", timings);
        return timings;
    }

    private long timeQuery(EntityKind kind, Query query) {
        long startTime = System.currentTimeMillis();
        int count = mongoTemplate.find(query, Document.class, kind.collection()).size();
        long duration = System.currentTimeMillis() - startTime;
        log.info("Query on {} returned {} documents in {}ms: {}", kind.collection(), count, duration,
            query.getQueryObject().toJson());
        return duration;
    }

    private void ensureCourseTextIndex() {
        try {
            mongoTemplate.indexOps(Course.class).ensureIndex(new TextIndexDefinitionBuilder()
                .onField("title")
                .onField("description")
                .build());
            log.info("Text index ensured: courses(title, description)");
        } catch (DataAccessException e) {
            // 啟動時已由 @TextIndexed 建立同欄位但不同名稱的索引
            log.info("Text index already exists on courses: {}", e.getMessage());
        }
    }
}
