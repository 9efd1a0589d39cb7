package io.github.samzhu.eduhub.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;

import io.github.samzhu.eduhub.document.EntityKind;
import io.github.samzhu.eduhub.dto.diagnostics.DatabaseInfo;
import io.github.samzhu.eduhub.dto.diagnostics.DatabaseInfo.CollectionStats;

/**
 * 資料庫概況查詢，使用 {@code collStats} 指令。
 */
@Service
public class DatabaseInfoService {

    private static final Logger log = LoggerFactory.getLogger(DatabaseInfoService.class);

    private final MongoTemplate mongoTemplate;

    public DatabaseInfoService(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * 取得資料庫名稱、所有集合與各集合的筆數與大小。
     *
     * @return 資料庫概況；查詢失敗時統計為空
     */
    public DatabaseInfo retrieveDatabaseInfo() {
        String databaseName = mongoTemplate.getDb().getName();
        try {
            List<String> collections = new ArrayList<>(mongoTemplate.getCollectionNames());
            Map<String, CollectionStats> stats = new LinkedHashMap<>();
            for (String collection : collections) {
                stats.put(collection, collectionStats(collection));
            }
            log.info("Database info retrieved: database={}, collections={}", databaseName, collections.size());
            return new DatabaseInfo(databaseName, collections, stats);
        } catch (DataAccessException e) {
            log.error("Failed to retrieve database info: database={}", databaseName, e);
            return new DatabaseInfo(databaseName, List.of(), Map.of());
        }
    }

    /**
     * 取得六個資料集合的統計（含索引數）。
     *
     * @return 集合名稱 → 統計；查詢失敗的集合不列入
     */
    public Map<String, CollectionStats> getCollectionStatistics() {
        Map<String, CollectionStats> stats = new LinkedHashMap<>();
        for (EntityKind kind : EntityKind.values()) {
            try {
                stats.put(kind.collection(), collectionStats(kind.collection()));
            } catch (DataAccessException e) {
                log.error("Failed to read collStats: collection={}", kind.collection(), e);
            }
        }
        return stats;
    }

    private CollectionStats collectionStats(String collection) {
        Document result = mongoTemplate.executeCommand(new Document("collStats", collection));
        return new CollectionStats(
            number(result.get("count")),
            number(result.get("size")),
            number(result.get("avgObjSize")),
            (int) number(result.get("nindexes")));
    }

    private static long number(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
