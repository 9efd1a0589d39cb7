package io.github.samzhu.eduhub.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.eduhub.document.EntityKind;

/**
 * 將六個集合匯出為 JSON 檔案。
 *
 * <p>檔案格式：
 * <pre>
 * {
 *   "users": [ {...}, ... ],
 *   "courses": [ ... ],
 *   ...
 * }
 * </pre>
 *
 * <p>ObjectId 轉為 24 位十六進位字串，日期轉為 ISO-8601 UTC 字串（如 {@code 2025-01-15T08:30:00Z}）。
 */
@Service
public class DataExportService {

    private static final Logger log = LoggerFactory.getLogger(DataExportService.class);

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public DataExportService(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = mongoTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * 匯出全部集合。
     *
     * @param path 輸出檔案
     * @return 各集合匯出的筆數；失敗時為空
     */
    public Map<String, Integer> exportSampleData(Path path) {
        try {
            Map<String, List<Document>> snapshot = new LinkedHashMap<>();
            for (EntityKind kind : EntityKind.values()) {
                snapshot.put(kind.collection(), mongoTemplate.findAll(Document.class, kind.collection()));
            }
            return writeSnapshot(snapshot, path);
        } catch (DataAccessException e) {
            log.error("Failed to read collections for export", e);
            return Map.of();
        }
    }

    /**
     * 將已載入的文件寫為 JSON 檔案。
     *
     * @param snapshot 集合名稱 → 文件
     * @param path 輸出檔案
     * @return 各集合匯出的筆數；寫檔失敗時為空
     */
    public Map<String, Integer> writeSnapshot(Map<String, List<Document>> snapshot, Path path) {
        Map<String, Object> output = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        snapshot.forEach((collection, documents) -> {
            output.put(collection, toJsonValue(documents));
            counts.put(collection, documents.size());
        });
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), output);
            log.info("Data exported to {}: {}", path, counts);
            return counts;
        } catch (IOException e) {
            log.error("Failed to write export file: {}", path, e);
            return Map.of();
        }
    }

    /**
     * 轉為 JSON 可序列化的值。
     */
    static Object toJsonValue(Object value) {
        if (value instanceof ObjectId objectId) {
            return objectId.toHexString();
        }
        if (value instanceof Date date) {
            return date.toInstant().toString();
        }
        if (value instanceof Instant instant) {
            return instant.toString();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> converted = new LinkedHashMap<>();
            map.forEach((key, nested) -> converted.put(String.valueOf(key), toJsonValue(nested)));
            return converted;
        }
        if (value instanceof List<?> list) {
            List<Object> converted = new ArrayList<>(list.size());
            list.forEach(element -> converted.add(toJsonValue(element)));
            return converted;
        }
        return value;
    }
}
