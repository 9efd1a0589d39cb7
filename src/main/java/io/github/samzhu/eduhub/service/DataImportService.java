package io.github.samzhu.eduhub.service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.eduhub.document.EntityKind;

/**
 * 讀取 {@link DataExportService} 匯出的 JSON 檔案。
 *
 * <p>已知集合的時間欄位（見 {@link EntityKind#timestampFields()}）由 ISO-8601 字串還原為日期，
 * 其他欄位保持 JSON 的型別。{@code _id} 維持十六進位字串。
 * 結果可交給 {@link io.github.samzhu.eduhub.pipeline.InMemoryPipelineExecutor} 離線分析。
 */
@Service
public class DataImportService {

    private static final Logger log = LoggerFactory.getLogger(DataImportService.class);

    private static final TypeReference<LinkedHashMap<String, List<Map<String, Object>>>> SNAPSHOT_TYPE =
        new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public DataImportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 讀取匯出檔。
     *
     * @param path 匯出檔路徑
     * @return 集合名稱 → 文件；讀檔失敗時為空
     */
    public Map<String, List<Document>> readSnapshot(Path path) {
        try {
            Map<String, List<Map<String, Object>>> raw = objectMapper.readValue(path.toFile(), SNAPSHOT_TYPE);
            Map<String, List<Document>> snapshot = new LinkedHashMap<>();
            raw.forEach((collection, documents) -> {
                List<String> timestampFields = EntityKind.fromCollection(collection)
                    .map(EntityKind::timestampFields)
                    .orElse(List.of());
                snapshot.put(collection, documents.stream()
                    .map(document -> restore(document, timestampFields))
                    .toList());
            });
            log.info("Snapshot loaded from {}: {} collections", path, snapshot.size());
            return snapshot;
        } catch (IOException e) {
            log.error("Failed to read snapshot file: {}", path, e);
            return Map.of();
        }
    }

    static Document restore(Map<String, Object> source, List<String> timestampFields) {
        Document document = new Document(source);
        for (String field : timestampFields) {
            if (document.get(field) instanceof String text) {
                try {
                    document.put(field, Date.from(Instant.parse(text)));
                } catch (DateTimeParseException e) {
                    log.warn("Field {} is not an ISO-8601 instant: {}", field, text);
                }
            }
        }
        return document;
    }
}
