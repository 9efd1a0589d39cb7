package io.github.samzhu.eduhub.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import io.github.samzhu.eduhub.document.EntityKind;

/**
 * 清空資料庫並寫入範例資料。
 *
 * <p>處理流程：
 * <pre>
 * 1. 清空六個集合與顯示用 ID 序號
 * 2. 產生範例資料（{@link SampleDataGenerator}）
 * 3. 依 users → courses → lessons → assignments → enrollments → submissions 順序寫入
 * </pre>
 */
@Service
public class SampleDataLoader {

    private static final Logger log = LoggerFactory.getLogger(SampleDataLoader.class);

    private final MongoTemplate mongoTemplate;
    private final SampleDataGenerator generator;
    private final DisplayIdService displayIdService;

    public SampleDataLoader(MongoTemplate mongoTemplate, SampleDataGenerator generator,
            DisplayIdService displayIdService) {
        this.mongoTemplate = mongoTemplate;
        this.generator = generator;
        this.displayIdService = displayIdService;
    }

    /**
     * 重新產生範例資料。
     *
     * @return 各集合實際寫入的筆數；寫入失敗時只包含失敗前已完成的集合
     */
    public Map<String, Integer> populate() {
        log.info("Beginning sample data population");
        Map<String, Integer> inserted = new LinkedHashMap<>();
        try {
            clearExistingData();
            SampleDataSet dataSet = generator.generate();
            insert(EntityKind.USER, dataSet.users(), inserted);
            insert(EntityKind.COURSE, dataSet.courses(), inserted);
            insert(EntityKind.LESSON, dataSet.lessons(), inserted);
            insert(EntityKind.ASSIGNMENT, dataSet.assignments(), inserted);
            insert(EntityKind.ENROLLMENT, dataSet.enrollments(), inserted);
            insert(EntityKind.SUBMISSION, dataSet.submissions(), inserted);
            log.info("Sample data population completed: {}", inserted);
        } catch (DataAccessException e) {
            log.error("Sample data population failed after {}", inserted, e);
        }
        return inserted;
    }

    /**
     * 清空六個集合與顯示用 ID 序號。
     */
    public void clearExistingData() {
        for (EntityKind kind : EntityKind.values()) {
            mongoTemplate.remove(new Query(), kind.collection());
        }
        displayIdService.resetCounters();
        log.info("Existing data cleared from all collections");
    }

    private void insert(EntityKind kind, List<?> documents, Map<String, Integer> inserted) {
        if (!documents.isEmpty()) {
            mongoTemplate.insert(documents, kind.collection());
        }
        inserted.put(kind.collection(), documents.size());
        log.info("Inserted {} {} records", documents.size(), kind.collection());
    }
}
