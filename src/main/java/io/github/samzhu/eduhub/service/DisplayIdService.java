package io.github.samzhu.eduhub.service;

import java.util.Optional;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import io.github.samzhu.eduhub.document.DisplayIdCounter;
import io.github.samzhu.eduhub.document.EntityKind;
import io.github.samzhu.eduhub.util.DisplayIds;

/**
 * 顯示用 ID 產生服務。
 *
 * <p>每個 (集合, 前綴) 有一個序號文件，存放在 {@code display_id_counters}：
 * <pre>
 * 1. 讀取集合中目前最大的顯示 ID（字典序，符合 ^PREFIX_\d+$）
 * 2. $max：把序號提高到至少等於該值（資料由其他途徑寫入時追上）
 * 3. findAndModify + $inc：原子取得下一個序號
 * 4. 補零為三位數
 * </pre>
 *
 * <p>併發建立者不會取得相同的 ID。取得序號後建立失敗會留下空號。
 */
@Service
public class DisplayIdService {

    private static final Logger log = LoggerFactory.getLogger(DisplayIdService.class);

    private static final String SEQ = "seq";

    private final MongoTemplate mongoTemplate;

    public DisplayIdService(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * 取得下一個顯示用 ID。
     *
     * @param kind 實體種類（決定集合與 ID 欄位）
     * @param prefix ID 前綴，如 {@code STU}
     * @return 新的顯示用 ID，如 {@code STU_021}
     */
    public String nextId(EntityKind kind, String prefix) {
        long floor = findMaxDisplayId(kind, prefix)
            .map(id -> DisplayIds.parseSuffix(id, prefix))
            .orElse(0L);

        Query counterQuery = Query.query(Criteria.where("_id").is(DisplayIdCounter.createId(kind.collection(), prefix)));
        mongoTemplate.upsert(counterQuery, new Update().max(SEQ, floor), DisplayIdCounter.class);
        DisplayIdCounter counter = mongoTemplate.findAndModify(
            counterQuery,
            new Update().inc(SEQ, 1),
            FindAndModifyOptions.options().returnNew(true).upsert(true),
            DisplayIdCounter.class);

        long next = counter != null ? counter.seq() : floor + 1;
        String displayId = DisplayIds.format(prefix, next);
        log.debug("Allocated display id: collection={}, id={}", kind.collection(), displayId);
        return displayId;
    }

    /**
     * 讀取集合中字典序最大的顯示用 ID。
     *
     * @param kind 實體種類
     * @param prefix ID 前綴
     * @return 最大的顯示用 ID（集合中沒有該前綴時為空）
     */
    public Optional<String> findMaxDisplayId(EntityKind kind, String prefix) {
        Query query = Query.query(Criteria.where(kind.idField()).regex(DisplayIds.patternFor(prefix)))
            .with(Sort.by(Sort.Direction.DESC, kind.idField()))
            .limit(1);
        query.fields().include(kind.idField());
        Document latest = mongoTemplate.findOne(query, Document.class, kind.collection());
        return Optional.ofNullable(latest).map(document -> document.getString(kind.idField()));
    }

    /**
     * 清空所有序號（重新產生範例資料時使用）。
     */
    public void resetCounters() {
        mongoTemplate.remove(new Query(), DisplayIdCounter.class);
        log.info("Display id counters reset");
    }
}
