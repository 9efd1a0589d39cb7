package io.github.samzhu.eduhub.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.bson.Document;

/**
 * {@code $group} 依鍵值分組並計算累加器。
 *
 * <p>鍵值運算式求值為 null（含欄位缺少）的文件歸入 {@code _id: null} 組，與其他組一樣輸出。
 * 輸出順序為各組第一次出現的順序。
 */
public record GroupStage(Expr key, Map<String, Accumulator> accumulators) implements Stage {

    public GroupStage {
        accumulators = new LinkedHashMap<>(accumulators);
    }

    @Override
    public Stream<Document> apply(Stream<Document> input, LookupSource source) {
        Map<Object, Bucket> buckets = new LinkedHashMap<>();
        input.forEach(document -> {
            Object keyValue = key.evaluate(document);
            buckets.computeIfAbsent(Documents.normalizeKey(keyValue), k -> new Bucket(keyValue))
                .documents().add(document);
        });
        return buckets.values().stream().map(this::toResult);
    }

    private Document toResult(Bucket bucket) {
        Document result = new Document("_id", bucket.key());
        accumulators.forEach((name, accumulator) -> result.put(name, accumulator.accumulate(bucket.documents())));
        return result;
    }

    @Override
    public Document toDocument() {
        Document group = new Document("_id", key.toBson());
        accumulators.forEach((name, accumulator) -> group.put(name, accumulator.toBson()));
        return new Document("$group", group);
    }

    private record Bucket(Object key, List<Document> documents) {
        Bucket(Object key) {
            this(key, new ArrayList<>());
        }
    }
}
