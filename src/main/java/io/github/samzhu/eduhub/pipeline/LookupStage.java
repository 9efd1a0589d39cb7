package io.github.samzhu.eduhub.pipeline;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import org.bson.Document;

/**
 * {@code $lookup} 等值 join。
 *
 * <p>每筆輸入文件加上 {@code as} 陣列欄位，內容為 {@code from} 集合中
 * {@code foreignField} 等於本文件 {@code localField} 的所有文件（可為空陣列）。
 * 缺少 {@code localField} 的文件會對應到缺少 {@code foreignField} 的文件，與 MongoDB 相同。
 */
public record LookupStage(String from, String localField, String foreignField, String as) implements Stage {

    @Override
    public Stream<Document> apply(Stream<Document> input, LookupSource source) {
        Map<Object, List<Document>> index = new HashMap<>();
        for (Document foreign : source.documents(from)) {
            Object key = Documents.normalizeKey(Documents.resolve(foreign, foreignField));
            index.computeIfAbsent(key, k -> new ArrayList<>()).add(foreign);
        }
        return input.map(document -> Documents.with(document, as, matches(document, index)));
    }

    private List<Document> matches(Document document, Map<Object, List<Document>> index) {
        Object local = Documents.resolve(document, localField);
        if (local instanceof List<?> values) {
            Set<Document> matched = new LinkedHashSet<>();
            values.forEach(value -> matched.addAll(index.getOrDefault(Documents.normalizeKey(value), List.of())));
            return new ArrayList<>(matched);
        }
        return new ArrayList<>(index.getOrDefault(Documents.normalizeKey(local), List.of()));
    }

    @Override
    public Document toDocument() {
        return new Document("$lookup", new Document("from", from)
            .append("localField", localField)
            .append("foreignField", foreignField)
            .append("as", as));
    }
}
