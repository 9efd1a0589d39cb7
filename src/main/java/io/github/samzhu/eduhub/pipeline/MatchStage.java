package io.github.samzhu.eduhub.pipeline;

import java.util.List;
import java.util.stream.Stream;

import org.bson.Document;

/**
 * {@code $match} 相等條件。欄位為陣列時，任一元素相等即符合。
 */
public record MatchStage(String field, Object value) implements Stage {

    @Override
    public Stream<Document> apply(Stream<Document> input, LookupSource source) {
        return input.filter(this::matches);
    }

    private boolean matches(Document document) {
        Object actual = Documents.resolve(document, field);
        if (actual instanceof List<?> list && !(value instanceof List<?>)) {
            return list.stream().anyMatch(element -> Documents.valuesEqual(element, value));
        }
        return Documents.valuesEqual(actual, value);
    }

    @Override
    public Document toDocument() {
        return new Document("$match", new Document(field, value));
    }
}
