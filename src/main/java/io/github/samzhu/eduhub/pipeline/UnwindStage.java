package io.github.samzhu.eduhub.pipeline;

import java.util.List;
import java.util.stream.Stream;

import org.bson.Document;

/**
 * {@code $unwind} 將陣列欄位展開為每個元素一筆文件。
 *
 * <p>欄位缺少、為 null 或為空陣列時，預設丟棄該文件；
 * {@code preserveNullAndEmptyArrays} 為 true 時保留（空陣列欄位會被移除）。
 */
public record UnwindStage(String field, boolean preserveNullAndEmptyArrays) implements Stage {

    @Override
    public Stream<Document> apply(Stream<Document> input, LookupSource source) {
        return input.flatMap(this::unwind);
    }

    private Stream<Document> unwind(Document document) {
        Object value = Documents.resolve(document, field);
        if (value instanceof List<?> list) {
            if (list.isEmpty()) {
                if (!preserveNullAndEmptyArrays) {
                    return Stream.empty();
                }
                return field.indexOf('.') < 0 ? Stream.of(Documents.without(document, field)) : Stream.of(document);
            }
            return list.stream().map(element -> Documents.with(document, field, element));
        }
        if (value == null) {
            return preserveNullAndEmptyArrays ? Stream.of(document) : Stream.empty();
        }
        // 非陣列值視為單一元素陣列
        return Stream.of(document);
    }

    @Override
    public Document toDocument() {
        return new Document("$unwind", new Document("path", "$" + field)
            .append("preserveNullAndEmptyArrays", preserveNullAndEmptyArrays));
    }
}
