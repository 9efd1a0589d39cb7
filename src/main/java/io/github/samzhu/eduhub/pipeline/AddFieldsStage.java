package io.github.samzhu.eduhub.pipeline;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

import org.bson.Document;

/**
 * {@code $addFields} 以運算式新增或覆寫欄位。
 */
public record AddFieldsStage(Map<String, Expr> fields) implements Stage {

    public AddFieldsStage {
        fields = new LinkedHashMap<>(fields);
    }

    @Override
    public Stream<Document> apply(Stream<Document> input, LookupSource source) {
        return input.map(document -> {
            Document result = document;
            for (Map.Entry<String, Expr> field : fields.entrySet()) {
                // 所有運算式都以原始文件求值
                result = Documents.with(result, field.getKey(), field.getValue().evaluate(document));
            }
            return result;
        });
    }

    @Override
    public Document toDocument() {
        Document added = new Document();
        fields.forEach((name, expr) -> added.put(name, expr.toBson()));
        return new Document("$addFields", added);
    }
}
