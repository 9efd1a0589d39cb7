package io.github.samzhu.eduhub.pipeline;

import java.util.List;
import java.util.stream.Stream;

import org.bson.Document;

/**
 * {@code $project} 包含式投影。
 *
 * <p>只保留列出的欄位路徑（可為巢狀路徑），{@code _id} 預設保留。
 */
public record ProjectStage(List<String> paths) implements Stage {

    public ProjectStage {
        paths = List.copyOf(paths);
    }

    @Override
    public Stream<Document> apply(Stream<Document> input, LookupSource source) {
        return input.map(this::project);
    }

    private Document project(Document document) {
        Document result = new Document();
        if (document.containsKey("_id")) {
            result.put("_id", document.get("_id"));
        }
        for (String path : paths) {
            if (Documents.contains(document, path)) {
                result = Documents.with(result, path, Documents.resolve(document, path));
            }
        }
        return result;
    }

    @Override
    public Document toDocument() {
        Document projection = new Document();
        paths.forEach(path -> projection.put(path, 1));
        return new Document("$project", projection);
    }
}
