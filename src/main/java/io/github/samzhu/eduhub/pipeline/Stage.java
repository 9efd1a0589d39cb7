package io.github.samzhu.eduhub.pipeline;

import java.util.stream.Stream;

import org.bson.Document;

/**
 * Aggregation pipeline 的單一階段。
 *
 * <p>同一個階段物件可以記憶體內套用於文件串流，也可以轉為 MongoDB 的 stage 文件交由資料庫執行，
 * 兩者語意一致。
 */
public interface Stage {

    Stream<Document> apply(Stream<Document> input, LookupSource source);

    Document toDocument();
}
