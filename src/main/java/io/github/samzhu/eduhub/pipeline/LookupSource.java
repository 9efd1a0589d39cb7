package io.github.samzhu.eduhub.pipeline;

import java.util.List;

import org.bson.Document;

/**
 * 依集合名稱提供文件，供記憶體內執行 {@code $lookup} 使用。
 *
 * <p>不存在的集合回傳空清單，join 結果因此為空陣列而非錯誤。
 */
@FunctionalInterface
public interface LookupSource {

    List<Document> documents(String collection);
}
