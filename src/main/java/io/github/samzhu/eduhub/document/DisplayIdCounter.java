package io.github.samzhu.eduhub.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 顯示用 ID 序號文件。
 *
 * <p>文件 ID 格式：{@code {collection}:{prefix}}，例如 {@code users:STU}。
 * {@code seq} 只透過 {@code $max} 與 {@code $inc} 原子更新。
 */
@Document(collection = "display_id_counters")
public record DisplayIdCounter(
    @Id String id,
    long seq
) {

    public static String createId(String collection, String prefix) {
        return collection + ":" + prefix;
    }
}
