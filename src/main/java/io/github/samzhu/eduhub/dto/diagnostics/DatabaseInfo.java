package io.github.samzhu.eduhub.dto.diagnostics;

import java.util.List;
import java.util.Map;

/**
 * 資料庫與集合概況。
 *
 * @param databaseName 資料庫名稱
 * @param collections 集合名稱
 * @param collectionStats 集合名稱 → 統計
 */
public record DatabaseInfo(
    String databaseName,
    List<String> collections,
    Map<String, CollectionStats> collectionStats
) {

    /**
     * 單一集合的 {@code collStats} 摘要。
     *
     * @param count 文件數
     * @param size 資料大小 (bytes)
     * @param avgObjSize 平均文件大小 (bytes)
     * @param indexCount 索引數
     */
    public record CollectionStats(
        long count,
        long size,
        long avgObjSize,
        int indexCount
    ) {}
}
