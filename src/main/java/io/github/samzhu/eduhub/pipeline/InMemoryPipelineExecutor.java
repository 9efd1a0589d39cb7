package io.github.samzhu.eduhub.pipeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bson.Document;

/**
 * 在記憶體中對已載入的文件快照執行 pipeline。
 *
 * <p>用於離線分析匯出檔與單元測試。不存在的集合視為空集合。
 */
public class InMemoryPipelineExecutor implements PipelineExecutor, LookupSource {

    private final Map<String, List<Document>> collections;

    public InMemoryPipelineExecutor(Map<String, List<Document>> collections) {
        this.collections = new LinkedHashMap<>();
        collections.forEach((name, documents) -> this.collections.put(name, List.copyOf(documents)));
    }

    @Override
    public List<Document> execute(Pipeline pipeline) {
        return pipeline.evaluate(this);
    }

    @Override
    public List<Document> documents(String collection) {
        return collections.getOrDefault(collection, List.of());
    }
}
