package io.github.samzhu.eduhub.pipeline;

import java.util.List;

import org.bson.Document;

/**
 * 執行 {@link Pipeline} 並回傳結果文件。
 */
public interface PipelineExecutor {

    List<Document> execute(Pipeline pipeline);
}
