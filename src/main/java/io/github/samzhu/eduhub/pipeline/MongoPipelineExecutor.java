package io.github.samzhu.eduhub.pipeline;

import java.util.List;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

/**
 * 透過 {@link MongoTemplate#aggregate} 在資料庫端執行 pipeline。
 *
 * <p>例外（{@link org.springframework.dao.DataAccessException}）直接往上拋，由呼叫端決定如何處理。
 */
@Component
public class MongoPipelineExecutor implements PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(MongoPipelineExecutor.class);

    private final MongoTemplate mongoTemplate;

    public MongoPipelineExecutor(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<Document> execute(Pipeline pipeline) {
        log.debug("Running aggregation: collection={}, stages={}", pipeline.collection(), pipeline.toDocuments());
        return mongoTemplate.aggregate(pipeline.toAggregation(), pipeline.collection(), Document.class)
            .getMappedResults();
    }
}
