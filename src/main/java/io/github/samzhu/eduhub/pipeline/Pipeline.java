package io.github.samzhu.eduhub.pipeline;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import org.bson.Document;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperationContext;

/**
 * 以集合為起點的 aggregation pipeline，由有序的 {@link Stage} 組成。
 *
 * <p>同一組 stage 物件有兩種執行方式：
 * <pre>
 * Pipeline ─┬─ toAggregation() ──→ MongoTemplate.aggregate()   (MongoPipelineExecutor)
 *           └─ evaluate(source) ─→ Stream&lt;Document&gt;          (InMemoryPipelineExecutor)
 * </pre>
 *
 * <p>使用範例：
 * <pre>{@code
 * Pipeline pipeline = Pipeline.from("enrollments")
 *     .group(Expr.field("status"), NamedFields
 *         .of("count", Accumulator.count())
 *         .and("averageProgress", Accumulator.avg(Expr.field("progress"))))
 *     .build();
 * }</pre>
 */
public final class Pipeline {

    private final String collection;
    private final List<Stage> stages;

    private Pipeline(String collection, List<Stage> stages) {
        this.collection = collection;
        this.stages = List.copyOf(stages);
    }

    public static Builder from(String collection) {
        return new Builder(collection);
    }

    public String collection() {
        return collection;
    }

    public List<Stage> stages() {
        return stages;
    }

    /**
     * 在記憶體中依序執行所有 stage。
     *
     * @param source 各集合的文件來源（起始集合與 lookup 的外部集合）
     * @return 最終輸出文件
     */
    public List<Document> evaluate(LookupSource source) {
        Stream<Document> documents = source.documents(collection).stream();
        for (Stage stage : stages) {
            documents = stage.apply(documents, source);
        }
        return documents.toList();
    }

    /**
     * 轉為 MongoDB aggregation stage 文件列表。
     */
    public List<Document> toDocuments() {
        return stages.stream().map(Stage::toDocument).toList();
    }

    /**
     * 轉為 Spring Data {@link Aggregation}，每個 stage 原樣送出不經欄位對應。
     */
    public Aggregation toAggregation() {
        List<AggregationOperation> operations = stages.stream()
            .<AggregationOperation>map(stage -> new RawStageOperation(stage.toDocument()))
            .toList();
        return Aggregation.newAggregation(operations);
    }

    @Override
    public String toString() {
        return "Pipeline[" + collection + "]" + toDocuments();
    }

    /**
     * 直接輸出已組好的 stage 文件。
     */
    static final class RawStageOperation implements AggregationOperation {

        private final Document stage;

        RawStageOperation(Document stage) {
            this.stage = stage;
        }

        @Override
        public Document toDocument(AggregationOperationContext context) {
            return stage;
        }

        @Override
        public String getOperator() {
            return stage.keySet().iterator().next();
        }
    }

    public static final class Builder {

        private final String collection;
        private final List<Stage> stages = new ArrayList<>();

        private Builder(String collection) {
            this.collection = collection;
        }

        public Builder match(String field, Object value) {
            return stage(new MatchStage(field, value));
        }

        public Builder lookup(String from, String localField, String foreignField, String as) {
            return stage(new LookupStage(from, localField, foreignField, as));
        }

        public Builder unwind(String field) {
            return stage(new UnwindStage(field, false));
        }

        public Builder unwindPreserving(String field) {
            return stage(new UnwindStage(field, true));
        }

        public Builder group(Expr key, NamedFields<Accumulator> accumulators) {
            return stage(new GroupStage(key, accumulators.toMap()));
        }

        public Builder addFields(NamedFields<Expr> fields) {
            return stage(new AddFieldsStage(fields.toMap()));
        }

        public Builder sort(SortStage.SortKey... keys) {
            return stage(new SortStage(Arrays.asList(keys)));
        }

        public Builder project(String... paths) {
            return stage(new ProjectStage(Arrays.asList(paths)));
        }

        public Builder stage(Stage stage) {
            stages.add(stage);
            return this;
        }

        public Pipeline build() {
            return new Pipeline(collection, stages);
        }
    }
}
