package io.github.samzhu.eduhub.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.CollectionOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.index.MongoPersistentEntityIndexResolver;
import org.springframework.data.mongodb.core.schema.JsonSchemaProperty;
import org.springframework.data.mongodb.core.schema.MongoJsonSchema;
import org.springframework.stereotype.Component;

import io.github.samzhu.eduhub.document.EntityKind;
import io.github.samzhu.eduhub.document.User;

/**
 * 啟動時建立集合、schema 驗證器與索引。
 *
 * <p>處理流程：
 * <pre>
 * 每種 EntityKind
 *   ├─ 集合不存在 → 建立（users / courses 附 $jsonSchema 驗證器）
 *   └─ 依文件類別上的 @Indexed / @CompoundIndex / @TextIndexed 建立索引
 * </pre>
 *
 * <p>重複執行是安全的：已存在的集合會被略過，已存在的索引由 MongoDB 忽略。
 */
@Component
@Order(0)
public class SchemaInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

    private final MongoTemplate mongoTemplate;

    public SchemaInitializer(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void run(ApplicationArguments args) {
        for (EntityKind kind : EntityKind.values()) {
            createCollection(kind);
            createIndexes(kind);
        }
        log.info("Schema initialized: {} collections", EntityKind.values().length);
    }

    void createCollection(EntityKind kind) {
        if (mongoTemplate.collectionExists(kind.collection())) {
            log.debug("Collection already exists: {}", kind.collection());
            return;
        }
        try {
            MongoJsonSchema schema = schemaFor(kind);
            if (schema != null) {
                mongoTemplate.createCollection(kind.collection(), CollectionOptions.empty().schema(schema));
                log.info("Created collection with schema validator: {}", kind.collection());
            } else {
                mongoTemplate.createCollection(kind.collection());
                log.info("Created collection: {}", kind.collection());
            }
        } catch (DataAccessException e) {
            // 多個實例同時啟動時，集合可能已被其他實例建立
            log.warn("Collection {} not created: {}", kind.collection(), e.getMessage());
        }
    }

    void createIndexes(EntityKind kind) {
        MongoPersistentEntityIndexResolver resolver =
            new MongoPersistentEntityIndexResolver(mongoTemplate.getConverter().getMappingContext());
        IndexOperations indexOps = mongoTemplate.indexOps(kind.documentType());
        resolver.resolveIndexFor(kind.documentType()).forEach(indexOps::ensureIndex);
        log.debug("Indexes ensured: {}", kind.collection());
    }

    /**
     * 資料庫端的 schema 驗證器，只有 users 與 courses 有定義。
     */
    static MongoJsonSchema schemaFor(EntityKind kind) {
        return switch (kind) {
            case USER -> MongoJsonSchema.builder()
                .required("userId", "email", "firstName", "lastName", "role")
                .properties(
                    JsonSchemaProperty.string("userId"),
                    JsonSchemaProperty.string("email").matching(User.EMAIL_PATTERN),
                    JsonSchemaProperty.string("firstName"),
                    JsonSchemaProperty.string("lastName"),
                    JsonSchemaProperty.string("role").possibleValues("student", "instructor"),
                    JsonSchemaProperty.date("dateJoined"),
                    JsonSchemaProperty.bool("isActive"))
                .build();
            case COURSE -> MongoJsonSchema.builder()
                .required("courseId", "title", "instructorId")
                .properties(
                    JsonSchemaProperty.string("courseId"),
                    JsonSchemaProperty.string("title"),
                    JsonSchemaProperty.string("instructorId"),
                    JsonSchemaProperty.string("category"),
                    JsonSchemaProperty.string("level").possibleValues("beginner", "intermediate", "advanced"),
                    JsonSchemaProperty.bool("isPublished"))
                .build();
            default -> null;
        };
    }
}
