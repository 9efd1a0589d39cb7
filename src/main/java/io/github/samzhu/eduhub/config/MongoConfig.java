package io.github.samzhu.eduhub.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * MongoDB 資料庫配置。
 *
 * <p>啟用 Repository 自動掃描，自動註冊 {@code io.github.samzhu.eduhub.repository} 下的介面。
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code users} - 學生與講師</li>
 *   <li>{@code courses} - 課程</li>
 *   <li>{@code lessons} - 課程單元</li>
 *   <li>{@code assignments} - 作業</li>
 *   <li>{@code enrollments} - 選課記錄</li>
 *   <li>{@code submissions} - 作業繳交</li>
 *   <li>{@code display_id_counters} - 顯示用 ID 序號</li>
 * </ul>
 *
 * <p>集合的建立、schema 驗證與索引由 {@link SchemaInitializer} 負責。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/configuration.html">Spring Data MongoDB Configuration</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.eduhub.repository")
public class MongoConfig {
}
