package io.github.samzhu.eduhub;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * EduHub - 線上學習平台的資料存取與分析服務。
 *
 * <p>此服務以 MongoDB 作為文件資料庫，負責：
 * <ul>
 *   <li>定義六個集合的 schema 驗證規則與索引</li>
 *   <li>產生具參照一致性的範例資料</li>
 *   <li>提供用戶、課程、單元、作業、選課、繳交的 CRUD 操作</li>
 *   <li>以 aggregation pipeline 計算跨集合統計</li>
 *   <li>匯出全部集合為 JSON 檔案</li>
 * </ul>
 *
 * <p>資料流程：
 * <pre>
 * SampleDataLoader → MongoDB ← CRUD Services
 *                      ↓
 *              CourseAnalyticsService (pipelines)
 *                      ↓
 *        AnalyticsReportPrinter / DataExportService / REST API
 * </pre>
 */
@SpringBootApplication
public class EduhubApplication {

    private static final Logger log = LoggerFactory.getLogger(EduhubApplication.class);

    public static void main(String[] args) {
        log.info("Starting EduHub Service - e-learning data access and analytics");
        SpringApplication.run(EduhubApplication.class, args);
    }
}
