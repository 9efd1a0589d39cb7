package io.github.samzhu.eduhub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * EduHub 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link SampleDataConfig} - 範例資料產生設定，控制各集合筆數與隨機種子</li>
 *   <li>{@link ExportConfig} - JSON 匯出設定</li>
 *   <li>{@link ReportConfig} - 啟動時統計報表設定</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * eduhub:
 *   sample-data:
 *     enabled: true
 *     seed: 42
 *     users: 20
 *     courses: 8
 *     lessons: 25
 *     assignments: 10
 *     enrollments: 15
 *     submissions: 12
 *     max-pair-attempts: 50
 *   export:
 *     enabled: true
 *     file: sample_data.json
 *   report:
 *     enabled: true
 *     snapshot-file:
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "eduhub")
public record EduhubProperties(
    SampleDataConfig sampleData,
    ExportConfig export,
    ReportConfig report
) {
    public EduhubProperties {
        if (sampleData == null) {
            sampleData = SampleDataConfig.defaults();
        }
        if (export == null) {
            export = ExportConfig.defaults();
        }
        if (report == null) {
            report = ReportConfig.defaults();
        }
    }

    /**
     * 範例資料產生設定。
     *
     * <p>控制 {@link io.github.samzhu.eduhub.service.SampleDataGenerator} 的行為：
     * <ul>
     *   <li>{@code users} 中 25% 為講師，其餘為學生</li>
     *   <li>{@code courses} 上限為可用課程標題數 (8)</li>
     *   <li>{@code enrollments} 與 {@code submissions} 為嘗試筆數，實際筆數可能較少</li>
     * </ul>
     *
     * @param enabled 啟動時是否清空並重新產生範例資料，預設 false
     * @param seed 隨機種子，null 表示每次不同
     * @param users 用戶數，預設 20
     * @param courses 課程數，預設 8
     * @param lessons 單元數，預設 25
     * @param assignments 作業數，預設 10
     * @param enrollments 選課嘗試數，預設 15
     * @param submissions 繳交嘗試數，預設 12
     * @param maxPairAttempts 尋找未使用 (學生, 課程) 組合的最大嘗試次數，預設 50
     */
    public record SampleDataConfig(
        boolean enabled,
        Long seed,
        int users,
        int courses,
        int lessons,
        int assignments,
        int enrollments,
        int submissions,
        int maxPairAttempts
    ) {
        public SampleDataConfig {
            if (users <= 0) {
                users = 20;
            }
            if (courses <= 0) {
                courses = 8;
            }
            if (lessons <= 0) {
                lessons = 25;
            }
            if (assignments <= 0) {
                assignments = 10;
            }
            if (enrollments <= 0) {
                enrollments = 15;
            }
            if (submissions <= 0) {
                submissions = 12;
            }
            if (maxPairAttempts <= 0) {
                maxPairAttempts = 50;
            }
        }

        /**
         * 建立預設範例資料設定（不自動產生）。
         */
        public static SampleDataConfig defaults() {
            return new SampleDataConfig(false, null, 20, 8, 25, 10, 15, 12, 50);
        }
    }

    /**
     * JSON 匯出設定。
     *
     * @param enabled 啟動流程結束時是否匯出全部集合
     * @param file 匯出檔名，預設 {@code sample_data.json}
     */
    public record ExportConfig(
        boolean enabled,
        String file
    ) {
        public ExportConfig {
            if (file == null || file.isBlank()) {
                file = "sample_data.json";
            }
        }

        public static ExportConfig defaults() {
            return new ExportConfig(false, "sample_data.json");
        }
    }

    /**
     * 統計報表設定。
     *
     * <p>若設定 {@code snapshotFile}，報表改為離線分析該匯出檔，不讀取資料庫。
     *
     * @param enabled 啟動時是否輸出統計報表
     * @param snapshotFile 離線分析用的匯出檔路徑，空白表示分析資料庫
     */
    public record ReportConfig(
        boolean enabled,
        String snapshotFile
    ) {
        public ReportConfig {
            if (snapshotFile != null && snapshotFile.isBlank()) {
                snapshotFile = null;
            }
        }

        public static ReportConfig defaults() {
            return new ReportConfig(false, null);
        }

        public boolean offline() {
            return snapshotFile != null;
        }
    }
}
