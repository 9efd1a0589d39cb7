package io.github.samzhu.eduhub;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import io.github.samzhu.eduhub.config.EduhubProperties;
import io.github.samzhu.eduhub.pipeline.InMemoryPipelineExecutor;
import io.github.samzhu.eduhub.service.AnalyticsReportPrinter;
import io.github.samzhu.eduhub.service.CourseAnalyticsService;
import io.github.samzhu.eduhub.service.DataExportService;
import io.github.samzhu.eduhub.service.DataImportService;
import io.github.samzhu.eduhub.service.DatabaseInfoService;
import io.github.samzhu.eduhub.service.SampleDataLoader;

/**
 * 啟動流程，在 {@link io.github.samzhu.eduhub.config.SchemaInitializer} 之後執行。
 *
 * <p>依 {@code eduhub.*} 設定決定要執行的步驟：
 * <pre>
 * sample-data.enabled → 清空並寫入範例資料
 * report.enabled      → snapshot-file 有設定：離線分析匯出檔
 *                       否則：輸出資料庫概況與統計報表
 * export.enabled      → 匯出全部集合為 JSON
 * </pre>
 */
@Component
@Order(10)
public class EduhubRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(EduhubRunner.class);

    private final EduhubProperties properties;
    private final SampleDataLoader sampleDataLoader;
    private final CourseAnalyticsService analyticsService;
    private final DatabaseInfoService databaseInfoService;
    private final DataExportService exportService;
    private final DataImportService importService;
    private final AnalyticsReportPrinter reportPrinter;

    public EduhubRunner(
            EduhubProperties properties,
            SampleDataLoader sampleDataLoader,
            CourseAnalyticsService analyticsService,
            DatabaseInfoService databaseInfoService,
            DataExportService exportService,
            DataImportService importService,
            AnalyticsReportPrinter reportPrinter) {
        this.properties = properties;
        this.sampleDataLoader = sampleDataLoader;
        this.analyticsService = analyticsService;
        this.databaseInfoService = databaseInfoService;
        this.exportService = exportService;
        this.importService = importService;
        this.reportPrinter = reportPrinter;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (properties.sampleData().enabled()) {
            reportPrinter.printCounts("Sample data inserted", sampleDataLoader.populate());
        }
        if (properties.report().enabled()) {
            if (properties.report().offline()) {
                runOfflineReport(Path.of(properties.report().snapshotFile()));
            } else {
                reportPrinter.printDatabaseInfo(databaseInfoService.retrieveDatabaseInfo());
                reportPrinter.printReport(analyticsService);
            }
        }
        if (properties.export().enabled()) {
            reportPrinter.printCounts("Exported", exportService.exportSampleData(Path.of(properties.export().file())));
        }
    }

    void runOfflineReport(Path snapshotFile) {
        log.info("Running offline report on snapshot: {}", snapshotFile);
        Map<String, List<Document>> snapshot = importService.readSnapshot(snapshotFile);
        if (snapshot.isEmpty()) {
            log.warn("Snapshot is empty or unreadable, report skipped: {}", snapshotFile);
            return;
        }
        reportPrinter.printReport(new CourseAnalyticsService(new InMemoryPipelineExecutor(snapshot)));
    }
}
