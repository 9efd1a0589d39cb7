package io.github.samzhu.eduhub;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.eduhub.config.EduhubProperties;
import io.github.samzhu.eduhub.config.EduhubProperties.ExportConfig;
import io.github.samzhu.eduhub.config.EduhubProperties.ReportConfig;
import io.github.samzhu.eduhub.config.EduhubProperties.SampleDataConfig;
import io.github.samzhu.eduhub.service.AnalyticsReportPrinter;
import io.github.samzhu.eduhub.service.CourseAnalyticsService;
import io.github.samzhu.eduhub.service.DataExportService;
import io.github.samzhu.eduhub.service.DataImportService;
import io.github.samzhu.eduhub.service.DatabaseInfoService;
import io.github.samzhu.eduhub.service.SampleDataLoader;

class EduhubRunnerTest {

    private SampleDataLoader sampleDataLoader;
    private CourseAnalyticsService analyticsService;
    private DatabaseInfoService databaseInfoService;
    private DataExportService exportService;
    private DataImportService importService;
    private AnalyticsReportPrinter reportPrinter;

    @BeforeEach
    void setUp() {
        sampleDataLoader = mock(SampleDataLoader.class);
        analyticsService = mock(CourseAnalyticsService.class);
        databaseInfoService = mock(DatabaseInfoService.class);
        exportService = mock(DataExportService.class);
        importService = mock(DataImportService.class);
        reportPrinter = mock(AnalyticsReportPrinter.class);
    }

    @Test
    void defaultsShouldDoNothing() {
        // Given
        EduhubRunner runner = runner(new EduhubProperties(null, null, null));

        // When
        runner.run(null);

        // Then
        verifyNoInteractions(sampleDataLoader, databaseInfoService, exportService, importService, reportPrinter);
    }

    @Test
    void shouldPopulateReportAndExportWhenEnabled() {
        // Given
        EduhubProperties properties = new EduhubProperties(
            new SampleDataConfig(true, 42L, 20, 8, 25, 10, 15, 12, 50),
            new ExportConfig(true, "out.json"),
            new ReportConfig(true, null));
        when(sampleDataLoader.populate()).thenReturn(Map.of("users", 20));

        // When
        runner(properties).run(null);

        // Then
        verify(reportPrinter).printCounts("Sample data inserted", Map.of("users", 20));
        verify(databaseInfoService).retrieveDatabaseInfo();
        verify(reportPrinter).printReport(analyticsService);
        verify(exportService).exportSampleData(Path.of("out.json"));
    }

    @Test
    void offlineReportShouldAnalyseSnapshotInsteadOfDatabase() {
        // Given
        EduhubProperties properties = new EduhubProperties(null, null, new ReportConfig(true, "snapshot.json"));
        when(importService.readSnapshot(Path.of("snapshot.json")))
            .thenReturn(Map.of("enrollments", List.of(new Document("status", "active"))));

        // When
        runner(properties).run(null);

        // Then
        verifyNoInteractions(databaseInfoService);
        verify(reportPrinter, never()).printReport(analyticsService);
        verify(reportPrinter).printReport(any(CourseAnalyticsService.class));
    }

    @Test
    void unreadableSnapshotShouldSkipReport() {
        // Given
        EduhubProperties properties = new EduhubProperties(null, null, new ReportConfig(true, "missing.json"));
        when(importService.readSnapshot(eq(Path.of("missing.json")))).thenReturn(Map.of());

        // When
        runner(properties).run(null);

        // Then
        verifyNoInteractions(reportPrinter);
    }

    private EduhubRunner runner(EduhubProperties properties) {
        return new EduhubRunner(properties, sampleDataLoader, analyticsService, databaseInfoService,
            exportService, importService, reportPrinter);
    }
}
