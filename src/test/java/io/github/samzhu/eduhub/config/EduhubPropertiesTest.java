package io.github.samzhu.eduhub.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class EduhubPropertiesTest {

    @Test
    void missingSectionsShouldFallBackToDefaults() {
        // When
        EduhubProperties properties = new EduhubProperties(null, null, null);

        // Then
        assertThat(properties.sampleData().enabled()).isFalse();
        assertThat(properties.sampleData().users()).isEqualTo(20);
        assertThat(properties.sampleData().maxPairAttempts()).isEqualTo(50);
        assertThat(properties.export().file()).isEqualTo("sample_data.json");
        assertThat(properties.report().offline()).isFalse();
    }

    @Test
    void nonPositiveCountsShouldUseDefaults() {
        // When
        EduhubProperties.SampleDataConfig config =
            new EduhubProperties.SampleDataConfig(true, 7L, 0, -1, 0, 0, 0, 0, 0);

        // Then
        assertThat(config.users()).isEqualTo(20);
        assertThat(config.courses()).isEqualTo(8);
        assertThat(config.lessons()).isEqualTo(25);
        assertThat(config.seed()).isEqualTo(7L);
    }

    @Test
    void blankSnapshotFileShouldMeanOnlineReport() {
        assertThat(new EduhubProperties.ReportConfig(true, " ").offline()).isFalse();
        assertThat(new EduhubProperties.ReportConfig(true, "sample_data.json").offline()).isTrue();
    }
}
