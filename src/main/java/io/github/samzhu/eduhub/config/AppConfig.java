package io.github.samzhu.eduhub.config;

import java.time.Clock;
import java.util.Random;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link EduhubProperties} 的型別安全配置綁定，並提供範例資料產生
 * 所需的 {@link Clock} 與 {@link Random}。
 *
 * @see EduhubProperties
 */
@Configuration
@EnableConfigurationProperties(EduhubProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 範例資料用的亂數產生器，設定 {@code eduhub.sample-data.seed} 時結果可重現。
     */
    @Bean
    public Random sampleDataRandom(EduhubProperties properties) {
        Long seed = properties.sampleData().seed();
        return seed != null ? new Random(seed) : new Random();
    }
}
