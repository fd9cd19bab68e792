package com.defimonitor.config;

import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Bounds every MongoDB call so a stalled server surfaces as a storage error instead of
 * blocking the scheduler thread.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoClientSettingsBuilderCustomizer storageTimeouts(AppProps props) {
        AppProps.Storage storage = props.getStorage();
        return builder -> builder
                .applyToSocketSettings(s -> s
                        .connectTimeout(storage.getTimeoutMs(), MILLISECONDS)
                        .readTimeout(storage.getTimeoutMs(), MILLISECONDS))
                .applyToClusterSettings(c -> c
                        .serverSelectionTimeout(storage.getServerSelectionTimeoutMs(), MILLISECONDS))
                .applyToConnectionPoolSettings(p -> p
                        .maxWaitTime(storage.getTimeoutMs(), MILLISECONDS));
    }
}
