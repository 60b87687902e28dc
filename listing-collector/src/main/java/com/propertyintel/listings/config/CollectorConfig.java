package com.propertyintel.listings.config;

import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class CollectorConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, ListingCollectorProperties properties) {
        Duration timeout = Duration.ofSeconds(properties.getApi().getTimeoutSeconds());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    /** All lifecycle timestamps and "today" dates are taken in UTC */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Uses application default credentials */
    @Bean
    @ConditionalOnProperty(prefix = "listing-collector.archive", name = "mode", havingValue = "GCS")
    public Storage storage() {
        return StorageOptions.getDefaultInstance().getService();
    }
}
