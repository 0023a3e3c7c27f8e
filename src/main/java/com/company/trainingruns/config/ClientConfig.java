package com.company.trainingruns.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(TrainingRunProperties.class)
@Slf4j
public class ClientConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Every tracker call is bounded by the connect and read timeouts.
     */
    @Bean
    public RestTemplate trackerRestTemplate(RestTemplateBuilder builder, TrainingRunProperties properties) {
        TrainingRunProperties.Tracker tracker = properties.getTracker();

        RestTemplateBuilder configured = builder
                .rootUri(tracker.getBaseUrl())
                .setConnectTimeout(tracker.getConnectTimeout())
                .setReadTimeout(tracker.getReadTimeout());

        if (tracker.getApiKey() != null && !tracker.getApiKey().isBlank()) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + tracker.getApiKey());
        } else {
            log.warn("No tracker API key configured, requests will be unauthenticated");
        }

        return configured.build();
    }
}
