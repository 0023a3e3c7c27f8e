package com.company.trainingruns.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "training-runs")
public class TrainingRunProperties {

    private Tracker tracker = new Tracker();
    private Reconciliation reconciliation = new Reconciliation();
    private Matching matching = new Matching();
    private Infrastructure infrastructure = new Infrastructure();
    private Cache cache = new Cache();
    private Security security = new Security();

    @Data
    public static class Tracker {
        private String baseUrl = "https://api.wandb.ai";
        private String apiKey;
        private String entity;
        private String project;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Reconciliation {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(10);
        private Duration initialDelay = Duration.ofMinutes(1);
        private int batchLimit = 500;
        // launched runs older than this with no tracker record are presumed dead
        private Duration staleThreshold = Duration.ofHours(2);
        private boolean markStale = true;
    }

    @Data
    public static class Matching {
        private Duration window = Duration.ofMinutes(30);
    }

    @Data
    public static class Infrastructure {
        private boolean enabled = false;
        private String region = "us-east-1";
        private Duration apiTimeout = Duration.ofSeconds(10);
        private int batchLimit = 200;
        // host labels that never have a cloud instance behind them
        private List<String> exemptHosts = new ArrayList<>(List.of("expanse"));
    }

    @Data
    public static class Cache {
        private String keyPrefix = "runs:";
        private Duration statsTtl = Duration.ofMinutes(2);
        private Duration aggregateTtl = Duration.ofMinutes(30);
    }

    @Data
    public static class Security {
        private String rolesClaim = "roles";
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
    }
}
