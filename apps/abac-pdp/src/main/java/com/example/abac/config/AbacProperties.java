package com.example.abac.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "abac")
public class AbacProperties {

    private Cache cache = new Cache();
    private Audit audit = new Audit();
    private Statistics statistics = new Statistics();
    private CorePolicies corePolicies = new CorePolicies();

    @Data
    public static class Cache {
        // only consumed through the ${abac.cache.refresh-interval} placeholder on PolicyCache.scheduledRefresh
        private Duration refreshInterval = Duration.ofMinutes(5);
        private Duration loadTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Audit {
        private int queueCapacity = 10_000;
        private Duration writeTimeout = Duration.ofSeconds(5);
        private Duration shutdownTimeout = Duration.ofSeconds(10);
        private Duration retention = Duration.ofDays(30);
        private int inMemoryCapacity = 10_000;  // ring size of the in-memory decision log
    }

    @Data
    public static class Statistics {
        private int topPolicies = 10;
        private int recentDenials = 10;
    }

    @Data
    public static class CorePolicies {
        private boolean initializeOnStartup = true;
        private String systemActorId = "system";
    }
}
