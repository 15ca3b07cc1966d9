package com.journeytide.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralizes engine, topic and gateway configuration.
 *
 * Bound from application.yml under "journeys" prefix:
 *   journeys:
 *     topics:
 *       callbacks: journeys.callbacks
 *       analytics: journeys.analytics
 *       dlq: journeys.dlq
 *     sweep:
 *       enabled: true
 *       interval-ms: 60000
 *     test:
 *       phone-numbers: ["+15550001111"]
 *     gateway:
 *       phone-number-id: ...
 *       access-token: ...
 *
 * Services inject this instead of hardcoding topic names, lock timings or
 * gateway credentials.
 */
@Component
@ConfigurationProperties(prefix = "journeys")
@Getter
@Setter
public class JourneyEngineProperties {

    private Topics topics = new Topics();
    private Sweep sweep = new Sweep();
    private Test test = new Test();
    private Gateway gateway = new Gateway();
    private Dedup dedup = new Dedup();

    @Getter
    @Setter
    public static class Topics {
        private String callbacks = "journeys.callbacks";
        private String analytics = "journeys.analytics";
        private String dlq = "journeys.dlq";
    }

    @Getter
    @Setter
    public static class Sweep {
        private boolean enabled = true;
        private long intervalMs = 60_000;
        /** Must outlive the slowest sweep, or two instances may overlap. */
        private long lockTtlSeconds = 600;
        private boolean includeTestJourneys = true;
        private int maxStepsPerAdvance = 50;
        private long enrollmentLeaseSeconds = 30;
    }

    /**
     * Global test audience, merged with each journey's own test lists.
     */
    @Getter
    @Setter
    public static class Test {
        private List<String> phoneNumbers = new ArrayList<>();
        private List<String> customerIds = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Gateway {
        private String baseUrl = "https://graph.facebook.com/v18.0";
        private String phoneNumberId;
        private String accessToken;
        private int connectTimeoutMs = 5_000;
        private int readTimeoutMs = 10_000;
        private String defaultLanguage = "en";
    }

    @Getter
    @Setter
    public static class Dedup {
        private long ttlHours = 24;
    }
}
