package com.deepansh.collab.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Strongly-typed engine configuration.
 * Bound from application.yml under the "collab" prefix.
 */
@ConfigurationProperties(prefix = "collab")
@Data
public class CollabProperties {

    private Presence presence = new Presence();
    private Sessions sessions = new Sessions();
    private Chat chat = new Chat();
    private Fanout fanout = new Fanout();
    private Media media = new Media();
    private Idempotency idempotency = new Idempotency();

    /** Per-type policy overrides keyed by wire name, e.g. "reading". */
    private Map<String, TypeOverride> types = new HashMap<>();

    @Data
    public static class Presence {
        /** How long a dropped participant keeps their seat, role and turn position. */
        private Duration graceWindow = Duration.ofSeconds(45);
        private Duration cursorThrottle = Duration.ofMillis(16);
        private boolean excludeCursorOriginator = true;
    }

    @Data
    public static class Sessions {
        private Duration idleTimeout = Duration.ofMinutes(30);
        /** How long a completed session stays readable for still-attached clients. */
        private Duration retention = Duration.ofMinutes(2);
        private long janitorIntervalMs = 30_000;
        private int snapshotMessageLimit = 50;
    }

    @Data
    public static class Chat {
        private int maxContentLength = 2000;
        private Duration typingTimeout = Duration.ofSeconds(5);
        private RateLimit rateLimit = new RateLimit();

        @Data
        public static class RateLimit {
            private int limitForPeriod = 20;
            private Duration refreshPeriod = Duration.ofSeconds(10);
        }
    }

    @Data
    public static class Fanout {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        /** A recipient lagging further behind than this is disconnected. */
        private int maxPendingEvents = 512;
    }

    @Data
    public static class Media {
        private boolean enabled = false;
        private String baseUrl = "http://localhost:9090";
        private String apiKey = "";
        private int connectTimeoutMs = 3000;
        private int readTimeoutMs = 5000;
    }

    @Data
    public static class Idempotency {
        /** How long a REST create response is replayed for the same key. */
        private Duration ttl = Duration.ofHours(24);
    }

    /** Null fields keep the type's built-in default. */
    @Data
    public static class TypeOverride {
        private Integer minParticipants;
        private Integer maxParticipants;
        private Boolean closedToJoinsWhenActive;
        private Boolean turnAdvances;
        private Boolean hostFirst;
        private String defaultLayout;
    }
}
