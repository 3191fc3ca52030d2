package com.webresearch.core.config;

import com.webresearch.core.entity.OperatorMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Externalized settings of the research core.
 *
 * Defaults mirror the engine's built-in behaviour:
 * - Page cache: 100 entries, 30 min
 * - Extraction / query cache: 1,000 entries, 1 h
 * - Domain map: 1,000 entries, 24 h
 * - Telemetry log: 10,000 events, 1 h, 200 ms stop target
 */
@Configuration
@ConfigurationProperties(prefix = "research")
@Data
public class ResearchProperties {

    private Planner planner = new Planner();

    private Cache cache = new Cache();

    private Telemetry telemetry = new Telemetry();

    private Source source = new Source();

    private Engine engine = new Engine();

    private Maintenance maintenance = new Maintenance();

    @Data
    public static class Planner {
        /** Mode used when the objective does not name one */
        private OperatorMode defaultMode = OperatorMode.STANDARD;

        private double defaultConfidenceThreshold = 0.8;

        /** Required confidence of classified questions */
        private double defaultRequiredConfidence = 0.7;

        /** Secondary category paths per plan */
        private int maxCategoryPaths = 3;

        /** Domains covered by the verification path */
        private int verificationDomainLimit = 5;

        /** Source-intelligence candidates pulled per detected source category */
        private int candidatesPerCategory = 2;
    }

    @Data
    public static class Cache {
        private Region page = new Region(100, Duration.ofMinutes(30));
        private Region extraction = new Region(1000, Duration.ofHours(1));
        private Region domainMap = new Region(1000, Duration.ofHours(24));
        private Region query = new Region(1000, Duration.ofHours(1));
    }

    @Data
    public static class Region {
        private int maxSize;
        private Duration ttl;

        public Region() {
        }

        public Region(int maxSize, Duration ttl) {
            this.maxSize = maxSize;
            this.ttl = ttl;
        }
    }

    @Data
    public static class Telemetry {
        private int maxEvents = 10_000;
        private Duration maxEventAge = Duration.ofHours(1);
        private Duration stopTarget = Duration.ofMillis(200);
        /** Per-channel buffer of subscriber sinks */
        private int subscriberBuffer = 256;
    }

    @Data
    public static class Source {
        /** EMA weight for success rate, extraction yield and pattern reliability */
        private double smoothingAlpha = 0.3;

        /** EMA weight for pairwise domain agreement */
        private double consistencyAlpha = 0.2;

        /** Domains whose success rate decays below this are avoided */
        private double avoidSuccessRate = 0.2;

        /** Scores untouched for this long decay toward neutral during maintenance */
        private Duration staleAfter = Duration.ofDays(7);

        /** Fraction of the distance to neutral removed per maintenance pass */
        private double staleDecay = 0.1;
    }

    @Data
    public static class Engine {
        /** Upper bound on concurrently running paths regardless of plan budgets */
        private int parallelism = 3;

        /** Extractions scoring below this after confidence rules are ignored */
        private double minExtractionConfidence = 0.0;

        private Duration pausePollInterval = Duration.ofMillis(50);

        /** Finished sessions older than this are evicted during maintenance */
        private Duration claimRetention = Duration.ofHours(24);
    }

    @Data
    public static class Maintenance {
        private boolean enabled = true;
        private long intervalMs = 300_000;
    }
}
