package com.webresearch.core.service.telemetry;

import com.webresearch.core.config.ResearchProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Creates one {@link TelemetryEngine} per research session, sharing the stop timer and error counter.
 */
@Component
public class TelemetryEngineFactory {

    private final ResearchProperties properties;
    private final Clock clock;
    private final Timer stopTimer;
    private final Counter errorCounter;

    public TelemetryEngineFactory(ResearchProperties properties, Clock clock, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.clock = clock;
        this.stopTimer = Timer.builder("research.stop.duration")
                .description("Time from stop request to stop condition reported")
                .register(meterRegistry);
        this.errorCounter = Counter.builder("research.telemetry.errors")
                .description("Errors recorded by research sessions")
                .register(meterRegistry);
    }

    public TelemetryEngine create(String sessionId) {
        return new TelemetryEngine(sessionId, properties.getTelemetry(), clock, stopTimer, errorCounter);
    }
}
