package com.phillippitts.sttguard.service.metrics;

import com.phillippitts.sttguard.service.protocol.DecodeError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Centralized metrics tracking for data-channel integrity checks.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Verdicts per result (pass, fail)</li>
 *   <li>Frames that skipped verification</li>
 *   <li>Decode errors per kind</li>
 *   <li>Connections opened, closed and rejected</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class IntegrityMetrics {

    private static final String METRIC_PREFIX = "sttguard.integrity";

    private final MeterRegistry registry;

    public IntegrityMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts one verification verdict.
     *
     * @param ok whether the frame passed
     */
    public void recordVerdict(boolean ok) {
        Counter.builder(METRIC_PREFIX + ".verdicts")
                .description("Number of verified frames by result")
                .tag("result", ok ? "pass" : "fail")
                .register(registry)
                .increment();
    }

    public void incrementSkipped() {
        Counter.builder(METRIC_PREFIX + ".skipped")
                .description("Number of frames accepted without verification")
                .register(registry)
                .increment();
    }

    public void incrementDecodeError(DecodeError error) {
        Counter.builder(METRIC_PREFIX + ".decode.errors")
                .description("Number of dropped undecodable frames")
                .tag("error", error.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void incrementRejections() {
        Counter.builder(METRIC_PREFIX + ".rejections")
                .description("Number of connections closed for data corruption")
                .register(registry)
                .increment();
    }

    public void recordConnectionOpened() {
        connectionCounter("opened").increment();
    }

    public void recordConnectionClosed() {
        connectionCounter("closed").increment();
    }

    private Counter connectionCounter(String event) {
        return Counter.builder(METRIC_PREFIX + ".connections")
                .description("Data-channel connection lifecycle events")
                .tag("event", event)
                .register(registry);
    }
}
