package com.phillippitts.n8nsync.service.metrics;

import com.phillippitts.n8nsync.domain.SyncAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for sync operations.
 *
 * <p>Meters:
 * <ul>
 *   <li>{@code n8nsync.operation.latency} - timer per operation (pull, push, force-pull, ...)</li>
 *   <li>{@code n8nsync.operation.result} - counter per operation and resulting action</li>
 *   <li>{@code n8nsync.operation.failure} - counter per operation and exception type</li>
 *   <li>{@code n8nsync.errors} - observation errors (poll failures, malformed files)</li>
 * </ul>
 *
 * <p>Exposed at /actuator/prometheus.
 */
@Component
public class SyncMetrics {

    private static final String METRIC_PREFIX = "n8nsync";

    private final MeterRegistry registry;

    public SyncMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a completed operation.
     *
     * @param operation operation name
     * @param action what the operation did
     * @param durationNanos duration in nanoseconds
     */
    public void recordOperation(String operation, SyncAction action, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".operation.latency")
                .description("Time taken by a sync operation")
                .tag("operation", operation)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".operation.result")
                .description("Completed sync operations by resulting action")
                .tag("operation", operation)
                .tag("action", action.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void incrementFailure(String operation, String reason) {
        Counter.builder(METRIC_PREFIX + ".operation.failure")
                .description("Failed sync operations")
                .tag("operation", operation)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param kind error category, e.g. {@code remote} or {@code local}
     */
    public void incrementObservationError(String kind) {
        Counter.builder(METRIC_PREFIX + ".errors")
                .description("Errors raised while observing the directory or the remote")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
