package warden.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Locale;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import warden.core.model.ratelimit.DecisionReason;
import warden.core.port.out.Metrics;

/**
 * Records enforcement metrics using Micrometer.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code warden.decisions.total} - Decisions by endpoint, reason and outcome</li>
 *   <li>{@code warden.store.timeouts.total} - Counter store timeouts by store and operation</li>
 *   <li>{@code warden.store.failures.total} - Counter store failures by store and operation</li>
 *   <li>{@code warden.violations.dropped.total} - Violations dropped on a full monitor queue</li>
 *   <li>{@code warden.blocks.total} - Blocks created</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerMetrics implements Metrics {

    private final MeterRegistry registry;

    @Inject
    public MicrometerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public boolean isEnabled() {
        return registry != null;
    }

    @Override
    public void recordDecision(String endpoint, DecisionReason reason, boolean allowed) {
        Counter.builder("warden.decisions.total")
                .description("Enforcement decisions")
                .tag("endpoint", endpoint)
                .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                .tag("allowed", String.valueOf(allowed))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreTimeout(String store, String operation) {
        Counter.builder("warden.store.timeouts.total")
                .description("Counter store operations that timed out")
                .tag("store", store)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String store, String operation) {
        Counter.builder("warden.store.failures.total")
                .description("Counter store operations that failed")
                .tag("store", store)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordViolationDropped() {
        Counter.builder("warden.violations.dropped.total")
                .description("Violations dropped because the monitor queue was full")
                .register(registry)
                .increment();
    }

    @Override
    public void recordBlock() {
        Counter.builder("warden.blocks.total")
                .description("Identifiers blocked")
                .register(registry)
                .increment();
    }
}
