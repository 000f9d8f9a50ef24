package warden.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.ratelimit.DecisionReason;

@DisplayName("MicrometerMetrics")
class MicrometerMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerMetrics(registry);
    }

    @Test
    @DisplayName("should count decisions by endpoint, reason and outcome")
    void shouldCountDecisions() {
        metrics.recordDecision("auth.login", DecisionReason.WITHIN_LIMIT, true);
        metrics.recordDecision("auth.login", DecisionReason.WITHIN_LIMIT, true);
        metrics.recordDecision("auth.login", DecisionReason.LIMIT_EXCEEDED, false);

        assertTrue(metrics.isEnabled());
        assertEquals(2.0, registry.get("warden.decisions.total")
                .tag("endpoint", "auth.login")
                .tag("reason", "within_limit")
                .tag("allowed", "true")
                .counter()
                .count());
        assertEquals(1.0, registry.get("warden.decisions.total")
                .tag("reason", "limit_exceeded")
                .tag("allowed", "false")
                .counter()
                .count());
    }

    @Test
    @DisplayName("should count store timeouts and failures separately")
    void shouldCountStoreProblems() {
        metrics.recordStoreTimeout("redis", "incrementWithExpiry");
        metrics.recordStoreFailure("redis", "get");

        assertEquals(1.0, registry.get("warden.store.timeouts.total")
                .tag("operation", "incrementWithExpiry")
                .counter()
                .count());
        assertEquals(1.0, registry.get("warden.store.failures.total")
                .tag("store", "redis")
                .tag("operation", "get")
                .counter()
                .count());
    }

    @Test
    @DisplayName("should count dropped violations and blocks")
    void shouldCountMonitorEvents() {
        metrics.recordViolationDropped();
        metrics.recordBlock();
        metrics.recordBlock();

        assertEquals(1.0, registry.get("warden.violations.dropped.total").counter().count());
        assertEquals(2.0, registry.get("warden.blocks.total").counter().count());
    }
}
