package warden.core.service.abuse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.TestConfigs;
import warden.adapter.out.store.memory.InMemoryCounterStore;
import warden.core.config.AbuseDetectionConfig;
import warden.core.model.abuse.AlertSeverity;
import warden.core.model.abuse.AlertType;
import warden.core.model.abuse.MonitorState;
import warden.core.model.abuse.SecurityAlert;
import warden.core.model.abuse.Violation;
import warden.core.port.out.Metrics;
import warden.core.service.StoreKeys;
import warden.spi.CounterStore;
import warden.spi.StoreUnavailableException;

@DisplayName("ViolationMonitor")
@ExtendWith(MockitoExtension.class)
class ViolationMonitorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);
    private static final StoreKeys KEYS = new StoreKeys("test:");

    @Mock
    private Metrics metrics;

    private InMemoryCounterStore store;
    private BlockList blockList;
    private ViolationMonitor monitor;
    private List<SecurityAlert> received;

    @BeforeEach
    void setUp() {
        store = new InMemoryCounterStore();
        blockList = new BlockList(store, KEYS, metrics);
        monitor = new ViolationMonitor(TestConfigs.abuseDetection(), store, blockList, KEYS, metrics);
        received = new CopyOnWriteArrayList<>();
        monitor.subscribe(received::add);
    }

    @AfterEach
    void tearDown() {
        monitor.stop();
        store.shutdown();
    }

    private List<SecurityAlert> process(String identifier, String endpoint) {
        return monitor.process(Violation.now(identifier, endpoint, Map.of())).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("Brute force detection")
    class BruteForceTests {

        @Test
        @DisplayName("should watch an identifier below the threshold")
        void shouldWatchBelowThreshold() {
            assertEquals(MonitorState.CLEAN, monitor.stateOf("1.2.3.4"));

            process("1.2.3.4", "auth.login");
            process("1.2.3.4", "auth.login");

            assertTrue(received.isEmpty());
            assertEquals(MonitorState.WATCHING, monitor.stateOf("1.2.3.4"));
            assertFalse(monitor.isBlocked("1.2.3.4").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should alert once and block on the third login violation")
        void shouldAlertAndBlockOnThreshold() {
            process("1.2.3.4", "auth.login");
            process("1.2.3.4", "auth.login");
            final var alerts = process("1.2.3.4", "auth.login");

            assertEquals(1, alerts.size());
            final var alert = alerts.get(0);
            assertEquals(AlertType.BRUTE_FORCE, alert.type());
            assertEquals(AlertSeverity.HIGH, alert.severity());
            assertEquals("1.2.3.4", alert.identifier());
            assertEquals(3, alert.evidence().size());
            assertTrue(alert.evidence().stream().allMatch(v -> v.endpoint().equals("auth.login")));
            assertEquals(3, alert.summary().get("violations"));
            assertEquals(List.of(alert), received);
            assertTrue(monitor.isBlocked("1.2.3.4").await().atMost(TIMEOUT));
            assertEquals(MonitorState.BLOCKED, monitor.stateOf("1.2.3.4"));
            verify(metrics).recordBlock();
        }

        @Test
        @DisplayName("should carry the triggering violations with their metadata as evidence")
        void shouldCarryViolationsAsEvidence() {
            final var metadata = Map.of("ip", "1.2.3.4", "userAgent", "curl/8.0");
            List<SecurityAlert> alerts = List.of();
            for (var i = 0; i < 3; i++) {
                alerts = monitor.process(Violation.now("1.2.3.4", "auth.login", metadata))
                        .await()
                        .atMost(TIMEOUT);
            }

            assertEquals(1, alerts.size());
            final var evidence = alerts.get(0).evidence();
            assertEquals(3, evidence.size());
            assertTrue(evidence.stream().allMatch(v -> v.metadata().equals(metadata)));
            assertFalse(evidence.get(0).timestamp().isAfter(evidence.get(2).timestamp()));
            assertEquals(List.of("auth.login"), alerts.get(0).summary().get("endpoints"));
        }

        @Test
        @DisplayName("should suppress further alerts within the cooldown while keeping the block")
        void shouldSuppressWithinCooldown() {
            for (var i = 0; i < 3; i++) {
                process("1.2.3.4", "auth.login");
            }

            final var fourth = process("1.2.3.4", "auth.login");

            assertTrue(fourth.isEmpty());
            assertEquals(1, received.size());
            assertTrue(monitor.isBlocked("1.2.3.4").await().atMost(TIMEOUT));
            verify(metrics, times(1)).recordBlock();
        }

        @Test
        @DisplayName("should report the blocked state until the block ends even after the retention has passed")
        void shouldKeepBlockedStateBeyondRetention() throws InterruptedException {
            final var config = TestConfigs.abuseDetection();
            when(config.retention()).thenReturn(Duration.ofMillis(200));
            when(config.blockDuration()).thenReturn(Duration.ofSeconds(30));
            final var shortLived = new ViolationMonitor(config, store, blockList, KEYS, metrics);
            try {
                for (var i = 0; i < 3; i++) {
                    shortLived.process(Violation.now("5.6.7.8", "auth.login", Map.of()))
                            .await()
                            .atMost(TIMEOUT);
                }
                assertEquals(MonitorState.BLOCKED, shortLived.stateOf("5.6.7.8"));

                Thread.sleep(500);

                assertEquals(MonitorState.BLOCKED, shortLived.stateOf("5.6.7.8"));
            } finally {
                shortLived.stop();
            }
        }

        @Test
        @DisplayName("should match login endpoints by pattern")
        void shouldMatchLoginEndpointsByPattern() {
            process("user-7", "admin.login");
            process("user-7", "login");
            final var alerts = process("user-7", "partner.login");

            assertEquals(1, alerts.size());
            assertEquals(AlertType.BRUTE_FORCE, alerts.get(0).type());
        }

        @Test
        @DisplayName("should ignore violations on other endpoints")
        void shouldIgnoreOtherEndpoints() {
            for (var i = 0; i < 5; i++) {
                process("1.2.3.4", "api.search");
            }

            assertTrue(received.isEmpty());
            assertFalse(monitor.isBlocked("1.2.3.4").await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("API abuse detection")
    class ApiAbuseTests {

        @Test
        @DisplayName("should flag without blocking at the threshold")
        void shouldFlagAtThreshold() {
            final var alerts = new ArrayList<SecurityAlert>();
            for (var i = 0; i < 10; i++) {
                alerts.addAll(process("scraper", "api.search"));
            }

            assertEquals(1, alerts.size());
            assertEquals(AlertType.API_ABUSE, alerts.get(0).type());
            assertEquals(AlertSeverity.MEDIUM, alerts.get(0).severity());
            assertEquals(MonitorState.FLAGGED, monitor.stateOf("scraper"));
            assertFalse(monitor.isBlocked("scraper").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should block at the escalation threshold even while the alert is suppressed")
        void shouldBlockOnEscalation() {
            for (var i = 0; i < 50; i++) {
                process("scraper", "api.search");
            }

            assertEquals(1, received.size());
            assertEquals(AlertSeverity.MEDIUM, received.get(0).severity());
            assertTrue(monitor.isBlocked("scraper").await().atMost(TIMEOUT));
            assertEquals(MonitorState.BLOCKED, monitor.stateOf("scraper"));
        }
    }

    @Nested
    @DisplayName("Store failures")
    class StoreFailureTests {

        @Mock
        private CounterStore failingStore;

        @Test
        @DisplayName("should publish the alert when the cooldown cannot be checked")
        void shouldPublishWhenCooldownUnavailable() {
            when(failingStore.setIfAbsent(anyString(), anyString(), anyLong()))
                    .thenReturn(Uni.createFrom().failure(new StoreUnavailableException("setIfAbsent", "down")));
            final var failingMonitor = new ViolationMonitor(
                    TestConfigs.abuseDetection(),
                    failingStore,
                    new BlockList(failingStore, KEYS, metrics),
                    KEYS,
                    metrics);
            final var alerts = new ArrayList<SecurityAlert>();
            failingMonitor.subscribe(alerts::add);

            for (var i = 0; i < 3; i++) {
                failingMonitor.process(Violation.now("1.2.3.4", "auth.login", Map.of())).await().atMost(TIMEOUT);
            }

            assertEquals(1, alerts.size());
            assertEquals(MonitorState.FLAGGED, failingMonitor.stateOf("1.2.3.4"));
        }
    }

    @Nested
    @DisplayName("subscribe()")
    class SubscribeTests {

        @Test
        @DisplayName("should isolate handlers from each other")
        void shouldIsolateHandlers() {
            final var second = new ArrayList<SecurityAlert>();
            monitor.subscribe(alert -> {
                throw new IllegalStateException("handler failure");
            });
            monitor.subscribe(second::add);

            for (var i = 0; i < 3; i++) {
                process("1.2.3.4", "auth.login");
            }

            assertEquals(1, received.size());
            assertEquals(1, second.size());
        }

        @Test
        @DisplayName("should stop delivering after unsubscribe")
        void shouldStopAfterUnsubscribe() {
            final var alerts = new ArrayList<SecurityAlert>();
            final var subscription = monitor.subscribe(alerts::add);
            subscription.unsubscribe();
            subscription.unsubscribe();

            for (var i = 0; i < 3; i++) {
                process("1.2.3.4", "auth.login");
            }

            assertTrue(alerts.isEmpty());
            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("recordViolation()")
    class RecordViolationTests {

        @Test
        @DisplayName("should process queued violations on the background worker")
        void shouldProcessOnWorker() throws InterruptedException {
            final var latch = new CountDownLatch(1);
            monitor.subscribe(alert -> latch.countDown());
            monitor.start();

            for (var i = 0; i < 3; i++) {
                assertTrue(monitor.recordViolation(Violation.now("1.2.3.4", "auth.login", Map.of())));
            }

            assertTrue(latch.await(2, TimeUnit.SECONDS));
            assertEquals(AlertType.BRUTE_FORCE, received.get(0).type());
        }

        @Test
        @DisplayName("should drop violations when the queue is full")
        void shouldDropWhenQueueFull() {
            final var small = new ViolationMonitor(TestConfigs.abuseDetection(2), store, blockList, KEYS, metrics);

            assertTrue(small.recordViolation(Violation.now("a", "api.search", Map.of())));
            assertTrue(small.recordViolation(Violation.now("a", "api.search", Map.of())));
            assertFalse(small.recordViolation(Violation.now("a", "api.search", Map.of())));

            assertEquals(2, small.pendingViolations());
            verify(metrics, times(1)).recordViolationDropped();
        }

        @Test
        @DisplayName("should discard violations when detection is disabled")
        void shouldDiscardWhenDisabled() {
            final AbuseDetectionConfig config = TestConfigs.abuseDetection();
            when(config.enabled()).thenReturn(false);
            final var disabled = new ViolationMonitor(config, store, blockList, KEYS, metrics);

            assertFalse(disabled.recordViolation(Violation.now("a", "api.search", Map.of())));
            verify(metrics, never()).recordViolationDropped();
        }
    }

    @Nested
    @DisplayName("Unblocking")
    class UnblockTests {

        @Test
        @DisplayName("should clear history and cooldowns on unblock")
        void shouldClearOnUnblock() {
            for (var i = 0; i < 3; i++) {
                process("1.2.3.4", "auth.login");
            }

            assertTrue(monitor.unblock("1.2.3.4").await().atMost(TIMEOUT));

            assertEquals(MonitorState.CLEAN, monitor.stateOf("1.2.3.4"));
            assertTrue(monitor.recentViolations("1.2.3.4").isEmpty());
            assertFalse(monitor.isBlocked("1.2.3.4").await().atMost(TIMEOUT));

            for (var i = 0; i < 3; i++) {
                process("1.2.3.4", "auth.login");
            }
            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("should return to clean once the block expires")
        void shouldReturnToCleanAfterExpiry() throws InterruptedException {
            final AbuseDetectionConfig config = TestConfigs.abuseDetection();
            when(config.blockDuration()).thenReturn(Duration.ofMillis(200));
            final var shortBlocks = new ViolationMonitor(config, store, blockList, KEYS, metrics);
            for (var i = 0; i < 3; i++) {
                shortBlocks.process(Violation.now("1.2.3.4", "auth.login", Map.of())).await().atMost(TIMEOUT);
            }
            assertEquals(MonitorState.BLOCKED, shortBlocks.stateOf("1.2.3.4"));

            Thread.sleep(300);

            assertEquals(MonitorState.CLEAN, shortBlocks.stateOf("1.2.3.4"));
            assertFalse(shortBlocks.isBlocked("1.2.3.4").await().atMost(TIMEOUT));
        }
    }
}
