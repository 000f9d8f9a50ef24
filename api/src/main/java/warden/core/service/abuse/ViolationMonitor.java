package warden.core.service.abuse;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.AbuseDetectionConfig;
import warden.core.config.StoreConfig;
import warden.core.model.abuse.AlertSeverity;
import warden.core.model.abuse.AlertType;
import warden.core.model.abuse.BlockEntry;
import warden.core.model.abuse.MonitorState;
import warden.core.model.abuse.SecurityAlert;
import warden.core.model.abuse.Violation;
import warden.core.port.out.Metrics;
import warden.core.service.StoreKeys;
import warden.spi.CounterStore;

/**
 * Detects abusive patterns in rate limit violations and reacts to them.
 *
 * <p>Violations are handed over from the request path through a bounded queue and
 * processed in arrival order by a single background worker. When the queue is full
 * the violation is dropped and counted; the request path never waits.
 *
 * <p>Patterns:
 * <ul>
 *   <li><b>Brute force</b> - repeated violations on login endpoints</li>
 *   <li><b>API abuse</b> - sustained violations on any endpoint, escalated to HIGH
 *       at a multiple of the threshold</li>
 * </ul>
 *
 * <p>An alert is published at most once per identifier and type per cooldown,
 * tracked in the counter store so the cooldown holds across instances. A HIGH
 * severity match blocks the identifier even while its alert is suppressed.
 */
@ApplicationScoped
public class ViolationMonitor {

    private static final Logger LOG = Logger.getLogger(ViolationMonitor.class);
    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);
    private static final Duration PROCESSING_TIMEOUT = Duration.ofSeconds(5);

    private final boolean enabled;
    private final int queueCapacity;
    private final Duration alertCooldown;
    private final Duration blockDuration;
    private final int bruteForceThreshold;
    private final Duration bruteForceWindow;
    private final AlertSeverity bruteForceSeverity;
    private final EndpointPatternMatcher loginEndpoints;
    private final int apiAbuseThreshold;
    private final Duration apiAbuseWindow;
    private final AlertSeverity apiAbuseSeverity;
    private final int escalationFactor;

    private final CounterStore store;
    private final BlockList blockList;
    private final StoreKeys keys;
    private final Metrics metrics;
    private final ViolationHistory history;
    private final BlockingQueue<Violation> queue;
    private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();

    private volatile boolean running;
    private ExecutorService worker;

    @Inject
    public ViolationMonitor(
            AbuseDetectionConfig config,
            StoreConfig storeConfig,
            CounterStore store,
            BlockList blockList,
            Metrics metrics) {
        this(config, store, blockList, new StoreKeys(storeConfig.keyPrefix()), metrics);
    }

    public ViolationMonitor(
            AbuseDetectionConfig config, CounterStore store, BlockList blockList, StoreKeys keys, Metrics metrics) {
        this.enabled = config.enabled();
        this.queueCapacity = config.queueCapacity();
        this.alertCooldown = config.alertCooldown();
        this.blockDuration = config.blockDuration();
        this.bruteForceThreshold = config.bruteForce().threshold();
        this.bruteForceWindow = config.bruteForce().window();
        this.bruteForceSeverity = config.bruteForce().severity();
        this.loginEndpoints = new EndpointPatternMatcher(config.bruteForce().endpoints());
        this.apiAbuseThreshold = config.apiAbuse().threshold();
        this.apiAbuseWindow = config.apiAbuse().window();
        this.apiAbuseSeverity = config.apiAbuse().severity();
        this.escalationFactor = config.apiAbuse().escalationFactor();
        this.store = store;
        this.blockList = blockList;
        this.keys = keys;
        this.metrics = metrics;
        this.history = new ViolationHistory(
                config.historyCapacity(), config.retention(), config.maxTrackedIdentifiers());
        this.queue = new ArrayBlockingQueue<>(config.queueCapacity());
    }

    /**
     * Start the background worker. Called by the container; tests call it directly.
     */
    @PostConstruct
    public void start() {
        if (!enabled) {
            LOG.info("Abuse detection is disabled, violations will be discarded");
            return;
        }
        if (running) {
            return;
        }
        running = true;
        worker = Executors.newSingleThreadExecutor(r -> {
            final var thread = new Thread(r, "violation-monitor");
            thread.setDaemon(true);
            return thread;
        });
        worker.submit(this::drain);
        LOG.infof(
                "Abuse detection started: brute-force %d/%s on %s, api-abuse %d/%s",
                bruteForceThreshold, bruteForceWindow, loginEndpoints.globs(), apiAbuseThreshold, apiAbuseWindow);
    }

    @PreDestroy
    public void stop() {
        running = false;
        if (worker != null) {
            worker.shutdownNow();
        }
        subscribers.clear();
    }

    /**
     * Queue a violation for analysis without blocking.
     *
     * @param violation the violation
     * @return true if queued; false if detection is disabled or the queue is full
     */
    public boolean recordViolation(Violation violation) {
        if (!enabled) {
            return false;
        }
        if (queue.offer(violation)) {
            return true;
        }
        LOG.warnv(
                "Violation queue full (capacity {0}), dropping violation for {1} on {2}",
                queueCapacity, violation.identifier(), violation.endpoint());
        if (metrics != null) {
            metrics.recordViolationDropped();
        }
        return false;
    }

    /**
     * Subscribe to security alerts.
     *
     * <p>Handlers run on the monitor worker thread. A handler that throws is logged
     * and does not affect other handlers.
     *
     * @param handler the alert handler
     * @return a subscription that removes the handler
     */
    public Subscription subscribe(Consumer<SecurityAlert> handler) {
        final var subscriber = new Subscriber(handler);
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    /**
     * @param identifier the identifier
     * @return the current monitor state
     */
    public MonitorState stateOf(String identifier) {
        return history.state(identifier);
    }

    /**
     * @param identifier the identifier
     * @return the retained violations, oldest first
     */
    public List<Violation> recentViolations(String identifier) {
        return history.recent(identifier);
    }

    public Uni<Boolean> isBlocked(String identifier) {
        return blockList.isBlocked(identifier);
    }

    /**
     * Lift a block and forget the identifier: its violation history and alert
     * cooldowns are cleared.
     *
     * @param identifier the identifier
     * @return true if a block was removed
     */
    public Uni<Boolean> unblock(String identifier) {
        return blockList.unblock(identifier)
                .call(() -> clearCooldowns(identifier))
                .invoke(() -> history.clear(identifier));
    }

    int pendingViolations() {
        return queue.size();
    }

    /**
     * Analyze one violation and react to any matched pattern.
     *
     * @return the alerts that were published
     */
    Uni<List<SecurityAlert>> process(Violation violation) {
        final var recent = history.record(violation);
        final var matches = detect(violation, recent);
        if (matches.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        history.markFlagged(violation.identifier());
        return Multi.createFrom()
                .iterable(matches)
                .onItem()
                .transformToUniAndConcatenate(match -> handle(violation.identifier(), match))
                .collect()
                .asList()
                .map(published -> published.stream()
                        .filter(Optional::isPresent)
                        .map(Optional::get)
                        .toList());
    }

    private void drain() {
        while (running) {
            try {
                final var violation = queue.poll(POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
                if (violation != null) {
                    process(violation).await().atMost(PROCESSING_TIMEOUT);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                LOG.warnv(e, "Failed to process violation");
            }
        }
    }

    private List<Match> detect(Violation violation, List<Violation> recent) {
        final var matches = new ArrayList<Match>(2);
        final var now = violation.timestamp();

        final var bruteForce = recent.stream()
                .filter(v -> !v.timestamp().isBefore(now.minus(bruteForceWindow)))
                .filter(v -> loginEndpoints.matchesAny(v.endpoint()))
                .toList();
        if (bruteForce.size() >= bruteForceThreshold) {
            matches.add(new Match(
                    AlertType.BRUTE_FORCE,
                    bruteForceSeverity,
                    bruteForce,
                    summary(bruteForce, bruteForceThreshold, bruteForceWindow)));
        }

        final var abuse = recent.stream()
                .filter(v -> !v.timestamp().isBefore(now.minus(apiAbuseWindow)))
                .toList();
        if (abuse.size() >= apiAbuseThreshold) {
            final var severity = abuse.size() >= (long) apiAbuseThreshold * escalationFactor
                    ? AlertSeverity.HIGH
                    : apiAbuseSeverity;
            matches.add(new Match(
                    AlertType.API_ABUSE, severity, abuse, summary(abuse, apiAbuseThreshold, apiAbuseWindow)));
        }
        return matches;
    }

    private Uni<Optional<SecurityAlert>> handle(String identifier, Match match) {
        final var alert = new SecurityAlert(
                match.type(), match.severity(), identifier, match.evidence(), match.summary(), Instant.now());
        final var cooldownKey = keys.alertCooldown(match.type(), identifier);

        final Uni<Optional<SecurityAlert>> published = store.setIfAbsent(
                        cooldownKey, String.valueOf(alert.detectedAt().toEpochMilli()), alertCooldown.toMillis())
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Alert cooldown unavailable for {0}, publishing anyway: {1}", identifier, error.getMessage());
                    return true;
                })
                .map(fresh -> {
                    if (!fresh) {
                        LOG.debugf("Suppressed %s alert for %s (cooldown active)", match.type(), identifier);
                        return Optional.empty();
                    }
                    publish(alert);
                    return Optional.of(alert);
                });

        if (match.severity() != AlertSeverity.HIGH) {
            return published;
        }
        return published.call(ignored -> block(identifier, match.type()));
    }

    private Uni<Void> block(String identifier, AlertType type) {
        final var reason = type.name() + " detected";
        return blockList.block(identifier, reason, blockDuration)
                .flatMap(created -> blockList.lookup(identifier))
                .map(entry -> entry.map(BlockEntry::expiresAt).orElseGet(() -> Instant.now().plus(blockDuration)))
                .invoke(until -> history.markBlocked(identifier, until))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Failed to block {0} after {1}: {2}", identifier, type, error.getMessage());
                    return null;
                })
                .replaceWithVoid();
    }

    private void publish(SecurityAlert alert) {
        LOG.debugf("Publishing %s alert (%s) for %s", alert.type(), alert.severity(), alert.identifier());
        for (var subscriber : subscribers) {
            try {
                subscriber.handler().accept(alert);
            } catch (Exception e) {
                LOG.warnv(e, "Alert subscriber failed for {0} alert on {1}", alert.type(), alert.identifier());
            }
        }
    }

    private Uni<Void> clearCooldowns(String identifier) {
        return Multi.createFrom()
                .items(AlertType.values())
                .onItem()
                .transformToUniAndConcatenate(type -> store.delete(keys.alertCooldown(type, identifier)))
                .collect()
                .last()
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Failed to clear alert cooldowns for {0}: {1}", identifier, error.getMessage());
                    return false;
                })
                .replaceWithVoid();
    }

    private static Map<String, Object> summary(List<Violation> violations, int threshold, Duration window) {
        final var summary = new LinkedHashMap<String, Object>();
        summary.put("violations", violations.size());
        summary.put("threshold", threshold);
        summary.put("window", window.toString());
        summary.put("endpoints", List.copyOf(new TreeSet<>(violations.stream()
                .map(Violation::endpoint)
                .toList())));
        summary.put("firstSeen", violations.get(0).timestamp().toString());
        summary.put("lastSeen", violations.get(violations.size() - 1).timestamp().toString());
        return summary;
    }

    private record Match(
            AlertType type, AlertSeverity severity, List<Violation> evidence, Map<String, Object> summary) {}

    // Wrapper so that the same handler subscribed twice yields two independent subscriptions.
    private static final class Subscriber {

        private final Consumer<SecurityAlert> handler;

        Subscriber(Consumer<SecurityAlert> handler) {
            this.handler = handler;
        }

        Consumer<SecurityAlert> handler() {
            return handler;
        }
    }
}
