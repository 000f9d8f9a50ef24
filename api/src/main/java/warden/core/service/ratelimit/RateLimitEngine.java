package warden.core.service.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.RateLimitingConfig;
import warden.core.config.StoreConfig;
import warden.core.model.abuse.Violation;
import warden.core.model.ratelimit.Decision;
import warden.core.model.ratelimit.DecisionReason;
import warden.core.model.ratelimit.FailurePolicy;
import warden.core.model.ratelimit.Outcome;
import warden.core.model.ratelimit.RateLimitRule;
import warden.core.model.ratelimit.RequestContext;
import warden.core.service.StoreKeys;
import warden.core.service.abuse.ViolationMonitor;
import warden.spi.CounterStore;
import warden.spi.StoreUnavailableException;

/**
 * Fixed-window rate limiting over the shared counter store.
 *
 * <p>A counted request is a single atomic increment-with-expiry; the first request
 * of a window creates the counter with the window as its TTL, and the window ends
 * when the counter expires. Outcomes a rule does not count only peek at the counter.
 *
 * <p>When the store is unavailable the rule's {@link FailurePolicy} decides. Such
 * decisions carry {@link DecisionReason#STORE_UNAVAILABLE} and never produce
 * violations.
 */
@ApplicationScoped
public class RateLimitEngine {

    private static final Logger LOG = Logger.getLogger(RateLimitEngine.class);

    private final RuleRegistry registry;
    private final CounterStore store;
    private final ViolationMonitor monitor;
    private final StoreKeys keys;
    private final boolean enabled;
    private final Duration failClosedRetryAfter;

    @Inject
    public RateLimitEngine(
            RuleRegistry registry,
            CounterStore store,
            ViolationMonitor monitor,
            RateLimitingConfig config,
            StoreConfig storeConfig) {
        this(
                registry,
                store,
                monitor,
                new StoreKeys(storeConfig.keyPrefix()),
                config.enabled(),
                config.failClosedRetryAfter());
    }

    public RateLimitEngine(
            RuleRegistry registry,
            CounterStore store,
            ViolationMonitor monitor,
            StoreKeys keys,
            boolean enabled,
            Duration failClosedRetryAfter) {
        this.registry = registry;
        this.store = store;
        this.monitor = monitor;
        this.keys = keys;
        this.enabled = enabled;
        this.failClosedRetryAfter = failClosedRetryAfter;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Evaluate a request and consume quota when its outcome is counted.
     *
     * @param context the request
     * @return the decision
     */
    public Uni<Decision> evaluate(RequestContext context) {
        if (!enabled) {
            return Uni.createFrom().item(Decision.unlimited());
        }
        final var rule = registry.resolve(context.endpoint(), context.tier());
        if (rule.isClosed()) {
            return Uni.createFrom().item(closed(context, rule));
        }
        if (!rule.counts(context.outcome())) {
            return peek(context.identifier(), context.endpoint(), rule);
        }

        final var key = keys.counter(context.endpoint(), context.identifier());
        return store.incrementWithExpiry(key, rule.windowDurationMs())
                .map(snapshot -> {
                    final var resetAt = Instant.now().plusMillis(snapshot.ttlRemainingMs());
                    if (snapshot.count() <= rule.maxRequests()) {
                        return Decision.allow(
                                rule.maxRequests(),
                                rule.maxRequests() - snapshot.count(),
                                resetAt,
                                DecisionReason.WITHIN_LIMIT);
                    }
                    LOG.debugf(
                            "Rate limit exceeded for %s on %s: %d/%d",
                            context.identifier(), context.endpoint(), snapshot.count(), rule.maxRequests());
                    reportViolation(context);
                    return Decision.deny(
                            rule.maxRequests(), resetAt, snapshot.ttlRemainingMs(), DecisionReason.LIMIT_EXCEEDED);
                })
                .onFailure(StoreUnavailableException.class)
                .recoverWithItem(error -> onStoreUnavailable(context.endpoint(), rule, error));
    }

    /**
     * Evaluate a request with the given attributes.
     */
    public Uni<Decision> evaluate(String identifier, String endpoint, String tier, Outcome outcome) {
        return evaluate(new RequestContext(identifier, endpoint, tier, outcome, Map.of()));
    }

    /**
     * Report the current state of a counter without consuming quota.
     *
     * @param identifier the identifier
     * @param endpoint the endpoint
     * @param tier the caller tier
     * @return the decision for the current count
     */
    public Uni<Decision> status(String identifier, String endpoint, String tier) {
        if (!enabled) {
            return Uni.createFrom().item(Decision.unlimited());
        }
        final var rule = registry.resolve(endpoint, tier);
        if (rule.isClosed()) {
            return Uni.createFrom().item(Decision.deny(
                    0, Instant.now().plusMillis(rule.windowDurationMs()), rule.windowDurationMs(),
                    DecisionReason.ENDPOINT_CLOSED));
        }
        return peek(identifier, endpoint, rule);
    }

    /**
     * Delete the counter of an identifier on an endpoint.
     *
     * @return true if a counter existed
     */
    public Uni<Boolean> reset(String identifier, String endpoint) {
        return store.delete(keys.counter(endpoint, identifier)).invoke(deleted -> {
            if (deleted) {
                LOG.infof("Reset rate limit counter for %s on %s", identifier, endpoint);
            }
        });
    }

    /**
     * Decision used when the store cannot be reached for the given rule.
     */
    public Decision failurePolicyDecision(RateLimitRule rule) {
        if (rule.failurePolicy() == FailurePolicy.FAIL_CLOSED) {
            return Decision.deny(
                    rule.maxRequests(),
                    Instant.now().plus(failClosedRetryAfter),
                    failClosedRetryAfter.toMillis(),
                    DecisionReason.STORE_UNAVAILABLE);
        }
        return Decision.allow(
                rule.maxRequests(),
                rule.maxRequests(),
                Instant.now().plusMillis(rule.windowDurationMs()),
                DecisionReason.STORE_UNAVAILABLE);
    }

    private Uni<Decision> peek(String identifier, String endpoint, RateLimitRule rule) {
        return store.get(keys.counter(endpoint, identifier))
                .map(snapshot -> {
                    final var ttl = snapshot.isEmpty() ? rule.windowDurationMs() : snapshot.ttlRemainingMs();
                    final var resetAt = Instant.now().plusMillis(ttl);
                    if (snapshot.count() <= rule.maxRequests()) {
                        return Decision.allow(
                                rule.maxRequests(),
                                rule.maxRequests() - snapshot.count(),
                                resetAt,
                                DecisionReason.WITHIN_LIMIT);
                    }
                    return Decision.deny(rule.maxRequests(), resetAt, ttl, DecisionReason.LIMIT_EXCEEDED);
                })
                .onFailure(StoreUnavailableException.class)
                .recoverWithItem(error -> onStoreUnavailable(endpoint, rule, error));
    }

    private Decision closed(RequestContext context, RateLimitRule rule) {
        LOG.debugf("Endpoint %s is closed for tier %s", context.endpoint(), context.tier());
        reportViolation(context);
        return Decision.deny(
                0,
                Instant.now().plusMillis(rule.windowDurationMs()),
                rule.windowDurationMs(),
                DecisionReason.ENDPOINT_CLOSED);
    }

    private Decision onStoreUnavailable(String endpoint, RateLimitRule rule, Throwable error) {
        LOG.warnv(
                "Counter store unavailable for {0}, applying {1}: {2}",
                endpoint, rule.failurePolicy(), error.getMessage());
        return failurePolicyDecision(rule);
    }

    private void reportViolation(RequestContext context) {
        if (monitor != null) {
            monitor.recordViolation(Violation.now(context.identifier(), context.endpoint(), context.metadata()));
        }
    }
}
