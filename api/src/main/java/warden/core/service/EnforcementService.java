package warden.core.service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.StoreConfig;
import warden.core.model.abuse.BlockEntry;
import warden.core.model.abuse.MonitorState;
import warden.core.model.ratelimit.Decision;
import warden.core.model.ratelimit.DecisionReason;
import warden.core.model.ratelimit.RateLimitRule;
import warden.core.model.ratelimit.RequestContext;
import warden.core.model.ratelimit.RuleKey;
import warden.core.model.ratelimit.UsageStats;
import warden.core.port.in.EnforcementManagement;
import warden.core.port.in.EnforcementUseCase;
import warden.core.port.out.Metrics;
import warden.core.service.abuse.BlockList;
import warden.core.service.abuse.ViolationMonitor;
import warden.core.service.ratelimit.RateLimitEngine;
import warden.core.service.ratelimit.RuleRegistry;
import warden.spi.CounterStore;
import warden.spi.StoreUnavailableException;

/**
 * Single entry point for request enforcement and its administration.
 *
 * <p>Evaluation checks the block list first; a blocked identifier is denied without
 * touching any counter. Otherwise the rate limit engine decides.
 */
@ApplicationScoped
public class EnforcementService implements EnforcementUseCase, EnforcementManagement {

    private static final Logger LOG = Logger.getLogger(EnforcementService.class);

    private final BlockList blockList;
    private final RuleRegistry registry;
    private final RateLimitEngine engine;
    private final ViolationMonitor monitor;
    private final CounterStore store;
    private final StoreKeys keys;
    private final Metrics metrics;

    @Inject
    public EnforcementService(
            BlockList blockList,
            RuleRegistry registry,
            RateLimitEngine engine,
            ViolationMonitor monitor,
            CounterStore store,
            StoreConfig storeConfig,
            Metrics metrics) {
        this(blockList, registry, engine, monitor, store, new StoreKeys(storeConfig.keyPrefix()), metrics);
    }

    public EnforcementService(
            BlockList blockList,
            RuleRegistry registry,
            RateLimitEngine engine,
            ViolationMonitor monitor,
            CounterStore store,
            StoreKeys keys,
            Metrics metrics) {
        this.blockList = blockList;
        this.registry = registry;
        this.engine = engine;
        this.monitor = monitor;
        this.store = store;
        this.keys = keys;
        this.metrics = metrics;
    }

    @Override
    public Uni<Decision> evaluate(RequestContext context) {
        if (!engine.isEnabled()) {
            return Uni.createFrom().item(Decision.unlimited());
        }
        return blockList.lookup(context.identifier())
                .flatMap(block -> block.isPresent()
                        ? Uni.createFrom().item(blocked(block.get()))
                        : engine.evaluate(context))
                .onFailure(StoreUnavailableException.class)
                .recoverWithItem(error -> blockCheckUnavailable(context, error))
                .invoke(decision -> record(context.endpoint(), decision));
    }

    @Override
    public Uni<Decision> check(RequestContext context) {
        return engine.status(context.identifier(), context.endpoint(), context.tier());
    }

    @Override
    public Uni<Boolean> block(String identifier, String reason, Duration duration) {
        return blockList.block(identifier, reason, duration);
    }

    @Override
    public Uni<Boolean> unblock(String identifier) {
        return monitor.unblock(identifier);
    }

    @Override
    public Uni<Boolean> isBlocked(String identifier) {
        return blockList.isBlocked(identifier);
    }

    @Override
    public Uni<Boolean> reset(String identifier, String endpoint) {
        return engine.reset(identifier, endpoint);
    }

    @Override
    public Uni<UsageStats> getUsage(String identifier) {
        final var block = blockList.lookup(identifier)
                .onFailure(StoreUnavailableException.class)
                .recoverWithItem(error -> {
                    LOG.warnv("Block lookup failed for {0}: {1}", identifier, error.getMessage());
                    return Optional.<BlockEntry>empty();
                });
        final var endpoints = Multi.createFrom()
                .iterable(registry.endpoints())
                .onItem()
                .transformToUniAndConcatenate(endpoint -> usage(identifier, endpoint))
                .select()
                .where(Optional::isPresent)
                .map(Optional::get)
                .collect()
                .asList();
        return Uni.combine().all().unis(block, endpoints).asTuple().map(tuple -> new UsageStats(
                identifier, tuple.getItem1(), monitor.stateOf(identifier), tuple.getItem2()));
    }

    @Override
    public MonitorState monitorState(String identifier) {
        return monitor.stateOf(identifier);
    }

    @Override
    public void reloadRules(Map<RuleKey, RateLimitRule> rules) {
        registry.replaceAll(rules);
    }

    // The engine resolves its own store failures, so only the block lookup lands here.
    private Decision blockCheckUnavailable(RequestContext context, Throwable error) {
        final var rule = registry.resolve(context.endpoint(), context.tier());
        LOG.warnv(
                "Block check unavailable for {0}, applying {1}: {2}",
                context.identifier(), rule.failurePolicy(), error.getMessage());
        return engine.failurePolicyDecision(rule);
    }

    private Decision blocked(BlockEntry entry) {
        final var now = Instant.now();
        LOG.debugf("Denied blocked identifier %s: %s", entry.identifier(), entry.reason());
        return Decision.deny(0, entry.expiresAt(), entry.remaining(now).toMillis(), DecisionReason.BLOCKED);
    }

    private Uni<Optional<UsageStats.EndpointUsage>> usage(String identifier, String endpoint) {
        final var rule = registry.resolve(endpoint, null);
        return store.get(keys.counter(endpoint, identifier))
                .map(snapshot -> snapshot.isEmpty()
                        ? Optional.<UsageStats.EndpointUsage>empty()
                        : Optional.of(new UsageStats.EndpointUsage(
                                endpoint,
                                snapshot.count(),
                                rule.maxRequests(),
                                Math.max(0, rule.maxRequests() - snapshot.count()),
                                Instant.now().plusMillis(snapshot.ttlRemainingMs()))))
                .onFailure(StoreUnavailableException.class)
                .recoverWithItem(error -> Optional.empty());
    }

    private void record(String endpoint, Decision decision) {
        if (metrics != null) {
            metrics.recordDecision(endpoint, decision.reason(), decision.allowed());
        }
    }
}
