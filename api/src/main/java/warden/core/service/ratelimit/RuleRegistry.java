package warden.core.service.ratelimit;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.config.RateLimitingConfig;
import warden.core.model.ratelimit.InvalidRuleException;
import warden.core.model.ratelimit.RateLimitRule;
import warden.core.model.ratelimit.RuleKey;
import warden.core.model.ratelimit.Tier;

/**
 * Holds rate limit rules per endpoint and tier and resolves the rule for a request.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>exact {@code (endpoint, tier)}</li>
 *   <li>{@code (endpoint, default)}</li>
 *   <li>the process-wide fallback rule</li>
 * </ol>
 *
 * <p>Unknown endpoints and unknown tiers are never errors; they fall through to the
 * next step. Reads take the read lock, so a {@link #replaceAll reload} is observed
 * either entirely or not at all.
 */
@ApplicationScoped
public class RuleRegistry {

    private static final Logger LOG = Logger.getLogger(RuleRegistry.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final RateLimitRule fallbackRule;
    private Map<RuleKey, RateLimitRule> rules = new HashMap<>();

    @Inject
    public RuleRegistry(RateLimitingConfig config) {
        this(RateLimitRule.of(config.fallback().window(), config.fallback().maxRequests()));
    }

    public RuleRegistry(RateLimitRule fallbackRule) {
        this.fallbackRule = fallbackRule;
    }

    /**
     * Register or replace a single rule.
     *
     * @param key the endpoint and tier
     * @param rule the rule
     * @throws InvalidRuleException if the tier is not a known tier or "default"
     */
    public void register(RuleKey key, RateLimitRule rule) {
        final var canonical = canonicalize(key);
        if (rule == null) {
            throw new InvalidRuleException("Rule for " + canonical + " must not be null");
        }
        lock.writeLock().lock();
        try {
            rules.put(canonical, rule);
            warnOnInvertedTiers(canonical.endpoint(), rules);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Register a rule by endpoint and tier name.
     *
     * @param endpoint the endpoint
     * @param tier the tier name or "default"
     * @param rule the rule
     */
    public void register(String endpoint, String tier, RateLimitRule rule) {
        register(RuleKey.parse(endpoint, tier), rule);
    }

    /**
     * Validate a complete rule set and swap it in atomically.
     *
     * <p>If any rule is invalid nothing is replaced.
     *
     * @param newRules the new rule set
     * @throws InvalidRuleException if any key or rule is invalid
     */
    public void replaceAll(Map<RuleKey, RateLimitRule> newRules) {
        final var validated = new HashMap<RuleKey, RateLimitRule>();
        newRules.forEach((key, rule) -> {
            final var canonical = canonicalize(key);
            if (rule == null) {
                throw new InvalidRuleException("Rule for " + canonical + " must not be null");
            }
            validated.put(canonical, rule);
        });
        validated.keySet().stream()
                .map(RuleKey::endpoint)
                .distinct()
                .forEach(endpoint -> warnOnInvertedTiers(endpoint, validated));

        lock.writeLock().lock();
        try {
            rules = validated;
        } finally {
            lock.writeLock().unlock();
        }
        LOG.infof("Loaded %d rate limit rule(s) for %d endpoint(s)", validated.size(), endpoints().size());
    }

    /**
     * Resolve the rule for an endpoint and caller tier.
     *
     * @param endpoint the endpoint
     * @param tier the caller tier name (may be null or unknown)
     * @return the applicable rule, never null
     */
    public RateLimitRule resolve(String endpoint, String tier) {
        lock.readLock().lock();
        try {
            final var parsed = Tier.parse(tier);
            if (parsed.isPresent()) {
                final var exact = rules.get(RuleKey.of(endpoint, parsed.get()));
                if (exact != null) {
                    return exact;
                }
            }
            final var endpointDefault = rules.get(RuleKey.defaultFor(endpoint));
            return endpointDefault != null ? endpointDefault : fallbackRule;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the rule used when neither the tier nor the endpoint has a rule
     */
    public RateLimitRule fallbackRule() {
        return fallbackRule;
    }

    /**
     * @return the endpoints that have at least one rule, sorted
     */
    public Set<String> endpoints() {
        lock.readLock().lock();
        try {
            final var endpoints = new TreeSet<String>();
            rules.keySet().forEach(key -> endpoints.add(key.endpoint()));
            return endpoints;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return a snapshot of all registered rules
     */
    public Map<RuleKey, RateLimitRule> rules() {
        lock.readLock().lock();
        try {
            return Map.copyOf(rules);
        } finally {
            lock.readLock().unlock();
        }
    }

    private RuleKey canonicalize(RuleKey key) {
        if (key == null) {
            throw new InvalidRuleException("Rule key must not be null");
        }
        return RuleKey.parse(key.endpoint(), key.tier());
    }

    // A rule is considered stricter when it allows a lower request rate.
    private void warnOnInvertedTiers(String endpoint, Map<RuleKey, RateLimitRule> ruleSet) {
        final var tiered = ruleSet.entrySet().stream()
                .filter(e -> e.getKey().endpoint().equals(endpoint) && !e.getKey().isDefault())
                .sorted(Comparator.comparing(e -> Tier.parse(e.getKey().tier()).orElseThrow()))
                .toList();
        for (var i = 1; i < tiered.size(); i++) {
            final var lower = tiered.get(i - 1);
            final var higher = tiered.get(i);
            if (rate(higher.getValue()) < rate(lower.getValue())) {
                LOG.warnv(
                        "Rule for tier {0} on endpoint {1} is stricter than the rule for lower tier {2}",
                        higher.getKey().tier(), endpoint, lower.getKey().tier());
            }
        }
    }

    private static double rate(RateLimitRule rule) {
        return (double) rule.maxRequests() / rule.windowDurationMs();
    }
}
