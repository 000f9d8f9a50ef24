package warden.core.service.ratelimit;

import java.util.LinkedHashMap;
import java.util.Map;

import warden.core.config.RateLimitingConfig;
import warden.core.model.ratelimit.InvalidRuleException;
import warden.core.model.ratelimit.RateLimitRule;
import warden.core.model.ratelimit.RuleKey;

/**
 * Translates {@code warden.rate-limiting.endpoints.*} configuration into rules.
 */
public final class RuleConfigurationLoader {

    private RuleConfigurationLoader() {}

    /**
     * Build the rule set declared in configuration.
     *
     * @param config the rate limiting configuration
     * @return rules keyed by endpoint and tier
     * @throws InvalidRuleException if a tier name or rule value is invalid
     */
    public static Map<RuleKey, RateLimitRule> load(RateLimitingConfig config) {
        final var rules = new LinkedHashMap<RuleKey, RateLimitRule>();
        config.endpoints().forEach((endpoint, endpointConfig) -> endpointConfig.tiers().forEach((tier, rule) -> {
            final var key = RuleKey.parse(endpoint, tier);
            try {
                rules.put(key, new RateLimitRule(
                        rule.window().toMillis(),
                        rule.maxRequests(),
                        rule.countSuccessful(),
                        rule.countFailed(),
                        rule.failurePolicy()));
            } catch (InvalidRuleException e) {
                throw new InvalidRuleException(
                        "Invalid rule for endpoint '%s' tier '%s': %s".formatted(endpoint, tier, e.getMessage()));
            }
        }));
        return rules;
    }
}
