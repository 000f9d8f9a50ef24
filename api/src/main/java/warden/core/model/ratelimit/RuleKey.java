package warden.core.model.ratelimit;

import java.util.Objects;

/**
 * Identifies a rule by endpoint and tier.
 *
 * <p>The tier is either a canonical {@link Tier#value()} or {@link Tier#DEFAULT}.
 * Use the factory methods to build keys; they normalize the tier spelling.
 *
 * @param endpoint the logical endpoint name (e.g., "auth.login")
 * @param tier the canonical tier name or "default"
 */
public record RuleKey(String endpoint, String tier) {

    public RuleKey {
        if (endpoint == null || endpoint.isBlank()) {
            throw new InvalidRuleException("Rule endpoint must not be blank");
        }
        Objects.requireNonNull(tier, "tier must not be null");
    }

    /**
     * Creates a key for a specific tier.
     *
     * @param endpoint the endpoint name
     * @param tier the tier
     * @return the rule key
     */
    public static RuleKey of(String endpoint, Tier tier) {
        return new RuleKey(endpoint, tier.value());
    }

    /**
     * Creates the per-endpoint fallback key.
     *
     * @param endpoint the endpoint name
     * @return the default rule key for the endpoint
     */
    public static RuleKey defaultFor(String endpoint) {
        return new RuleKey(endpoint, Tier.DEFAULT);
    }

    /**
     * Parses a configured tier name into a key.
     *
     * @param endpoint the endpoint name
     * @param tierName a tier spelling accepted by {@link Tier#parse} or "default"
     * @return the rule key
     * @throws InvalidRuleException if the tier name is unknown
     */
    public static RuleKey parse(String endpoint, String tierName) {
        if (tierName != null && Tier.DEFAULT.equalsIgnoreCase(tierName.trim())) {
            return defaultFor(endpoint);
        }
        return Tier.parse(tierName)
                .map(tier -> of(endpoint, tier))
                .orElseThrow(() -> new InvalidRuleException(
                        "Unknown tier '%s' for endpoint '%s'".formatted(tierName, endpoint)));
    }

    /**
     * Returns true if this is the per-endpoint fallback key.
     *
     * @return true for the "default" tier
     */
    public boolean isDefault() {
        return Tier.DEFAULT.equals(tier);
    }
}
