package warden.core.model.ratelimit;

import java.time.Duration;

/**
 * Immutable rate limit policy for one endpoint and tier.
 *
 * <p>A rule with {@code maxRequests == 0} closes the endpoint for its tier: every
 * evaluation is denied without touching the counter store.
 *
 * @param windowDurationMs the fixed window length in milliseconds (at least 1)
 * @param maxRequests the number of counted requests allowed per window (0 closes the endpoint)
 * @param countSuccessful whether requests with a successful outcome consume quota
 * @param countFailed whether requests with a failed outcome consume quota
 * @param failurePolicy behavior when the counter store is unavailable
 */
public record RateLimitRule(
        long windowDurationMs,
        long maxRequests,
        boolean countSuccessful,
        boolean countFailed,
        FailurePolicy failurePolicy) {

    /**
     * Creates a rule with validation.
     */
    public RateLimitRule {
        if (windowDurationMs < 1) {
            throw new InvalidRuleException("windowDurationMs must be at least 1, got " + windowDurationMs);
        }
        if (maxRequests < 0) {
            throw new InvalidRuleException("maxRequests must be non-negative, got " + maxRequests);
        }
        if (failurePolicy == null) {
            throw new InvalidRuleException("failurePolicy must not be null");
        }
    }

    /**
     * Creates a rule that counts every outcome and fails open.
     *
     * @param window the window duration
     * @param maxRequests the maximum requests per window
     * @return the rule
     */
    public static RateLimitRule of(Duration window, long maxRequests) {
        return new RateLimitRule(window.toMillis(), maxRequests, true, true, FailurePolicy.FAIL_OPEN);
    }

    /**
     * Returns a copy of this rule with a different failure policy.
     *
     * @param policy the failure policy
     * @return the new rule
     */
    public RateLimitRule withFailurePolicy(FailurePolicy policy) {
        return new RateLimitRule(windowDurationMs, maxRequests, countSuccessful, countFailed, policy);
    }

    /**
     * Returns a copy of this rule with different counting flags.
     *
     * @param successful whether successful outcomes are counted
     * @param failed whether failed outcomes are counted
     * @return the new rule
     */
    public RateLimitRule withCounting(boolean successful, boolean failed) {
        return new RateLimitRule(windowDurationMs, maxRequests, successful, failed, failurePolicy);
    }

    /**
     * Returns true if the endpoint is closed for this tier.
     *
     * @return true when {@code maxRequests == 0}
     */
    public boolean isClosed() {
        return maxRequests == 0;
    }

    /**
     * Returns true if a request with the given outcome consumes quota.
     *
     * @param outcome the request outcome
     * @return false when the outcome is excluded from counting
     */
    public boolean counts(Outcome outcome) {
        return switch (outcome) {
            case SUCCESS -> countSuccessful;
            case FAILURE -> countFailed;
            case PENDING -> true;
        };
    }

    /**
     * Returns the window as a duration.
     *
     * @return the window duration
     */
    public Duration window() {
        return Duration.ofMillis(windowDurationMs);
    }
}
