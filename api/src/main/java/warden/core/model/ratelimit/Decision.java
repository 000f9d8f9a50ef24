package warden.core.model.ratelimit;

import java.time.Instant;
import java.util.OptionalLong;

/**
 * Result of a rate limit evaluation.
 *
 * <p>Callers translate a decision into {@code X-RateLimit-*} and {@code Retry-After}
 * headers and a 429 status on denial. {@code retryAfterMs} is only present when the
 * request is denied.
 *
 * @param allowed whether the request may proceed
 * @param limit the maximum requests per window of the applied rule
 * @param remaining requests left in the current window (never negative)
 * @param resetAt when the current window ends
 * @param retryAfterMs milliseconds until a retry can succeed (denials only)
 * @param reason why the decision was reached
 */
public record Decision(
        boolean allowed,
        long limit,
        long remaining,
        Instant resetAt,
        OptionalLong retryAfterMs,
        DecisionReason reason) {

    public Decision {
        if (remaining < 0) {
            throw new IllegalArgumentException("remaining must be non-negative");
        }
        retryAfterMs = allowed ? OptionalLong.empty() : retryAfterMs;
    }

    /**
     * Create an allowed decision.
     *
     * @param limit the rule limit
     * @param remaining remaining requests in the window
     * @param resetAt when the window ends
     * @param reason why the request was allowed
     * @return an allowed decision
     */
    public static Decision allow(long limit, long remaining, Instant resetAt, DecisionReason reason) {
        return new Decision(true, limit, remaining, resetAt, OptionalLong.empty(), reason);
    }

    /**
     * Create a denied decision.
     *
     * @param limit the rule limit
     * @param resetAt when the window (or block) ends
     * @param retryAfterMs milliseconds until retry
     * @param reason why the request was denied
     * @return a denied decision
     */
    public static Decision deny(long limit, Instant resetAt, long retryAfterMs, DecisionReason reason) {
        return new Decision(false, limit, 0, resetAt, OptionalLong.of(Math.max(0, retryAfterMs)), reason);
    }

    /**
     * Create an unconditional allow used when rate limiting is disabled.
     *
     * @return an allowed decision without limits
     */
    public static Decision unlimited() {
        return new Decision(true, Long.MAX_VALUE, Long.MAX_VALUE, Instant.now(), OptionalLong.empty(),
                DecisionReason.DISABLED);
    }

    /**
     * Return the reset time as epoch seconds for response headers.
     *
     * @return reset time as epoch seconds
     */
    public long resetAtEpochSeconds() {
        return resetAt.getEpochSecond();
    }
}
