package warden.core.config;

import java.time.Duration;
import java.util.Map;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import warden.core.model.ratelimit.FailurePolicy;

/**
 * Configuration mapping for rate limiting.
 *
 * <p>Configuration prefix: {@code warden.rate-limiting}
 *
 * <p>Rules are declared per endpoint and tier:
 * <pre>
 * warden.rate-limiting.endpoints."auth.login".tiers.anonymous.window=PT1M
 * warden.rate-limiting.endpoints."auth.login".tiers.anonymous.max-requests=5
 * warden.rate-limiting.endpoints."auth.login".tiers.anonymous.failure-policy=FAIL_CLOSED
 * </pre>
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code WARDEN_RATE_LIMITING_ENABLED} - Enable/disable rate limiting</li>
 *   <li>{@code WARDEN_RATE_LIMITING_FALLBACK_MAX_REQUESTS} - Limit for unknown endpoints</li>
 * </ul>
 *
 * @see warden.core.service.ratelimit.RuleRegistry
 */
@ConfigMapping(prefix = "warden.rate-limiting")
public interface RateLimitingConfig {

    /**
     * Enable or disable rate limiting globally.
     *
     * @return true if rate limiting is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Retry-After reported when a fail-closed rule denies because the store is down.
     *
     * @return retry-after duration (default: 1 second)
     */
    @WithDefault("PT1S")
    Duration failClosedRetryAfter();

    /**
     * Process-wide fallback rule for endpoints without any configured rule.
     */
    FallbackConfig fallback();

    /**
     * Rules keyed by endpoint name.
     *
     * @return endpoint configurations (empty when none are configured)
     */
    Map<String, EndpointConfig> endpoints();

    /**
     * Fallback rule configuration.
     */
    interface FallbackConfig {

        /**
         * @return window duration (default: 1 minute)
         */
        @WithDefault("PT1M")
        Duration window();

        /**
         * @return maximum requests per window (default: 60)
         */
        @WithDefault("60")
        long maxRequests();
    }

    /**
     * Rules of one endpoint keyed by tier name ({@code anonymous}, {@code authenticated},
     * {@code elevated}, {@code service} or {@code default}).
     */
    interface EndpointConfig {

        Map<String, RuleConfig> tiers();
    }

    /**
     * A single rule.
     */
    interface RuleConfig {

        /**
         * @return the fixed window length
         */
        Duration window();

        /**
         * Maximum counted requests per window; 0 closes the endpoint for the tier.
         *
         * @return maximum requests per window
         */
        long maxRequests();

        /**
         * @return whether successful requests consume quota (default: true)
         */
        @WithDefault("true")
        boolean countSuccessful();

        /**
         * @return whether failed requests consume quota (default: true)
         */
        @WithDefault("true")
        boolean countFailed();

        /**
         * @return behavior when the counter store is unavailable (default: FAIL_OPEN)
         */
        @WithDefault("FAIL_OPEN")
        FailurePolicy failurePolicy();
    }
}
