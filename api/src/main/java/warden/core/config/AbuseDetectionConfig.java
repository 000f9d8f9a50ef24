package warden.core.config;

import java.time.Duration;
import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import warden.core.model.abuse.AlertSeverity;

/**
 * Configuration mapping for the violation monitor.
 *
 * <p>Configuration prefix: {@code warden.abuse-detection}
 *
 * @see warden.core.service.abuse.ViolationMonitor
 */
@ConfigMapping(prefix = "warden.abuse-detection")
public interface AbuseDetectionConfig {

    /**
     * Enable pattern detection. When disabled violations are discarded.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Capacity of the queue between the request path and the monitor worker.
     * Violations arriving while the queue is full are dropped.
     *
     * @return queue capacity (default: 10000)
     */
    @WithDefault("10000")
    int queueCapacity();

    /**
     * Violations retained per identifier.
     *
     * @return ring buffer capacity (default: 50)
     */
    @WithDefault("50")
    int historyCapacity();

    /**
     * How long violations are retained.
     *
     * @return retention (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration retention();

    /**
     * Upper bound on identifiers tracked in memory.
     *
     * @return maximum tracked identifiers (default: 100000)
     */
    @WithDefault("100000")
    long maxTrackedIdentifiers();

    /**
     * Minimum time between two alerts of the same type for the same identifier.
     *
     * @return alert cooldown (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration alertCooldown();

    /**
     * Duration of the block applied on a HIGH severity alert.
     *
     * @return block duration (default: 24 hours)
     */
    @WithDefault("PT24H")
    Duration blockDuration();

    BruteForceConfig bruteForce();

    ApiAbuseConfig apiAbuse();

    /**
     * Repeated violations on login endpoints.
     */
    interface BruteForceConfig {

        /**
         * @return violations that trigger the pattern (default: 3)
         */
        @WithDefault("3")
        int threshold();

        /**
         * @return detection window (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration window();

        /**
         * @return alert severity (default: HIGH)
         */
        @WithDefault("HIGH")
        AlertSeverity severity();

        /**
         * Glob patterns matching login endpoints.
         *
         * @return endpoint patterns (default: login, auth.login, *.login)
         */
        @WithDefault("login,auth.login,*.login")
        List<String> endpoints();
    }

    /**
     * Sustained violations on any endpoint.
     */
    interface ApiAbuseConfig {

        /**
         * @return violations that trigger the pattern (default: 10)
         */
        @WithDefault("10")
        int threshold();

        /**
         * @return detection window (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration window();

        /**
         * @return alert severity (default: MEDIUM)
         */
        @WithDefault("MEDIUM")
        AlertSeverity severity();

        /**
         * Multiple of the threshold at which the alert is escalated to HIGH.
         *
         * @return escalation factor (default: 5)
         */
        @WithDefault("5")
        int escalationFactor();
    }
}
