package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the counter store.
 *
 * <p>Configuration prefix: {@code warden.store}
 *
 * @see warden.spi.CounterStore
 */
@ConfigMapping(prefix = "warden.store")
public interface StoreConfig {

    /**
     * Prefix applied to every key written to the store, allowing several
     * deployments to share a Redis instance.
     *
     * @return key prefix (default: "warden:")
     */
    @WithDefault("warden:")
    String keyPrefix();

    /**
     * Timeout applied to every store call. A call that exceeds it is treated as
     * a store failure and resolved by the rule's failure policy.
     *
     * @return operation timeout (default: 75 milliseconds)
     */
    @WithDefault("PT0.075S")
    Duration timeout();

    /**
     * Retries for idempotent store calls. Values above 1 are capped at 1; the
     * increment operation is never retried.
     *
     * @return max retries (default: 1)
     */
    @WithDefault("1")
    int maxRetries();

    /**
     * Redis backend configuration.
     */
    RedisConfig redis();

    interface RedisConfig {

        /**
         * Use Redis as the counter store. When disabled or when no Redis
         * datasource is available, the in-memory store is used.
         *
         * @return true to use Redis (default: false)
         */
        @WithDefault("false")
        boolean enabled();
    }
}
