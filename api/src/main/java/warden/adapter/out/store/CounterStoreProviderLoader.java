package warden.adapter.out.store;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import warden.adapter.out.store.memory.InMemoryCounterStore;
import warden.adapter.out.store.redis.RedisCounterStore;
import warden.core.config.StoreConfig;
import warden.core.port.out.Metrics;
import warden.spi.CounterStore;

/**
 * CDI producer for the counter store.
 *
 * <p>Selects the implementation based on configuration and availability:
 * <ul>
 *   <li>Redis - used when {@code warden.store.redis.enabled=true} and a Redis datasource is available</li>
 *   <li>In-memory - fallback for single-instance deployments</li>
 * </ul>
 */
@ApplicationScoped
public class CounterStoreProviderLoader {

    private static final Logger LOG = Logger.getLogger(CounterStoreProviderLoader.class);

    private final StoreConfig config;
    private final Metrics metrics;
    private final Instance<ReactiveRedisDataSource> redisDataSource;

    @Inject
    public CounterStoreProviderLoader(
            StoreConfig config, Metrics metrics, Instance<ReactiveRedisDataSource> redisDataSource) {
        this.config = config;
        this.metrics = metrics;
        this.redisDataSource = redisDataSource;
    }

    /**
     * Produces the counter store instance for CDI injection.
     *
     * @return the configured counter store
     */
    @Produces
    @ApplicationScoped
    public CounterStore produceCounterStore() {
        final var store = createRedisStore().orElseGet(() -> {
            LOG.warn("Using in-memory counter store; limits and blocks are not shared across instances");
            return new InMemoryCounterStore();
        });
        LOG.infov(
                "Using counter store: {0} (timeout={1}, maxRetries={2}, keyPrefix={3})",
                store.name(), config.timeout(), Math.min(1, config.maxRetries()), config.keyPrefix());
        return store;
    }

    /**
     * Disposes the counter store, shutting down any cleanup executors.
     */
    void disposeCounterStore(@Disposes CounterStore store) {
        if (store instanceof InMemoryCounterStore inMemory) {
            inMemory.shutdown();
        }
    }

    private Optional<CounterStore> createRedisStore() {
        if (!config.redis().enabled()) {
            LOG.debug("Redis counter store not enabled in configuration");
            return Optional.empty();
        }

        if (!redisDataSource.isResolvable()) {
            LOG.warn("Redis counter store enabled but ReactiveRedisDataSource not available");
            return Optional.empty();
        }

        try {
            final var helper = new StoreTimeoutHelper(config.timeout(), config.maxRetries(), metrics, "redis");
            return Optional.of(new RedisCounterStore(redisDataSource.get(), helper));
        } catch (Exception e) {
            LOG.warnv(e, "Failed to initialize Redis counter store, falling back to in-memory");
            return Optional.empty();
        }
    }
}
