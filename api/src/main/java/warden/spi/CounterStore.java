package warden.spi;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * SPI for the shared key/value store backing rate counters, block entries and alert cooldowns.
 *
 * <p>All cross-request coordination goes through this interface. Platform teams can plug in
 * their own backend (e.g., Memcached, DynamoDB) as long as the contract below holds.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>{@link #incrementWithExpiry} MUST be a single atomic operation: the expiry is attached
 *       only when the key is created, so concurrent first touches cannot each set a full TTL</li>
 *   <li>Entries MUST expire automatically using the store's own clock</li>
 *   <li>All operations MUST be non-blocking and bounded by a short timeout</li>
 *   <li>Unreachable or slow backends MUST fail with {@link StoreUnavailableException}</li>
 *   <li>Retries, if any, are capped at one and only for idempotent operations</li>
 * </ul>
 *
 * @see warden.adapter.out.store.redis.RedisCounterStore
 * @see warden.adapter.out.store.memory.InMemoryCounterStore
 */
public interface CounterStore {

    /**
     * Atomically increment a counter, creating it with the given TTL when absent.
     *
     * @param key the counter key
     * @param ttlMs expiry applied when the key is created
     * @return Uni with the new count and the remaining TTL in milliseconds
     */
    Uni<CounterSnapshot> incrementWithExpiry(String key, long ttlMs);

    /**
     * Read a counter without modifying it.
     *
     * @param key the counter key
     * @return Uni with the current count and remaining TTL ({@link CounterSnapshot#empty()} when absent)
     */
    Uni<CounterSnapshot> get(String key);

    /**
     * Read a raw value without modifying it.
     *
     * @param key the key
     * @return Uni with the value and its remaining TTL, or empty when absent or expired
     */
    Uni<Optional<StoredValue>> getValue(String key);

    /**
     * Store a value only when the key does not exist yet.
     *
     * @param key the key
     * @param value the value to store
     * @param ttlMs expiry of the new entry
     * @return Uni with true if the value was stored, false if the key already existed
     */
    Uni<Boolean> setIfAbsent(String key, String value, long ttlMs);

    /**
     * Delete a key.
     *
     * @param key the key
     * @return Uni with true if a key was removed
     */
    Uni<Boolean> delete(String key);

    /**
     * Returns the name of this backend for logging.
     *
     * @return backend name (e.g., "memory", "redis")
     */
    String name();

    /**
     * Snapshot of a counter.
     *
     * @param count the current count (0 when absent)
     * @param ttlRemainingMs milliseconds until the counter expires (0 when absent)
     */
    record CounterSnapshot(long count, long ttlRemainingMs) {

        public static CounterSnapshot empty() {
            return new CounterSnapshot(0, 0);
        }

        public boolean isEmpty() {
            return count == 0;
        }
    }

    /**
     * A raw stored value.
     *
     * @param value the stored string
     * @param ttlRemainingMs milliseconds until the entry expires
     */
    record StoredValue(String value, long ttlRemainingMs) {}
}
