package warden.adapter.out.store.redis;

import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;

import warden.adapter.out.store.StoreTimeoutHelper;
import warden.spi.CounterStore;

/**
 * Redis-based counter store for distributed deployments.
 *
 * <p>Counters are maintained by a Lua script so that the increment and the expiry
 * happen in one atomic round trip. The expiry is attached only when the key has
 * none, which keeps concurrent first requests from extending the window.
 *
 * <p>Every call is bounded by the {@link StoreTimeoutHelper}; increments are never
 * retried.
 */
public final class RedisCounterStore implements CounterStore {

    /**
     * Atomic increment with expiry.
     *
     * <ol>
     *   <li>KEYS[1] - the counter key</li>
     *   <li>ARGV[1] - TTL in milliseconds applied when the key has no expiry</li>
     * </ol>
     *
     * <p>Returns array: [count, ttl_remaining_ms]
     */
    static final String INCREMENT_SCRIPT =
            """
            local count = redis.call('INCR', KEYS[1])
            local ttl = redis.call('PTTL', KEYS[1])
            if ttl < 0 then
                redis.call('PEXPIRE', KEYS[1], ARGV[1])
                ttl = tonumber(ARGV[1])
            end
            return {count, ttl}
            """;

    /**
     * Read a value together with its remaining TTL.
     *
     * <p>Returns array: [value, ttl_remaining_ms], or an empty array when the key is absent.
     */
    static final String GET_SCRIPT =
            """
            local value = redis.call('GET', KEYS[1])
            if not value then
                return {}
            end
            return {value, redis.call('PTTL', KEYS[1])}
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveKeyCommands<String> keyCommands;
    private final StoreTimeoutHelper timeoutHelper;

    public RedisCounterStore(ReactiveRedisDataSource redisDataSource, StoreTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public Uni<CounterSnapshot> incrementWithExpiry(String key, long ttlMs) {
        return timeoutHelper.withTimeout(
                () -> redisDataSource
                        .execute("EVAL", INCREMENT_SCRIPT, "1", key, String.valueOf(ttlMs))
                        .map(RedisCounterStore::parseSnapshot),
                "incrementWithExpiry");
    }

    @Override
    public Uni<CounterSnapshot> get(String key) {
        return getRaw(key, "get").map(value -> value
                .map(v -> new CounterSnapshot(parseCount(v.value()), v.ttlRemainingMs()))
                .orElseGet(CounterSnapshot::empty));
    }

    @Override
    public Uni<Optional<StoredValue>> getValue(String key) {
        return getRaw(key, "getValue");
    }

    @Override
    public Uni<Boolean> setIfAbsent(String key, String value, long ttlMs) {
        return timeoutHelper.withRetry(
                () -> redisDataSource
                        .execute("SET", key, value, "PX", String.valueOf(ttlMs), "NX")
                        .map(response -> response != null && "OK".equalsIgnoreCase(response.toString())),
                "setIfAbsent");
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return timeoutHelper.withRetry(() -> keyCommands.del(key).map(removed -> removed > 0), "delete");
    }

    private Uni<Optional<StoredValue>> getRaw(String key, String operationName) {
        return timeoutHelper.withRetry(
                () -> redisDataSource
                        .execute("EVAL", GET_SCRIPT, "1", key)
                        .map(RedisCounterStore::parseValue),
                operationName);
    }

    static CounterSnapshot parseSnapshot(Response response) {
        if (response == null || response.size() < 2) {
            throw new IllegalStateException("Unexpected response from Redis increment script");
        }
        return new CounterSnapshot(response.get(0).toLong(), Math.max(0, response.get(1).toLong()));
    }

    static Optional<StoredValue> parseValue(Response response) {
        if (response == null || response.size() < 2) {
            return Optional.empty();
        }
        // PTTL is -1 for keys without expiry
        final var ttl = response.get(1).toLong();
        return Optional.of(new StoredValue(response.get(0).toString(), Math.max(0, ttl)));
    }

    private static long parseCount(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Key does not hold a counter", e);
        }
    }
}
