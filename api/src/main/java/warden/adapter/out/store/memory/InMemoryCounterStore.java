package warden.adapter.out.store.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.spi.CounterStore;

/**
 * In-memory implementation of {@link CounterStore}.
 *
 * <p>
 * Every operation runs under {@link ConcurrentMap#compute} on its key, which makes
 * increments and set-if-absent atomic within this process. Expired entries are
 * treated as absent on access and swept once a minute.
 *
 * <p>
 * <strong>Warning:</strong> State is neither shared across instances nor kept
 * across restarts. Use Redis for multi-instance deployments.
 */
public class InMemoryCounterStore implements CounterStore {

    private static final Logger LOG = Logger.getLogger(InMemoryCounterStore.class);

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryCounterStore() {
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            final var t = new Thread(r, "counter-store-cleanup");
            t.setDaemon(true);
            return t;
        });

        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, 1, 1, TimeUnit.MINUTES);
        LOG.info("Initialized in-memory counter store");
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public Uni<CounterSnapshot> incrementWithExpiry(String key, long ttlMs) {
        return Uni.createFrom().item(() -> {
            final var now = System.currentTimeMillis();
            final var entry = entries.compute(key, (k, existing) -> {
                if (existing == null || existing.isExpired(now)) {
                    return new Entry(1, null, now + ttlMs);
                }
                return new Entry(existing.count() + 1, null, existing.expiresAtMillis());
            });
            return new CounterSnapshot(entry.count(), entry.ttlRemaining(now));
        });
    }

    @Override
    public Uni<CounterSnapshot> get(String key) {
        return Uni.createFrom().item(() -> {
            final var now = System.currentTimeMillis();
            final var entry = live(key, now);
            return entry != null ? new CounterSnapshot(entry.count(), entry.ttlRemaining(now)) : CounterSnapshot.empty();
        });
    }

    @Override
    public Uni<Optional<StoredValue>> getValue(String key) {
        return Uni.createFrom().item(() -> {
            final var now = System.currentTimeMillis();
            final var entry = live(key, now);
            if (entry == null) {
                return Optional.<StoredValue>empty();
            }
            final var value = entry.value() != null ? entry.value() : String.valueOf(entry.count());
            return Optional.of(new StoredValue(value, entry.ttlRemaining(now)));
        });
    }

    @Override
    public Uni<Boolean> setIfAbsent(String key, String value, long ttlMs) {
        return Uni.createFrom().item(() -> {
            final var now = System.currentTimeMillis();
            final var created = new Entry(0, value, now + ttlMs);
            final var result = entries.compute(key, (k, existing) ->
                    existing == null || existing.isExpired(now) ? created : existing);
            return result == created;
        });
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return Uni.createFrom().item(() -> {
            final var removed = entries.remove(key);
            return removed != null && !removed.isExpired(System.currentTimeMillis());
        });
    }

    /**
     * Stops the cleanup executor.
     */
    public void shutdown() {
        cleanupExecutor.shutdown();
    }

    int size() {
        return entries.size();
    }

    void cleanupExpired() {
        final var now = System.currentTimeMillis();
        final var before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
        final var removed = before - entries.size();
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired counter store entries", removed);
        }
    }

    private Entry live(String key, long now) {
        final var entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(now)) {
            entries.remove(key, entry);
            return null;
        }
        return entry;
    }

    private record Entry(long count, String value, long expiresAtMillis) {

        boolean isExpired(long now) {
            return now >= expiresAtMillis;
        }

        long ttlRemaining(long now) {
            return Math.max(0, expiresAtMillis - now);
        }
    }
}
