package warden.core.service.abuse;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import warden.core.model.abuse.MonitorState;
import warden.core.model.abuse.Violation;

/**
 * Per-identifier violation ring buffers and monitor states.
 *
 * <p>Each identifier keeps at most {@code capacity} violations; violations older than
 * the retention are evicted lazily whenever the buffer is read or written.
 * Identifiers idle for longer than the retention are dropped, as is the least
 * recently used identifier once {@code maxIdentifiers} is reached. A blocked
 * identifier is kept until its block expires, whichever limit is hit first.
 */
class ViolationHistory {

    private final int capacity;
    private final Duration retention;
    private final Cache<String, IdentifierHistory> histories;

    ViolationHistory(int capacity, Duration retention, long maxIdentifiers) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.capacity = capacity;
        this.retention = retention;
        this.histories = Caffeine.newBuilder()
                .expireAfter(new HistoryExpiry(retention))
                .maximumWeight(maxIdentifiers)
                .weigher((String id, IdentifierHistory history) -> history.isBlocked() ? 0 : 1)
                .build();
    }

    /**
     * Append a violation and return the retained violations, oldest first.
     */
    List<Violation> record(Violation violation) {
        final var retained = new AtomicReference<List<Violation>>(List.of());
        histories.asMap().compute(violation.identifier(), (id, existing) -> {
            final var history = existing != null ? existing : new IdentifierHistory();
            retained.set(history.append(violation, capacity, violation.timestamp().minus(retention)));
            return history;
        });
        return retained.get();
    }

    List<Violation> recent(String identifier) {
        final var history = histories.getIfPresent(identifier);
        if (history == null) {
            return List.of();
        }
        return history.snapshot(Instant.now().minus(retention));
    }

    MonitorState state(String identifier) {
        final var history = histories.getIfPresent(identifier);
        return history != null ? history.state(Instant.now()) : MonitorState.CLEAN;
    }

    void markFlagged(String identifier) {
        histories.asMap().computeIfPresent(identifier, (id, history) -> {
            history.flag();
            return history;
        });
    }

    // Written through compute so the entry is re-weighed and its expiry extended to the block end.
    void markBlocked(String identifier, Instant until) {
        histories.asMap().compute(identifier, (id, existing) -> {
            final var history = existing != null ? existing : new IdentifierHistory();
            history.block(until);
            return history;
        });
    }

    void clear(String identifier) {
        histories.invalidate(identifier);
    }

    long trackedIdentifiers() {
        histories.cleanUp();
        return histories.estimatedSize();
    }

    private static final class HistoryExpiry implements Expiry<String, IdentifierHistory> {

        private final Duration retention;

        HistoryExpiry(Duration retention) {
            this.retention = retention;
        }

        @Override
        public long expireAfterCreate(String id, IdentifierHistory history, long currentTime) {
            return lifetime(history);
        }

        @Override
        public long expireAfterUpdate(
                String id, IdentifierHistory history, long currentTime, long currentDuration) {
            return lifetime(history);
        }

        @Override
        public long expireAfterRead(
                String id, IdentifierHistory history, long currentTime, long currentDuration) {
            return lifetime(history);
        }

        private long lifetime(IdentifierHistory history) {
            final var blockedUntil = history.blockedUntil();
            if (blockedUntil != null) {
                final var remaining = Duration.between(Instant.now(), blockedUntil);
                if (remaining.compareTo(retention) > 0) {
                    return remaining.toNanos();
                }
            }
            return retention.toNanos();
        }
    }

    private static final class IdentifierHistory {

        private final Deque<Violation> buffer = new ArrayDeque<>();
        private MonitorState state = MonitorState.CLEAN;
        private Instant blockedUntil;

        synchronized List<Violation> append(Violation violation, int capacity, Instant cutoff) {
            state(Instant.now());
            evictBefore(cutoff);
            while (buffer.size() >= capacity) {
                buffer.pollFirst();
            }
            buffer.addLast(violation);
            if (state == MonitorState.CLEAN) {
                state = MonitorState.WATCHING;
            }
            return List.copyOf(buffer);
        }

        synchronized List<Violation> snapshot(Instant cutoff) {
            evictBefore(cutoff);
            return List.copyOf(buffer);
        }

        synchronized MonitorState state(Instant now) {
            if (state == MonitorState.BLOCKED && blockedUntil != null && !now.isBefore(blockedUntil)) {
                state = MonitorState.CLEAN;
                blockedUntil = null;
                buffer.clear();
            }
            return state;
        }

        synchronized void flag() {
            if (state != MonitorState.BLOCKED) {
                state = MonitorState.FLAGGED;
            }
        }

        synchronized void block(Instant until) {
            state = MonitorState.BLOCKED;
            blockedUntil = until;
        }

        synchronized boolean isBlocked() {
            return state == MonitorState.BLOCKED;
        }

        synchronized Instant blockedUntil() {
            return state == MonitorState.BLOCKED ? blockedUntil : null;
        }

        private void evictBefore(Instant cutoff) {
            while (!buffer.isEmpty() && buffer.peekFirst().timestamp().isBefore(cutoff)) {
                buffer.pollFirst();
            }
        }
    }
}
