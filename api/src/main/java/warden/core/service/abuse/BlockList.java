package warden.core.service.abuse;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.StoreConfig;
import warden.core.model.abuse.BlockEntry;
import warden.core.port.out.Metrics;
import warden.core.service.StoreKeys;
import warden.spi.CounterStore;

/**
 * Time-bounded denylist of identifiers, kept in the counter store so that every
 * instance sees the same blocks.
 *
 * <p>Store failures surface as {@link warden.spi.StoreUnavailableException}; the
 * caller decides whether that means blocked or not.
 */
@ApplicationScoped
public class BlockList {

    private static final Logger LOG = Logger.getLogger(BlockList.class);

    private final CounterStore store;
    private final StoreKeys keys;
    private final Metrics metrics;

    @Inject
    public BlockList(CounterStore store, StoreConfig config, Metrics metrics) {
        this(store, new StoreKeys(config.keyPrefix()), metrics);
    }

    public BlockList(CounterStore store, StoreKeys keys, Metrics metrics) {
        this.store = store;
        this.keys = keys;
        this.metrics = metrics;
    }

    /**
     * Block an identifier unless it is already blocked. An existing block keeps
     * its original expiry.
     *
     * @param identifier the identifier
     * @param reason why it is blocked
     * @param duration how long the block lasts
     * @return true if a new block was created
     */
    public Uni<Boolean> block(String identifier, String reason, Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Block duration must be positive");
        }
        final var now = Instant.now();
        final var entry = new BlockEntry(identifier, reason, now, now.plus(duration));
        return store.setIfAbsent(keys.block(identifier), entry.encode(), duration.toMillis())
                .invoke(created -> {
                    if (created) {
                        LOG.infof("Blocked %s for %s: %s", identifier, duration, reason);
                        if (metrics != null) {
                            metrics.recordBlock();
                        }
                    } else {
                        LOG.debugf("Block for %s already active, not extended", identifier);
                    }
                });
    }

    /**
     * @param identifier the identifier
     * @return true if an unexpired block exists
     */
    public Uni<Boolean> isBlocked(String identifier) {
        return lookup(identifier).map(Optional::isPresent);
    }

    /**
     * Look up the active block on an identifier.
     *
     * @param identifier the identifier
     * @return the block entry, or empty if not blocked
     */
    public Uni<Optional<BlockEntry>> lookup(String identifier) {
        return store.getValue(keys.block(identifier))
                .map(value -> value.map(
                        v -> BlockEntry.decode(identifier, v.value(), v.ttlRemainingMs(), Instant.now())));
    }

    /**
     * Remove the block on an identifier.
     *
     * @param identifier the identifier
     * @return true if a block was removed
     */
    public Uni<Boolean> unblock(String identifier) {
        return store.delete(keys.block(identifier)).invoke(removed -> {
            if (removed) {
                LOG.infof("Unblocked %s", identifier);
            }
        });
    }
}
