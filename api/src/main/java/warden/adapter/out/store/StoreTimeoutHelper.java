package warden.adapter.out.store;

import java.time.Duration;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.Metrics;
import warden.spi.StoreUnavailableException;

/**
 * Applies timeouts, bounded retries and failure mapping to counter store operations.
 *
 * <p>Every timeout and backend error is converted to {@link StoreUnavailableException}
 * so that callers handle a single failure type through the rule's failure policy.
 *
 * <h2>Operation Modes</h2>
 * <ul>
 *   <li>{@link #withTimeout} - Single attempt. Use for non-idempotent operations such as
 *       increments, where a retry after an ambiguous failure could double count.</li>
 *   <li>{@link #withRetry} - Up to {@code maxRetries} additional attempts (capped at one).
 *       Use for reads, deletes and set-if-absent.</li>
 * </ul>
 *
 * <h2>Metrics</h2>
 * Records separate metrics for timeouts ({@code warden.store.timeouts.total}) and
 * non-timeout failures ({@code warden.store.failures.total}).
 */
public class StoreTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(StoreTimeoutHelper.class);

    private final Duration timeout;
    private final int maxRetries;
    private final Metrics metrics;
    private final String storeName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout applied to each attempt
     * @param maxRetries retries for idempotent operations (values above 1 are capped at 1)
     * @param metrics the metrics instance for recording timeouts (may be null)
     * @param storeName the store name for logging and metrics tagging
     */
    public StoreTimeoutHelper(Duration timeout, int maxRetries, Metrics metrics, String storeName) {
        this.timeout = timeout;
        this.maxRetries = Math.max(0, Math.min(1, maxRetries));
        this.metrics = metrics;
        this.storeName = storeName;
    }

    /**
     * Run an operation once with a timeout.
     *
     * @param operation supplies the store operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with StoreUnavailableException on timeout or failure
     */
    public <T> Uni<T> withTimeout(Supplier<Uni<T>> operation, String operationName) {
        return attempt(operation, operationName)
                .onFailure()
                .transform(error -> toUnavailable(operationName, error));
    }

    /**
     * Run an idempotent operation with a timeout per attempt and bounded retries.
     *
     * @param operation supplies the store operation; called once per attempt
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with StoreUnavailableException when all attempts fail
     */
    public <T> Uni<T> withRetry(Supplier<Uni<T>> operation, String operationName) {
        var uni = attempt(operation, operationName);
        if (maxRetries > 0) {
            uni = uni.onFailure().retry().atMost(maxRetries);
        }
        return uni.onFailure().transform(error -> toUnavailable(operationName, error));
    }

    public Duration timeout() {
        return timeout;
    }

    public int maxRetries() {
        return maxRetries;
    }

    private <T> Uni<T> attempt(Supplier<Uni<T>> operation, String operationName) {
        return Uni.createFrom()
                .deferred(() -> operation.get())
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Store operation timeout: {0} in {1} after {2}", operationName, storeName, timeout);
                    recordTimeout(operationName);
                    return new StoreUnavailableException(
                            operationName, "Store operation timeout: " + operationName + " in " + storeName);
                });
    }

    private Throwable toUnavailable(String operationName, Throwable error) {
        if (error instanceof StoreUnavailableException) {
            return error;
        }
        LOG.warnv("Store operation failure: {0} in {1}: {2}", operationName, storeName, error.getMessage());
        recordFailure(operationName);
        return new StoreUnavailableException(
                operationName, "Store operation failed: " + operationName + " in " + storeName, error);
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordStoreTimeout(storeName, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordStoreFailure(storeName, operationName);
        }
    }
}
