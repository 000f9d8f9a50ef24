package warden.core.port.out;

import warden.core.model.ratelimit.DecisionReason;

/**
 * Port interface for recording enforcement metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record an enforcement decision.
     *
     * @param endpoint the evaluated endpoint
     * @param reason why the decision was reached
     * @param allowed whether the request was allowed
     */
    void recordDecision(String endpoint, DecisionReason reason, boolean allowed);

    /**
     * Record a counter store call that exceeded its timeout.
     *
     * @param store the store name
     * @param operation the store operation
     */
    void recordStoreTimeout(String store, String operation);

    /**
     * Record a counter store call that failed.
     *
     * @param store the store name
     * @param operation the store operation
     */
    void recordStoreFailure(String store, String operation);

    /**
     * Record a violation dropped because the monitor queue was full.
     */
    void recordViolationDropped();

    /**
     * Record a new block on an identifier.
     */
    void recordBlock();
}
