package warden.core.model.ratelimit;

/**
 * Why a {@link Decision} was reached.
 */
public enum DecisionReason {
    /** Request counted (or peeked) and within the limit. */
    WITHIN_LIMIT,
    /** Request exceeded the rule's limit. */
    LIMIT_EXCEEDED,
    /** The rule closes the endpoint for this tier. */
    ENDPOINT_CLOSED,
    /** The identifier is on the block list. */
    BLOCKED,
    /** The counter store failed and the rule's failure policy decided. */
    STORE_UNAVAILABLE,
    /** Rate limiting is disabled. */
    DISABLED
}
