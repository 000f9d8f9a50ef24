package warden.core.model.ratelimit;

/**
 * Outcome of the request being evaluated, as reported by the caller.
 */
public enum Outcome {
    /** Outcome not known yet (evaluated before the request is handled). */
    PENDING,
    /** The request succeeded. */
    SUCCESS,
    /** The request failed (e.g., wrong password). */
    FAILURE
}
