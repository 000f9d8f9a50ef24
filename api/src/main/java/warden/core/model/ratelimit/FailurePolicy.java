package warden.core.model.ratelimit;

/**
 * How a rule behaves when the counter store is unavailable.
 */
public enum FailurePolicy {

    /**
     * Allow the request. Suited to read-only endpoints where an outage of the
     * store should not become an outage of the service.
     */
    FAIL_OPEN,

    /**
     * Deny the request. Required for security-critical endpoints such as login,
     * where failing open would disable brute force protection.
     */
    FAIL_CLOSED
}
