package warden.core.model.ratelimit;

import java.util.Map;
import java.util.Objects;

/**
 * Input to an enforcement evaluation.
 *
 * <p>The identifier and tier are derived by the caller (API key, then forwarded IP,
 * then session subject). When a caller could match more than one tier, the caller
 * picks one; the engine does not guess a precedence.
 *
 * @param identifier the key the limit is scoped to (IP, user id, API key)
 * @param endpoint the logical endpoint name
 * @param tier the caller tier name (unknown tiers fall back to the endpoint default)
 * @param outcome the request outcome
 * @param metadata extra attributes copied into violations (e.g., client IP, user-agent hash)
 */
public record RequestContext(
        String identifier, String endpoint, String tier, Outcome outcome, Map<String, String> metadata) {

    public RequestContext {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        outcome = outcome != null ? outcome : Outcome.PENDING;
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    /**
     * Creates a context without metadata.
     */
    public static RequestContext of(String identifier, String endpoint, String tier, Outcome outcome) {
        return new RequestContext(identifier, endpoint, tier, outcome, Map.of());
    }
}
