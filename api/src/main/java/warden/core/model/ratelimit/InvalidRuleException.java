package warden.core.model.ratelimit;

/**
 * Exception thrown when a rate limit rule or its registration key is malformed.
 *
 * <p>Raised eagerly at registration time so that a broken rule set prevents
 * startup instead of surfacing on the request path.
 */
public class InvalidRuleException extends RuntimeException {

    public InvalidRuleException(String message) {
        super(message);
    }
}
