package warden.core.model.abuse;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A denied request handed to the violation monitor.
 *
 * @param identifier the identifier that exceeded its limit
 * @param endpoint the endpoint the request targeted
 * @param timestamp when the denial happened
 * @param metadata request attributes supplied by the caller
 */
public record Violation(String identifier, String endpoint, Instant timestamp, Map<String, String> metadata) {

    public Violation {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        timestamp = timestamp != null ? timestamp : Instant.now();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    /**
     * Create a violation timestamped now.
     */
    public static Violation now(String identifier, String endpoint, Map<String, String> metadata) {
        return new Violation(identifier, endpoint, Instant.now(), metadata);
    }
}
