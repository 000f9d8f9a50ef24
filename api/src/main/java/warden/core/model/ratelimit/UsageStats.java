package warden.core.model.ratelimit;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import warden.core.model.abuse.BlockEntry;
import warden.core.model.abuse.MonitorState;

/**
 * Read-only usage report for one identifier.
 *
 * @param identifier the identifier
 * @param block the active block, if any
 * @param monitorState the abuse monitor state
 * @param endpoints usage per registered endpoint with an open window
 */
public record UsageStats(
        String identifier, Optional<BlockEntry> block, MonitorState monitorState, List<EndpointUsage> endpoints) {

    public UsageStats {
        block = block != null ? block : Optional.empty();
        endpoints = endpoints != null ? List.copyOf(endpoints) : List.of();
    }

    /**
     * Counter state for one endpoint.
     *
     * @param endpoint the endpoint name
     * @param count requests counted in the current window
     * @param limit the limit of the endpoint's default rule
     * @param remaining remaining requests under that limit
     * @param resetAt when the current window ends
     */
    public record EndpointUsage(String endpoint, long count, long limit, long remaining, Instant resetAt) {}
}
