package warden.adapter.in.rest;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.ratelimit.RuleKey;
import warden.core.port.in.EnforcementManagement;
import warden.core.service.ratelimit.RuleRegistry;

/**
 * REST resource for enforcement administration.
 *
 * <p>
 * Provides endpoints for:
 * <ul>
 * <li>Inspecting usage, block status and monitor state of an identifier</li>
 * <li>Blocking and unblocking identifiers</li>
 * <li>Resetting a counter</li>
 * <li>Listing the active rules</li>
 * </ul>
 *
 * <p>
 * Enabled with the build property {@code warden.admin.enabled=true}. Access control
 * is left to the deployment (network policy or an authenticating proxy).
 */
@Path("/admin/enforcement")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@IfBuildProperty(name = "warden.admin.enabled", stringValue = "true")
public class EnforcementAdminResource {

    private static final Logger LOG = Logger.getLogger(EnforcementAdminResource.class);
    private static final Duration DEFAULT_BLOCK_DURATION = Duration.ofHours(1);

    private final EnforcementManagement management;
    private final RuleRegistry registry;

    public EnforcementAdminResource(EnforcementManagement management, RuleRegistry registry) {
        this.management = management;
        this.registry = registry;
    }

    /**
     * Get usage statistics for an identifier.
     *
     * @param identifier the identifier
     * @return block entry, monitor state and per-endpoint counters
     */
    @GET
    @Path("/identifiers/{identifier}")
    public Uni<Response> getUsage(@PathParam("identifier") String identifier) {
        return management.getUsage(requireIdentifier(identifier))
                .map(usage -> Response.ok(usage).build());
    }

    /**
     * Get the abuse monitor state of an identifier.
     *
     * @param identifier the identifier
     * @return the monitor state
     */
    @GET
    @Path("/identifiers/{identifier}/state")
    public Response getState(@PathParam("identifier") String identifier) {
        final var state = management.monitorState(requireIdentifier(identifier));
        return Response.ok(Map.of("identifier", identifier, "state", state.name())).build();
    }

    /**
     * Block an identifier.
     *
     * @param identifier the identifier
     * @param request reason and ISO-8601 duration (default one hour)
     * @return 201 when a new block was created, 200 when a block already existed
     */
    @POST
    @Path("/identifiers/{identifier}/block")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> block(@PathParam("identifier") String identifier, BlockRequest request) {
        final var id = requireIdentifier(identifier);
        final var reason = request != null && request.reason() != null ? request.reason() : "manual block";
        final var duration = parseDuration(request != null ? request.duration() : null);

        return management.block(id, reason, duration).map(created -> {
            LOG.infof("Admin block for %s (%s, %s): created=%s", id, reason, duration, created);
            return Response.status(created ? Response.Status.CREATED : Response.Status.OK)
                    .entity(Map.of("identifier", id, "created", created, "duration", duration.toString()))
                    .build();
        });
    }

    /**
     * Remove the block on an identifier.
     *
     * @param identifier the identifier
     * @return 204 when unblocked
     */
    @DELETE
    @Path("/identifiers/{identifier}/block")
    public Uni<Response> unblock(@PathParam("identifier") String identifier) {
        final var id = requireIdentifier(identifier);
        return management.unblock(id).map(removed -> {
            if (!removed) {
                throw new NotFoundException("Identifier is not blocked: " + id);
            }
            LOG.infof("Admin unblock for %s", id);
            return Response.noContent().build();
        });
    }

    /**
     * Reset the counter of an identifier on an endpoint.
     *
     * @param identifier the identifier
     * @param endpoint the endpoint
     * @return 204 when a counter was deleted
     */
    @DELETE
    @Path("/identifiers/{identifier}/counters/{endpoint}")
    public Uni<Response> reset(@PathParam("identifier") String identifier, @PathParam("endpoint") String endpoint) {
        final var id = requireIdentifier(identifier);
        return management.reset(id, endpoint).map(deleted -> {
            if (!deleted) {
                throw new NotFoundException("No active counter for " + id + " on " + endpoint);
            }
            return Response.noContent().build();
        });
    }

    /**
     * List the active rules.
     *
     * @return rules with the fallback rule
     */
    @GET
    @Path("/rules")
    public Response listRules() {
        final var rules = registry.rules().entrySet().stream()
                .sorted(Map.Entry.comparingByKey(
                        Comparator.comparing(RuleKey::endpoint).thenComparing(RuleKey::tier)))
                .map(e -> Map.of(
                        "endpoint", e.getKey().endpoint(),
                        "tier", e.getKey().tier(),
                        "rule", e.getValue()))
                .toList();
        return Response.ok(Map.of("rules", rules, "fallback", registry.fallbackRule())).build();
    }

    private static String requireIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new BadRequestException("identifier must not be blank");
        }
        return identifier;
    }

    private static Duration parseDuration(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_BLOCK_DURATION;
        }
        try {
            final var duration = Duration.parse(value);
            if (duration.isNegative() || duration.isZero()) {
                throw new BadRequestException("duration must be positive");
            }
            return duration;
        } catch (DateTimeParseException e) {
            throw new BadRequestException("duration must be an ISO-8601 duration such as PT15M");
        }
    }

    /**
     * Request body for blocking an identifier.
     *
     * @param reason why the identifier is blocked
     * @param duration ISO-8601 duration of the block
     */
    public record BlockRequest(String reason, String duration) {}
}
