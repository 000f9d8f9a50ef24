package warden.core.port.in;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.Decision;
import warden.core.model.ratelimit.RequestContext;

/**
 * Inbound port for request enforcement.
 *
 * <p>Called once per request by the surrounding HTTP layer, which maps the
 * decision to {@code X-RateLimit-*} and {@code Retry-After} headers.
 */
public interface EnforcementUseCase {

    /**
     * Decide whether a request may proceed.
     *
     * <p>Blocked identifiers are denied before any counter is touched. Store
     * failures never propagate; they are resolved by the rule's failure policy.
     *
     * @param context the request context
     * @return the decision
     */
    Uni<Decision> evaluate(RequestContext context);

    /**
     * Report the current quota for a request without consuming any.
     *
     * @param context the request context (outcome is ignored)
     * @return the decision the next counted request would see before counting
     */
    Uni<Decision> check(RequestContext context);
}
