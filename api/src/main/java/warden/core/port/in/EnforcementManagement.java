package warden.core.port.in;

import java.time.Duration;
import java.util.Map;

import io.smallrye.mutiny.Uni;

import warden.core.model.abuse.MonitorState;
import warden.core.model.ratelimit.RateLimitRule;
import warden.core.model.ratelimit.RuleKey;
import warden.core.model.ratelimit.UsageStats;

/**
 * Inbound port for administrative enforcement operations.
 */
public interface EnforcementManagement {

    /**
     * Block an identifier. An existing block is kept as is, not extended.
     *
     * @param identifier the identifier to block
     * @param reason why it is blocked
     * @param duration how long the block lasts
     * @return true if a new block was created
     */
    Uni<Boolean> block(String identifier, String reason, Duration duration);

    /**
     * Lift a block and clear the identifier's violation history and alert cooldowns.
     *
     * @param identifier the identifier
     * @return true if a block was removed
     */
    Uni<Boolean> unblock(String identifier);

    /**
     * @param identifier the identifier
     * @return true if the identifier is currently blocked
     */
    Uni<Boolean> isBlocked(String identifier);

    /**
     * Delete the counter of an identifier on an endpoint.
     *
     * @param identifier the identifier
     * @param endpoint the endpoint
     * @return true if a counter existed
     */
    Uni<Boolean> reset(String identifier, String endpoint);

    /**
     * Report block status, monitor state and per-endpoint counters of an identifier.
     *
     * @param identifier the identifier
     * @return usage statistics
     */
    Uni<UsageStats> getUsage(String identifier);

    /**
     * @param identifier the identifier
     * @return the abuse monitor state
     */
    MonitorState monitorState(String identifier);

    /**
     * Validate and atomically replace the rule set.
     *
     * @param rules the new rules
     * @throws warden.core.model.ratelimit.InvalidRuleException if any rule is invalid
     */
    void reloadRules(Map<RuleKey, RateLimitRule> rules);
}
