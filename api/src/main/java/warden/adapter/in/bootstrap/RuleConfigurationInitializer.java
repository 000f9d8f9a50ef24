package warden.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import warden.core.config.RateLimitingConfig;
import warden.core.model.ratelimit.InvalidRuleException;
import warden.core.port.in.EnforcementManagement;
import warden.core.service.ratelimit.RuleConfigurationLoader;

/**
 * Loads the configured rate limit rules on application startup.
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>If a rule names an unknown tier: startup FAILS</li>
 *   <li>If a rule has a non-positive window or a negative limit: startup FAILS</li>
 * </ul>
 */
@ApplicationScoped
public class RuleConfigurationInitializer {

    private static final Logger LOG = Logger.getLogger(RuleConfigurationInitializer.class);

    private final EnforcementManagement management;
    private final RateLimitingConfig config;

    @Inject
    public RuleConfigurationInitializer(EnforcementManagement management, RateLimitingConfig config) {
        this.management = management;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        if (!config.enabled()) {
            LOG.info("Rate limiting is disabled, every request will be allowed");
        }
        try {
            final var rules = RuleConfigurationLoader.load(config);
            management.reloadRules(rules);
            if (rules.isEmpty()) {
                LOG.infof(
                        "No rate limit rules configured, all endpoints use the fallback of %d requests per %s",
                        config.fallback().maxRequests(), config.fallback().window());
            }
        } catch (InvalidRuleException e) {
            LOG.errorf("RULE CONFIGURATION FAILED: %s", e.getMessage());
            throw e;
        }
    }
}
