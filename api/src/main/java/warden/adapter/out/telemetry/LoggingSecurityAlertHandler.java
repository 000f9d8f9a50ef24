package warden.adapter.out.telemetry;

import org.jboss.logging.Logger;

import warden.core.model.abuse.SecurityAlert;
import warden.spi.SecurityAlertHandler;

/**
 * Security alert handler that logs alerts using JBoss Logging.
 *
 * <p>This is a built-in handler with priority 0 that always runs.
 * Log levels are based on alert severity:
 * <ul>
 *   <li>LOW severity → INFO level</li>
 *   <li>MEDIUM severity → WARN level</li>
 *   <li>HIGH severity → ERROR level</li>
 * </ul>
 */
public class LoggingSecurityAlertHandler implements SecurityAlertHandler {

    private static final Logger LOG = Logger.getLogger("warden.security");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public String description() {
        return "Logs security alerts using JBoss Logging";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public void handle(SecurityAlert alert) {
        final var message = format(alert);
        switch (alert.severity()) {
            case LOW -> LOG.info(message);
            case MEDIUM -> LOG.warn(message);
            case HIGH -> LOG.error(message);
        }
    }

    static String format(SecurityAlert alert) {
        return String.format(
                "%s: identifier=%s severity=%s summary=%s detectedAt=%s",
                alert.type(), alert.identifier(), alert.severity(), alert.summary(), alert.detectedAt());
    }
}
