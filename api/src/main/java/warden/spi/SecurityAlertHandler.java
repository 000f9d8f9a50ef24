package warden.spi;

import warden.core.model.abuse.SecurityAlert;

/**
 * SPI for receiving security alerts raised by the violation monitor.
 *
 * <p>Platform teams implement this interface to forward alerts to their
 * paging or ticketing systems. Implementations are discovered via
 * {@link java.util.ServiceLoader} and subscribed to the monitor at startup.
 *
 * <p>Built-in handlers:
 * <ul>
 *   <li>{@code logging} - Logs alerts using JBoss Logging (priority 0)</li>
 *   <li>{@code metrics} - Records alerts as Micrometer counters (priority 10)</li>
 * </ul>
 *
 * <p>Register implementations in:
 * {@code META-INF/services/warden.spi.SecurityAlertHandler}
 */
public interface SecurityAlertHandler {

    /**
     * Returns the unique name of this handler.
     *
     * @return handler name (e.g., "pagerduty", "webhook")
     */
    String name();

    /**
     * Returns a human-readable description of this handler.
     *
     * @return handler description
     */
    default String description() {
        return name() + " security alert handler";
    }

    /**
     * Returns the priority of this handler. Higher priority handlers are subscribed first.
     *
     * @return priority value (higher = invoked first)
     */
    default int priority() {
        return 0;
    }

    /**
     * Returns whether this handler should receive alerts.
     *
     * @return true if the handler's dependencies are configured
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Handle an alert.
     *
     * <p>Called on the monitor's worker thread. Exceptions are logged by the
     * monitor and do not reach other handlers, but long-running I/O should be
     * moved off the calling thread.
     *
     * @param alert the security alert
     */
    void handle(SecurityAlert alert);

    /**
     * Called during shutdown to release any resources.
     */
    default void close() {}
}
