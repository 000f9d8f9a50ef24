package warden.core.service.abuse;

/**
 * Handle returned by {@link ViolationMonitor#subscribe}. Unsubscribing twice is a no-op.
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
