package warden.adapter.out.telemetry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import warden.core.service.abuse.Subscription;
import warden.core.service.abuse.ViolationMonitor;
import warden.spi.SecurityAlertHandler;

/**
 * Subscribes the {@link SecurityAlertHandler}s found by {@link ServiceLoader} to the
 * violation monitor at startup.
 *
 * <p>Handlers are subscribed in priority order (highest first) and closed on shutdown.
 */
@ApplicationScoped
public class SecurityAlertHandlerRegistrar {

    private static final Logger LOG = Logger.getLogger(SecurityAlertHandlerRegistrar.class);

    private final ViolationMonitor monitor;
    private final MeterRegistry meterRegistry;
    private final List<Subscription> subscriptions = new ArrayList<>();
    private List<SecurityAlertHandler> handlers = List.of();

    @Inject
    public SecurityAlertHandlerRegistrar(ViolationMonitor monitor, MeterRegistry meterRegistry) {
        this.monitor = monitor;
        this.meterRegistry = meterRegistry;
    }

    void onStart(@Observes StartupEvent event) {
        register(ServiceLoader.load(SecurityAlertHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList());
    }

    /**
     * Subscribe the available handlers among the given ones.
     *
     * @param candidates loaded handlers
     */
    void register(List<SecurityAlertHandler> candidates) {
        for (var handler : candidates) {
            if (handler instanceof MetricsSecurityAlertHandler metricsHandler) {
                metricsHandler.setMeterRegistry(meterRegistry);
            }
        }

        handlers = candidates.stream()
                .filter(SecurityAlertHandler::isAvailable)
                .sorted(Comparator.comparingInt(SecurityAlertHandler::priority).reversed())
                .toList();

        if (handlers.isEmpty()) {
            LOG.warn("No security alert handlers found - alerts will only reach programmatic subscribers");
            return;
        }
        handlers.forEach(handler -> subscriptions.add(monitor.subscribe(handler::handle)));
        LOG.infof(
                "Subscribed %d security alert handler(s): %s",
                handlers.size(),
                handlers.stream()
                        .map(h -> h.name() + "(priority=" + h.priority() + ")")
                        .toList());
    }

    @PreDestroy
    void shutdown() {
        subscriptions.forEach(Subscription::unsubscribe);
        subscriptions.clear();
        handlers.forEach(handler -> {
            try {
                handler.close();
            } catch (Exception e) {
                LOG.warnf("Error closing handler %s: %s", handler.name(), e.getMessage());
            }
        });
    }

    /**
     * @return the subscribed handlers in priority order
     */
    public List<SecurityAlertHandler> getHandlers() {
        return handlers;
    }
}
