package warden.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import warden.core.model.abuse.AlertSeverity;
import warden.core.model.abuse.AlertType;
import warden.core.model.abuse.SecurityAlert;
import warden.core.service.abuse.Subscription;
import warden.core.service.abuse.ViolationMonitor;
import warden.spi.SecurityAlertHandler;

@DisplayName("SecurityAlertHandlerRegistrar")
class SecurityAlertHandlerRegistrarTest {

    private ViolationMonitor monitor;
    private SimpleMeterRegistry meterRegistry;
    private SecurityAlertHandlerRegistrar registrar;

    @BeforeEach
    void setUp() {
        monitor = mock(ViolationMonitor.class);
        meterRegistry = new SimpleMeterRegistry();
        when(monitor.subscribe(any())).thenReturn(mock(Subscription.class));
        registrar = new SecurityAlertHandlerRegistrar(monitor, meterRegistry);
    }

    @Test
    @DisplayName("should subscribe available handlers by priority")
    void shouldSubscribeByPriority() {
        final var unavailable = mock(SecurityAlertHandler.class);
        when(unavailable.isAvailable()).thenReturn(false);

        registrar.register(List.of(new LoggingSecurityAlertHandler(), new MetricsSecurityAlertHandler(), unavailable));

        final var names = registrar.getHandlers().stream().map(SecurityAlertHandler::name).toList();
        assertEquals(List.of("metrics", "logging"), names);
    }

    @Test
    @DisplayName("should route alerts to the metrics handler")
    @SuppressWarnings("unchecked")
    void shouldRouteAlerts() {
        registrar.register(List.of(new MetricsSecurityAlertHandler()));

        final ArgumentCaptor<Consumer<SecurityAlert>> captor = ArgumentCaptor.forClass(Consumer.class);
        verify(monitor).subscribe(captor.capture());
        captor.getValue().accept(new SecurityAlert(
                AlertType.BRUTE_FORCE, AlertSeverity.HIGH, "10.0.0.1", List.of(), Map.of("violations", 3), null));

        assertEquals(1.0, meterRegistry.get("warden.alerts.total")
                .tag("type", "brute_force")
                .tag("severity", "high")
                .counter()
                .count());
    }

    @Test
    @DisplayName("should unsubscribe and close handlers on shutdown")
    void shouldCloseOnShutdown() {
        final var subscription = mock(Subscription.class);
        final var handler = mock(SecurityAlertHandler.class);
        when(handler.isAvailable()).thenReturn(true);
        when(handler.name()).thenReturn("custom");
        when(monitor.subscribe(any())).thenReturn(subscription);

        registrar.register(List.of(handler));
        registrar.shutdown();

        verify(subscription).unsubscribe();
        verify(handler).close();
    }

    @Test
    @DisplayName("should find the bundled handlers with ServiceLoader")
    void shouldLoadBundledHandlers() {
        registrar.onStart(null);

        final var names = registrar.getHandlers().stream().map(SecurityAlertHandler::name).toList();
        assertTrue(names.containsAll(List.of("logging", "metrics")));
    }
}
