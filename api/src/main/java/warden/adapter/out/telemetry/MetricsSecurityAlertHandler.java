package warden.adapter.out.telemetry;

import java.util.Locale;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import warden.core.model.abuse.SecurityAlert;
import warden.spi.SecurityAlertHandler;

/**
 * Security alert handler that counts alerts as Micrometer metrics.
 *
 * <p>Records {@code warden.alerts.total} tagged by alert type and severity.
 * Unavailable until a {@link MeterRegistry} has been injected.
 */
public class MetricsSecurityAlertHandler implements SecurityAlertHandler {

    private MeterRegistry meterRegistry;

    /**
     * Called by {@link SecurityAlertHandlerRegistrar} after ServiceLoader instantiation.
     */
    public void setMeterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public String description() {
        return "Records security alerts as Micrometer metrics";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        return meterRegistry != null;
    }

    @Override
    public void handle(SecurityAlert alert) {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("warden.alerts.total")
                .description("Security alerts published by the violation monitor")
                .tag("type", alert.type().key())
                .tag("severity", alert.severity().name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }
}
