package turnstile.adapter.out.telemetry;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import turnstile.core.model.message.SendOutcome;
import turnstile.core.port.out.DispatchMetrics;

/**
 * Micrometer implementation of {@link DispatchMetrics}.
 *
 * <p>Records:
 * <ul>
 *   <li>{@code turnstile.sms.send.total} - sends by provider and outcome</li>
 *   <li>{@code turnstile.sms.send.duration} - send latency by provider and outcome</li>
 *   <li>{@code turnstile.auth.failures} - rejected bearer credentials by reason</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerDispatchMetrics implements DispatchMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerDispatchMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.metrics().enabled();
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordSend(String provider, SendOutcome outcome, long durationMs) {
        if (!enabled) {
            return;
        }

        final var outcomeTag = outcome.name().toLowerCase(Locale.ROOT);

        Counter.builder("turnstile.sms.send.total")
                .description("Total outbound OTP sends")
                .tag("provider", nullSafe(provider))
                .tag("outcome", outcomeTag)
                .register(registry)
                .increment();

        Timer.builder("turnstile.sms.send.duration")
                .description("Outbound OTP send latency")
                .tag("provider", nullSafe(provider))
                .tag("outcome", outcomeTag)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordAuthenticationFailure(String reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("turnstile.auth.failures")
                .description("Rejected bearer credentials")
                .tag("reason", nullSafe(reason))
                .register(registry)
                .increment();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
