package turnstile.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import turnstile.core.config.SmsConfig;
import turnstile.core.service.provider.ProviderRegistry;
import turnstile.spi.SmsProvider;

/**
 * Readiness check for the configured SMS providers.
 *
 * <p>Reports each enabled provider with its own health data. Providers are validated
 * at startup, so the check is DOWN only if a provider reports itself DOWN. No
 * outbound calls are made.
 */
@Readiness
@ApplicationScoped
public class SmsProviderHealthCheck implements HealthCheck {

    private final ProviderRegistry registry;
    private final SmsConfig config;

    @Inject
    public SmsProviderHealthCheck(ProviderRegistry registry, SmsConfig config) {
        this.registry = registry;
        this.config = config;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("sms-providers");
        builder.withData("enabled", config.enabled());
        builder.withData("default", config.provider());

        var up = true;
        for (SmsProvider provider : registry.enabledSmsProviders()) {
            final var health = provider.healthCheck();
            if (health.isEmpty()) {
                builder.withData(provider.name(), "UP");
                continue;
            }
            final var status = health.get().getStatus();
            builder.withData(provider.name(), status.name());
            up &= status == HealthCheckResponse.Status.UP;
        }

        return up ? builder.up().build() : builder.down().build();
    }
}
