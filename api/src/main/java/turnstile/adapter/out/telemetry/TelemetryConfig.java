package turnstile.adapter.out.telemetry;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Telemetry configuration.
 *
 * <p>Configuration prefix: {@code turnstile.telemetry}
 */
@ConfigMapping(prefix = "turnstile.telemetry")
public interface TelemetryConfig {

    MetricsConfig metrics();

    /**
     * Micrometer metrics settings.
     */
    interface MetricsConfig {

        /**
         * Record send and authentication metrics.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
