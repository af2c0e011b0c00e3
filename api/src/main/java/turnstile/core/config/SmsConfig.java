package turnstile.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for one-time passcode delivery.
 *
 * <p>Configuration prefix: {@code turnstile.sms}
 *
 * <p>Example configuration:
 * <pre>{@code
 * turnstile.sms.enabled=true
 * turnstile.sms.provider=msg91
 * turnstile.sms.msg91.enabled=true
 * turnstile.sms.msg91.auth-key=${MSG91_AUTH_KEY}
 * turnstile.sms.msg91.template-id=${MSG91_TEMPLATE_ID}
 * }</pre>
 */
@ConfigMapping(prefix = "turnstile.sms")
public interface SmsConfig {

    /**
     * Enable OTP delivery. When enabled, {@link #provider()} must name an enabled provider.
     */
    @WithDefault("false")
    boolean enabled();

    /**
     * Provider used when a request does not name one.
     */
    @WithDefault("msg91")
    String provider();

    /**
     * Upper bound for a single outbound provider call.
     */
    @WithDefault("PT10S")
    Duration timeout();

    /**
     * Number of digits in a generated passcode.
     */
    @WithName("otp-length")
    @WithDefault("6")
    int otpLength();

    /**
     * Message template; {@code {code}} is replaced by the passcode.
     */
    @WithDefault("Your code is {code}")
    String template();

    /**
     * Log raw provider response bodies at DEBUG level.
     *
     * <p>Bodies may contain phone numbers and provider account details, so this
     * is off unless explicitly enabled for troubleshooting.
     */
    @WithName("log-response-bodies")
    @WithDefault("false")
    boolean logResponseBodies();

    Msg91Properties msg91();

    TwilioProperties twilio();

    /**
     * Msg91 flow API credentials.
     */
    interface Msg91Properties {

        @WithDefault("false")
        boolean enabled();

        @WithName("auth-key")
        Optional<String> authKey();

        @WithName("template-id")
        Optional<String> templateId();

        @WithName("api-base")
        @WithDefault("https://control.msg91.com/api/v5/flow")
        String apiBase();
    }

    /**
     * Twilio messaging API credentials.
     */
    interface TwilioProperties {

        @WithDefault("false")
        boolean enabled();

        @WithName("account-sid")
        Optional<String> accountSid();

        @WithName("auth-token")
        Optional<String> authToken();

        @WithName("message-service-sid")
        Optional<String> messageServiceSid();

        @WithName("api-base")
        @WithDefault("https://api.twilio.com/2010-04-01")
        String apiBase();
    }
}
