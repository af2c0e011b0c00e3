package turnstile.core.model.provider;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported SMS/OTP delivery providers.
 */
public enum SmsProviderType {
    MSG91("msg91"),
    TWILIO("twilio");

    private final String providerName;

    SmsProviderType(String providerName) {
        this.providerName = providerName;
    }

    public String providerName() {
        return providerName;
    }

    public static Optional<SmsProviderType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        final var normalized = name.trim().toLowerCase(Locale.ROOT);
        for (SmsProviderType type : values()) {
            if (type.providerName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
