package turnstile.core.model.message;

import java.util.Locale;
import java.util.Optional;

/**
 * Delivery channel for an outbound one-time passcode.
 */
public enum MessageChannel {
    SMS("sms"),
    WHATSAPP("whatsapp");

    private final String wireName;

    MessageChannel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parse a channel from its wire name, case-insensitively.
     *
     * @param value the wire value, e.g. "sms"
     * @return the channel, or empty if the value is unknown
     */
    public static Optional<MessageChannel> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        final var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MessageChannel channel : values()) {
            if (channel.wireName.equals(normalized)) {
                return Optional.of(channel);
            }
        }
        return Optional.empty();
    }
}
