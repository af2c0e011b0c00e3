package turnstile.core.model.message;

/**
 * Outcome reported by a provider for one send attempt.
 *
 * <p>{@code providerMessage} is diagnostic text only. A rejected send may still carry
 * a non-empty message (e.g. "Invalid template"), so callers must gate on
 * {@link #delivered()} and never infer success from the text.
 *
 * @param delivered       whether the provider accepted the message
 * @param providerMessage provider-reported message or identifier
 */
public record OutboundMessageResult(boolean delivered, String providerMessage) {

    public OutboundMessageResult {
        if (providerMessage == null) {
            providerMessage = "";
        }
    }

    public static OutboundMessageResult delivered(String providerMessage) {
        return new OutboundMessageResult(true, providerMessage);
    }

    public static OutboundMessageResult rejected(String providerMessage) {
        return new OutboundMessageResult(false, providerMessage);
    }
}
