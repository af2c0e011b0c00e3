package turnstile.core.model.message;

/**
 * A single send attempt to an SMS-capable provider.
 *
 * @param recipient phone number of the recipient
 * @param body      rendered message text
 * @param channel   delivery channel
 * @param code      the one-time passcode embedded in the message
 */
public record OutboundMessageRequest(String recipient, String body, MessageChannel channel, String code) {

    public OutboundMessageRequest {
        if (recipient == null || recipient.isBlank()) {
            throw new IllegalArgumentException("Recipient cannot be null or blank");
        }
        if (channel == null) {
            throw new IllegalArgumentException("Channel cannot be null");
        }
        if (body == null) {
            body = "";
        }
        if (code == null) {
            code = "";
        }
    }
}
