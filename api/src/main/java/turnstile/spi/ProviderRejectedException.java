package turnstile.spi;

import turnstile.core.model.message.OutboundMessageResult;

/**
 * Thrown when the provider processed the request but reported a non-success status.
 *
 * <p>The provider's own message is kept on {@link #result()} for display. The exception
 * itself is authoritative: the result is always marked as not delivered.
 */
public class ProviderRejectedException extends ProviderException {

    private final OutboundMessageResult result;
    private final int statusCode;

    public ProviderRejectedException(String providerName, String status, String providerMessage, int statusCode) {
        super(
                providerName,
                "%s: provider returned status \"%s\" with message \"%s\" (code: %d)"
                        .formatted(providerName, status, providerMessage, statusCode));
        this.result = OutboundMessageResult.rejected(providerMessage);
        this.statusCode = statusCode;
    }

    public OutboundMessageResult result() {
        return result;
    }

    public int statusCode() {
        return statusCode;
    }
}
