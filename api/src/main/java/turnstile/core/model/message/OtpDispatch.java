package turnstile.core.model.message;

/**
 * A one-time passcode that was handed to a provider.
 *
 * <p>The caller is responsible for persisting {@code code} if it needs to verify it
 * later; it must never be echoed back to the requesting client.
 *
 * @param provider name of the provider that accepted the message
 * @param code     the generated passcode
 * @param result   the provider's result
 */
public record OtpDispatch(String provider, String code, OutboundMessageResult result) {}
