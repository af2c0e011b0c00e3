package turnstile.core.port.in;

import io.smallrye.mutiny.Uni;

import turnstile.core.model.message.MessageChannel;
import turnstile.core.model.message.OtpDispatch;

/**
 * Use case for delivering one-time passcodes.
 */
public interface OtpDispatchUseCase {

    /**
     * Generate a passcode and send it to a phone number.
     *
     * @param phone        recipient phone number
     * @param channel      delivery channel
     * @param providerName provider to use, or null for the configured default
     * @return the dispatched passcode, or a {@link turnstile.spi.ProviderException} failure
     */
    Uni<OtpDispatch> dispatch(String phone, MessageChannel channel, String providerName);
}
