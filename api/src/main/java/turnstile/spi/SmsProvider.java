package turnstile.spi;

import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;

import turnstile.core.model.message.MessageChannel;
import turnstile.core.model.message.OutboundMessageRequest;
import turnstile.core.model.message.OutboundMessageResult;

/**
 * SPI for one-time passcode delivery through a third-party SMS provider.
 *
 * <p>Instances are built once at startup from read-only configuration and reused
 * concurrently by every request, so implementations must not keep per-call state.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>msg91 - Msg91 flow API, SMS only</li>
 *   <li>twilio - Twilio messaging API, SMS and WhatsApp</li>
 * </ul>
 *
 * <h2>Failure contract</h2>
 * <p>{@link #sendMessage} either emits a delivered {@link OutboundMessageResult} or fails with
 * exactly one of:
 * <ul>
 *   <li>{@link UnsupportedChannelException} - channel not offered, no call attempted</li>
 *   <li>{@link ProviderTransportException} - connection error or timeout</li>
 *   <li>{@link ProviderResponseMalformedException} - body could not be parsed</li>
 *   <li>{@link ProviderRejectedException} - provider reported a non-success status</li>
 * </ul>
 * <p>A single attempt is made; retry policy belongs to the caller.
 */
public interface SmsProvider {

    /**
     * Provider name used for lookup and in error messages.
     *
     * @return provider name (e.g., "msg91")
     */
    String name();

    /**
     * Channels this provider can deliver on.
     *
     * @return supported channels
     */
    Set<MessageChannel> supportedChannels();

    /**
     * Check whether a channel is supported.
     */
    default boolean supports(MessageChannel channel) {
        return supportedChannels().contains(channel);
    }

    /**
     * Health indicator for the readiness endpoint.
     *
     * @return health check response, or empty if not supported
     */
    default Optional<HealthCheckResponse> healthCheck() {
        return Optional.empty();
    }

    /**
     * Send one message.
     *
     * @param request recipient, rendered body, channel and passcode
     * @return the delivered result, or a failure as described in the class documentation
     */
    Uni<OutboundMessageResult> sendMessage(OutboundMessageRequest request);
}
