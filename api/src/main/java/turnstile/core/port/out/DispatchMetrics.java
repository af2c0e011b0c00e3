package turnstile.core.port.out;

import turnstile.core.model.message.SendOutcome;

/**
 * Port interface for recording authentication and provider dispatch metrics.
 *
 * <p>Keeps the core services decoupled from the metrics implementation.
 */
public interface DispatchMetrics {

    /**
     * Record an outbound send.
     *
     * @param provider   provider name
     * @param outcome    how the send ended
     * @param durationMs duration in milliseconds
     */
    void recordSend(String provider, SendOutcome outcome, long durationMs);

    /**
     * Record a rejected authentication attempt.
     *
     * @param reason short, low-cardinality reason ("missing_token", "invalid_token")
     */
    void recordAuthenticationFailure(String reason);
}
