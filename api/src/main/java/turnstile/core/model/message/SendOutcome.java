package turnstile.core.model.message;

/**
 * Outcome of a send attempt, for metrics.
 */
public enum SendOutcome {
    DELIVERED,
    REJECTED,
    UNSUPPORTED_CHANNEL,
    TRANSPORT_ERROR,
    MALFORMED_RESPONSE,
    ERROR
}
