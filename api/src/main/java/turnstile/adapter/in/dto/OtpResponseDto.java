package turnstile.adapter.in.dto;

/**
 * Result of a delivered passcode. The passcode itself is never returned.
 *
 * @param provider  provider that accepted the message
 * @param messageId provider-reported message identifier
 */
public record OtpResponseDto(String provider, String messageId) {}
