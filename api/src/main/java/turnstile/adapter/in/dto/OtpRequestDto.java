package turnstile.adapter.in.dto;

/**
 * Request to send a one-time passcode.
 *
 * @param phone    recipient phone number (required)
 * @param channel  delivery channel, "sms" or "whatsapp" (optional, defaults to sms)
 * @param provider provider name (optional, defaults to the configured provider)
 */
public record OtpRequestDto(String phone, String channel, String provider) {}
