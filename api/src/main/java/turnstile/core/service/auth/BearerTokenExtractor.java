package turnstile.core.service.auth;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Extracts the token from an {@code Authorization: Bearer <token>} header.
 *
 * <p>Accepts exactly "Bearer" or "bearer", a single space and one non-empty token
 * without whitespace. Anything else (other schemes, other casing, extra spaces or
 * segments) is rejected.
 */
public final class BearerTokenExtractor {

    public static final String AUTHORIZATION_HEADER = "Authorization";

    private static final Pattern BEARER_PATTERN = Pattern.compile("^[Bb]earer (\\S+)$");

    private BearerTokenExtractor() {}

    /**
     * @param headerValue raw Authorization header value, may be null
     * @return the token, or empty when the header does not match
     */
    public static Optional<String> extract(String headerValue) {
        if (headerValue == null || headerValue.isEmpty()) {
            return Optional.empty();
        }
        final var matcher = BEARER_PATTERN.matcher(headerValue);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1));
    }
}
