package turnstile.core.model.auth;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Claims carried by a verified bearer token.
 *
 * <p>Only produced by a successful verification. The underlying map is an
 * unmodifiable copy, so a {@code Claims} value can be handed to any downstream
 * handler of the same request without defensive copying.
 *
 * @param values claim name to claim value, as decoded from the token payload
 */
public record Claims(Map<String, Object> values) {

    public static final String SUBJECT = "sub";
    public static final String AUDIENCE = "aud";
    public static final String EXPIRATION = "exp";

    public Claims {
        if (values == null) {
            values = Map.of();
        } else {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }
    }

    public static Claims of(Map<String, Object> values) {
        return new Claims(values);
    }

    /**
     * Raw claim value.
     *
     * @param name claim name
     * @return the value, or empty if the claim is absent
     */
    public Optional<Object> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * Claim value when it is a non-blank string.
     *
     * <p>Claims of any other JSON type (arrays, numbers, objects) yield empty.
     *
     * @param name claim name
     * @return the string value, or empty
     */
    public Optional<String> stringClaim(String name) {
        if (values.get(name) instanceof String value && !value.isBlank()) {
            return Optional.of(value);
        }
        return Optional.empty();
    }

    public Optional<String> subject() {
        return stringClaim(SUBJECT);
    }

    public Optional<String> audience() {
        return stringClaim(AUDIENCE);
    }

    public Optional<Instant> expiresAt() {
        if (values.get(EXPIRATION) instanceof Number seconds) {
            return Optional.of(Instant.ofEpochSecond(seconds.longValue()));
        }
        return Optional.empty();
    }
}
