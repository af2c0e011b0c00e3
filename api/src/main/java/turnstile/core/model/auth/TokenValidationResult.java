package turnstile.core.model.auth;

/**
 * Result of verifying an incoming bearer token.
 */
public sealed interface TokenValidationResult {

    /**
     * Token signature and time-based claims checked out.
     *
     * @param claims the decoded claims
     */
    record Valid(Claims claims) implements TokenValidationResult {
        public Valid {
            if (claims == null) {
                throw new IllegalArgumentException("Claims cannot be null");
            }
        }
    }

    /**
     * Token was rejected.
     *
     * @param reason human-readable reason, never containing secret material
     */
    record Invalid(String reason) implements TokenValidationResult {
        public Invalid {
            if (reason == null || reason.isBlank()) {
                reason = "Invalid token";
            }
        }
    }
}
