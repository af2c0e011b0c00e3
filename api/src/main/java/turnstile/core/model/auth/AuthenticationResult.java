package turnstile.core.model.auth;

/**
 * Represents the result of an authentication attempt.
 *
 * This is a sealed interface with three possible outcomes:
 * - Success: the bearer token verified, contains its Claims
 * - Failure: credential missing, malformed or rejected by the verifier
 * - Skip: the request path does not require authentication
 */
public sealed interface AuthenticationResult {

    /**
     * Authentication succeeded.
     *
     * @param claims the verified claims of the presented token
     */
    record Success(Claims claims) implements AuthenticationResult {
        public Success {
            if (claims == null) {
                throw new IllegalArgumentException("Claims cannot be null");
            }
        }
    }

    /**
     * Authentication failed with a specific reason.
     *
     * @param reason     safe, user-facing description of why authentication failed
     * @param statusCode HTTP status code to return
     */
    record Failure(String reason, int statusCode) implements AuthenticationResult {
        public Failure {
            if (reason == null || reason.isBlank()) {
                reason = "Authentication failed";
            }
            if (statusCode < 400 || statusCode >= 500) {
                statusCode = 401;
            }
        }

        public static Failure unauthorized(String reason) {
            return new Failure(reason, 401);
        }
    }

    /**
     * No authentication is required for this request.
     */
    record Skip() implements AuthenticationResult {
        private static final Skip INSTANCE = new Skip();

        public static Skip instance() {
            return INSTANCE;
        }
    }
}
