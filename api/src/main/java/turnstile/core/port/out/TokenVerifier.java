package turnstile.core.port.out;

import turnstile.core.model.auth.TokenValidationResult;

/**
 * Port for cryptographic verification of bearer tokens.
 *
 * <p>Implementations pin a single signing algorithm at construction and must reject any
 * token that declares a different one, including {@code none}. Verification is a pure
 * function of token, secret and current time: no retries and no side effects.
 */
public interface TokenVerifier {

    /**
     * Verify a compact-serialized token.
     *
     * @param token the token, without the "Bearer " prefix
     * @return {@link TokenValidationResult.Valid} with the claims, or
     *         {@link TokenValidationResult.Invalid} with a reason free of secret material
     */
    TokenValidationResult verify(String token);
}
