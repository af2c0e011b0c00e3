package turnstile.adapter.out.auth;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.jwx.HeaderParameterNames;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

import turnstile.core.config.AuthConfig;
import turnstile.core.model.auth.Claims;
import turnstile.core.model.auth.TokenValidationResult;
import turnstile.core.port.out.TokenVerifier;

/**
 * Verifies HMAC-signed JWTs against a shared secret using jose4j.
 *
 * <p>The signing algorithm is pinned at construction. The declared {@code alg} header is
 * compared with the pinned value before any cryptographic work, so tokens declaring
 * {@code none} or an asymmetric algorithm are rejected with an explicit reason. The
 * consumer is additionally restricted to the pinned algorithm through
 * {@link AlgorithmConstraints}.
 *
 * <p>Instances are immutable and safe for concurrent use.
 */
@ApplicationScoped
public class HmacTokenVerifier implements TokenVerifier {

    private static final Logger LOG = Logger.getLogger(HmacTokenVerifier.class);

    static final String MALFORMED = "Invalid token: malformed token";
    static final String UNEXPECTED_METHOD = "Invalid token: unexpected signing method: %s";
    static final String BAD_SIGNATURE = "Invalid token: signature verification failed";
    static final String EXPIRED = "Invalid token: token has expired";
    static final String NOT_YET_VALID = "Invalid token: token is not yet valid";

    private static final Map<String, Integer> MINIMUM_KEY_BYTES = Map.of(
            AlgorithmIdentifiers.HMAC_SHA256, 32,
            AlgorithmIdentifiers.HMAC_SHA384, 48,
            AlgorithmIdentifiers.HMAC_SHA512, 64);

    private final String algorithm;
    private final JwtConsumer consumer;

    @Inject
    public HmacTokenVerifier(AuthConfig config) {
        this(
                config.jwt()
                        .secret()
                        .orElseThrow(() -> new IllegalStateException("turnstile.auth.jwt.secret must be configured")),
                config.jwt().algorithm(),
                config.jwt().clockSkew());
    }

    HmacTokenVerifier(String secret, String algorithm, Duration clockSkew) {
        final var minimum = MINIMUM_KEY_BYTES.get(algorithm);
        if (minimum == null) {
            throw new IllegalStateException(
                    "Unsupported token signing algorithm: %s (expected one of HS256, HS384, HS512)"
                            .formatted(algorithm));
        }
        final var key = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
        if (key.length < minimum) {
            throw new IllegalStateException("Token secret for %s must be at least %d bytes, got %d"
                    .formatted(algorithm, minimum, key.length));
        }

        this.algorithm = algorithm;
        this.consumer = new JwtConsumerBuilder()
                .setVerificationKey(new HmacKey(key))
                .setJwsAlgorithmConstraints(new AlgorithmConstraints(ConstraintType.PERMIT, algorithm))
                .setSkipDefaultAudienceValidation()
                .setAllowedClockSkewInSeconds((int) clockSkew.toSeconds())
                .build();
    }

    void onStart(@Observes StartupEvent event) {
        LOG.infof("Bearer token verification pinned to %s", algorithm);
    }

    public String algorithm() {
        return algorithm;
    }

    @Override
    public TokenValidationResult verify(String token) {
        if (token == null || token.isBlank()) {
            return new TokenValidationResult.Invalid(MALFORMED);
        }

        final Object declared;
        try {
            final var jws = new JsonWebSignature();
            jws.setCompactSerialization(token);
            declared = jws.getHeaders().getObjectHeaderValue(HeaderParameterNames.ALGORITHM);
        } catch (JoseException e) {
            LOG.debugv("Token could not be parsed: {0}", e.getMessage());
            return new TokenValidationResult.Invalid(MALFORMED);
        }

        // alg is attacker-controlled JSON and may be any type
        if (declared != null && !(declared instanceof String)) {
            LOG.debugv("Token alg header is not a string: {0}", declared.getClass().getSimpleName());
            return new TokenValidationResult.Invalid(MALFORMED);
        }

        if (!algorithm.equals(declared)) {
            return new TokenValidationResult.Invalid(UNEXPECTED_METHOD.formatted(declared));
        }

        try {
            final var claims = consumer.processToClaims(token);
            return new TokenValidationResult.Valid(Claims.of(claims.getClaimsMap()));
        } catch (InvalidJwtException e) {
            LOG.debugv("Token rejected: {0}", e.getMessage());
            return new TokenValidationResult.Invalid(summarize(e));
        }
    }

    private static String summarize(InvalidJwtException e) {
        if (e.hasExpired()) {
            return EXPIRED;
        }
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
            return BAD_SIGNATURE;
        }
        if (e.hasErrorCode(ErrorCodes.NOT_YET_VALID)) {
            return NOT_YET_VALID;
        }
        return MALFORMED;
    }
}
