package turnstile.core.service.auth;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import turnstile.core.config.AuthConfig;
import turnstile.core.model.auth.AuthenticationResult;
import turnstile.core.model.auth.TokenValidationResult;
import turnstile.core.port.out.DispatchMetrics;
import turnstile.core.port.out.TokenVerifier;

/**
 * Decides whether a request may reach its handler.
 *
 * <p>Protected paths require an {@code Authorization: Bearer <token>} header whose token
 * passes the {@link TokenVerifier}. Every other path is skipped.
 */
@ApplicationScoped
public class AuthenticationService {

    private static final Logger LOG = Logger.getLogger(AuthenticationService.class);

    static final String TOKEN_REQUIRED = "This endpoint requires a Bearer token";

    private final TokenVerifier tokenVerifier;
    private final DispatchMetrics metrics;
    private final boolean enabled;
    private final List<String> protectedPaths;

    @Inject
    public AuthenticationService(TokenVerifier tokenVerifier, DispatchMetrics metrics, AuthConfig config) {
        this.tokenVerifier = tokenVerifier;
        this.metrics = metrics;
        this.enabled = config.enabled();
        this.protectedPaths = config.protectedPaths().stream()
                .map(AuthenticationService::normalize)
                .filter(path -> !path.isEmpty())
                .toList();

        if (!enabled) {
            LOG.warn("Bearer authentication is disabled (turnstile.auth.enabled=false)");
        }
    }

    /**
     * Check whether a path requires a bearer token.
     *
     * @param path request path, with or without leading slash
     * @return true if the path equals or lies below a protected prefix
     */
    public boolean isProtected(String path) {
        if (!enabled) {
            return false;
        }
        final var normalized = normalize(path);
        for (String prefix : protectedPaths) {
            if (normalized.equals(prefix) || normalized.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Authenticate a request.
     *
     * @param path                request path
     * @param authorizationHeader raw Authorization header value, may be null
     * @return Skip for unprotected paths, otherwise Success or a 401 Failure
     */
    public AuthenticationResult authenticate(String path, String authorizationHeader) {
        if (!isProtected(path)) {
            return AuthenticationResult.Skip.instance();
        }

        final var token = BearerTokenExtractor.extract(authorizationHeader);
        if (token.isEmpty()) {
            LOG.debugf("Missing or malformed bearer credential for path: %s", path);
            metrics.recordAuthenticationFailure("missing_token");
            return AuthenticationResult.Failure.unauthorized(TOKEN_REQUIRED);
        }

        final var result = tokenVerifier.verify(token.get());
        if (result instanceof TokenValidationResult.Valid valid) {
            return new AuthenticationResult.Success(valid.claims());
        }

        final var reason = ((TokenValidationResult.Invalid) result).reason();
        LOG.debugf("Bearer token rejected for path %s: %s", path, reason);
        metrics.recordAuthenticationFailure("invalid_token");
        return AuthenticationResult.Failure.unauthorized(reason);
    }

    private static String normalize(String path) {
        if (path == null) {
            return "";
        }
        var result = path.trim();
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
