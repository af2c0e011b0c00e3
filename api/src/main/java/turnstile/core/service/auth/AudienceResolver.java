package turnstile.core.service.auth;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import turnstile.core.config.AuthConfig;
import turnstile.core.model.auth.Claims;

/**
 * Selects the audience (tenant) of a request.
 *
 * <p>Precedence, first non-blank wins:
 * <ol>
 *   <li>the audience override header</li>
 *   <li>the string {@code aud} claim of the verified token</li>
 *   <li>the configured default audience</li>
 * </ol>
 *
 * <p>Runs for public requests too, in which case there are no claims and the header or
 * default decides.
 */
@ApplicationScoped
public class AudienceResolver {

    private final String headerName;
    private final String defaultAudience;

    @Inject
    public AudienceResolver(AuthConfig config) {
        this(config.audienceHeader(), config.jwt().aud());
    }

    AudienceResolver(String headerName, String defaultAudience) {
        if (defaultAudience == null || defaultAudience.isBlank()) {
            throw new IllegalStateException("A default audience must be configured (turnstile.auth.jwt.aud)");
        }
        this.headerName = headerName;
        this.defaultAudience = defaultAudience;
    }

    /**
     * Name of the audience override header.
     */
    public String headerName() {
        return headerName;
    }

    public String defaultAudience() {
        return defaultAudience;
    }

    /**
     * @param headerValue value of the audience header, if the request carried one
     * @param claims      verified claims, empty when the request is unauthenticated
     * @return the selected audience, never blank
     */
    public String resolve(Optional<String> headerValue, Optional<Claims> claims) {
        if (headerValue != null) {
            final var fromHeader = headerValue.filter(value -> !value.isBlank());
            if (fromHeader.isPresent()) {
                return fromHeader.get();
            }
        }

        if (claims != null) {
            final var fromClaims = claims.flatMap(Claims::audience);
            if (fromClaims.isPresent()) {
                return fromClaims.get();
            }
        }

        return defaultAudience;
    }
}
