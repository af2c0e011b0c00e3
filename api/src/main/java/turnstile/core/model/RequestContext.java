package turnstile.core.model;

import java.util.Optional;

import turnstile.core.model.auth.Claims;

/**
 * Per-request authentication state, threaded from the authentication filter to
 * resource methods as a request property.
 *
 * <p>Access it downstream via:
 * <pre>
 * RequestContext ctx = (RequestContext) requestContext.getProperty(RequestContext.PROPERTY);
 * </pre>
 *
 * @param claims   verified token claims, empty for requests that were not authenticated
 * @param audience the resolved audience, never blank
 */
public record RequestContext(Optional<Claims> claims, String audience) {

    /**
     * Request property key under which the context is stored.
     */
    public static final String PROPERTY = "turnstile.request.context";

    public RequestContext {
        if (claims == null) {
            claims = Optional.empty();
        }
        if (audience == null || audience.isBlank()) {
            throw new IllegalArgumentException("Audience cannot be null or blank");
        }
    }

    public static RequestContext anonymous(String audience) {
        return new RequestContext(Optional.empty(), audience);
    }

    public static RequestContext authenticated(Claims claims, String audience) {
        return new RequestContext(Optional.of(claims), audience);
    }

    public boolean isAuthenticated() {
        return claims.isPresent();
    }
}
