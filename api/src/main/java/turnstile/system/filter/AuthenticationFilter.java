package turnstile.system.filter;

import java.util.Optional;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.ext.Provider;

import org.jboss.logging.Logger;

import turnstile.adapter.in.problem.GatewayProblem;
import turnstile.core.model.RequestContext;
import turnstile.core.model.auth.AuthenticationResult;
import turnstile.core.model.auth.Claims;
import turnstile.core.service.auth.AudienceResolver;
import turnstile.core.service.auth.AuthenticationService;

/**
 * JAX-RS filter that authenticates protected paths and attaches a {@link RequestContext}
 * to every request.
 *
 * <p>Protected paths without a valid bearer token are aborted with 401 and a
 * {@code WWW-Authenticate: Bearer} challenge. All other requests continue with a context
 * carrying the verified claims, if any, and the resolved audience.
 *
 * <p>Downstream resources read the context via:
 * <pre>
 * RequestContext ctx = (RequestContext) requestContext.getProperty(RequestContext.PROPERTY);
 * </pre>
 */
@Provider
@Priority(Priorities.AUTHENTICATION)
public class AuthenticationFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(AuthenticationFilter.class);


    private final AuthenticationService authenticationService;
    private final AudienceResolver audienceResolver;

    @Inject
    public AuthenticationFilter(AuthenticationService authenticationService, AudienceResolver audienceResolver) {
        this.authenticationService = authenticationService;
        this.audienceResolver = audienceResolver;
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        final var path = requestContext.getUriInfo().getPath();
        final var authorization = requestContext.getHeaderString(HttpHeaders.AUTHORIZATION);

        final var result = authenticationService.authenticate(path, authorization);
        if (result instanceof AuthenticationResult.Failure failure) {
            LOG.debugf("Authentication failed for %s: %s", path, failure.reason());
            requestContext.abortWith(
                    GatewayProblem.unauthorized(failure.statusCode(), failure.reason()).getResponse());
            return;
        }

        final Optional<Claims> claims = result instanceof AuthenticationResult.Success success
                ? Optional.of(success.claims())
                : Optional.empty();
        final var audience = audienceResolver.resolve(
                Optional.ofNullable(requestContext.getHeaderString(audienceResolver.headerName())), claims);

        requestContext.setProperty(
                RequestContext.PROPERTY,
                claims.map(c -> RequestContext.authenticated(c, audience))
                        .orElseGet(() -> RequestContext.anonymous(audience)));
    }
}
