package turnstile.adapter.in.rest;

import java.net.URI;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;

import turnstile.adapter.in.problem.GatewayProblem;
import turnstile.core.service.provider.ProviderRegistry;

/**
 * Starts sign-in with an external identity provider.
 *
 * <p>Redirects the user agent to the provider's authorization URL. Exchanging the
 * returned code happens elsewhere.
 */
@Path("/authorize")
@ApplicationScoped
public class ExternalAuthResource {

    private static final Logger LOG = Logger.getLogger(ExternalAuthResource.class);

    private final ProviderRegistry registry;

    @Inject
    public ExternalAuthResource(ProviderRegistry registry) {
        this.registry = registry;
    }

    @GET
    public Response authorize(@QueryParam("provider") String provider, @QueryParam("state") String state) {
        if (provider == null || provider.isBlank()) {
            throw GatewayProblem.validationError("provider is required");
        }

        final var identityProvider = registry.identityProvider(provider);
        LOG.debugf("Redirecting to %s for authorization", identityProvider.name());
        return Response.seeOther(URI.create(identityProvider.authCodeUrl(state))).build();
    }
}
