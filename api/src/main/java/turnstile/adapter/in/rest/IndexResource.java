package turnstile.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import turnstile.adapter.in.dto.ServiceInfoDto;

/**
 * Public service identification endpoint.
 */
@Path("/")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class IndexResource {

    static final String DESCRIPTION = "Turnstile is an authentication gateway for bearer tokens and OTP delivery";

    private final ServiceInfoDto info;

    @Inject
    public IndexResource(
            @ConfigProperty(name = "quarkus.application.name", defaultValue = "turnstile") String name,
            @ConfigProperty(name = "quarkus.application.version", defaultValue = "unknown") String version) {
        this.info = new ServiceInfoDto(name, version, DESCRIPTION);
    }

    @GET
    public ServiceInfoDto index() {
        return info;
    }
}
