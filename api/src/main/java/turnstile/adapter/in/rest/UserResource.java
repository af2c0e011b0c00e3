package turnstile.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;

import turnstile.adapter.in.dto.UserInfoDto;
import turnstile.adapter.in.problem.GatewayProblem;
import turnstile.core.model.RequestContext;

/**
 * Returns the verified claims of the caller.
 *
 * <p>{@code /user} is a protected path, so requests only reach this resource with a
 * valid bearer token.
 */
@Path("/user")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class UserResource {

    @GET
    public UserInfoDto user(@Context ContainerRequestContext requestContext) {
        final var context = (RequestContext) requestContext.getProperty(RequestContext.PROPERTY);
        if (context == null || !context.isAuthenticated()) {
            throw GatewayProblem.unauthorized("This endpoint requires a Bearer token");
        }
        return UserInfoDto.fromContext(context);
    }
}
