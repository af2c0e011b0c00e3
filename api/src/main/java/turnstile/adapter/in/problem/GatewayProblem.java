package turnstile.adapter.in.problem;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.Response.Status;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * RFC 7807 Problem Details for gateway errors.
 *
 * <p>Each factory returns an exception that already carries its
 * {@code application/problem+json} response, so resources throw it, mappers and
 * filters use {@link #getResponse()}, and every endpoint reports errors the same way.
 * Unauthorized problems always carry the {@code WWW-Authenticate: Bearer} challenge.
 */
public final class GatewayProblem extends WebApplicationException {

    public static final String PROBLEM_JSON = "application/problem+json";
    public static final String BEARER_CHALLENGE = "Bearer realm=\"turnstile\"";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final transient ProblemDetail problem;

    private GatewayProblem(ProblemDetail problem, Response response) {
        super(problem.detail(), response);
        this.problem = problem;
    }

    public ProblemDetail problem() {
        return problem;
    }

    // ========== Not Found Errors ==========

    public static GatewayProblem providerNotFound(String detail) {
        return of(new ProblemDetail("Provider Not Found", 404, detail, null));
    }

    public static GatewayProblem featureDisabled(String feature) {
        return of(new ProblemDetail("Feature Disabled", 404, "%s is disabled".formatted(feature), null));
    }

    // ========== Bad Request Errors ==========

    public static GatewayProblem badRequest(String detail) {
        return of(new ProblemDetail("Bad Request", 400, detail, null));
    }

    public static GatewayProblem validationError(String detail) {
        return of(new ProblemDetail("Validation Error", 400, detail, null));
    }

    // ========== Authentication Errors ==========

    public static GatewayProblem unauthorized(String detail) {
        return unauthorized(Status.UNAUTHORIZED.getStatusCode(), detail);
    }

    public static GatewayProblem unauthorized(int status, String detail) {
        final var problem = new ProblemDetail("Unauthorized", status, detail, null);
        return new GatewayProblem(
                problem,
                builder(problem)
                        .header(HttpHeaders.WWW_AUTHENTICATE, BEARER_CHALLENGE)
                        .build());
    }

    // ========== Upstream Errors ==========

    public static GatewayProblem badGateway(String detail) {
        return of(new ProblemDetail("Bad Gateway", 502, detail, null));
    }

    public static GatewayProblem providerDeclined(String provider, String providerMessage) {
        return of(new ProblemDetail("Provider Declined", 502, "OTP provider declined: " + providerMessage, provider));
    }

    public static GatewayProblem gatewayTimeout(String detail) {
        return of(new ProblemDetail("Gateway Timeout", 504, detail, null));
    }

    // ========== Server Errors ==========

    public static GatewayProblem internalError(String detail) {
        return of(new ProblemDetail("Internal Server Error", 500, detail, null));
    }

    private static GatewayProblem of(ProblemDetail problem) {
        return new GatewayProblem(problem, builder(problem).build());
    }

    private static Response.ResponseBuilder builder(ProblemDetail problem) {
        return Response.status(problem.status()).type(PROBLEM_JSON).entity(toJson(problem));
    }

    private static String toJson(ProblemDetail problem) {
        try {
            return OBJECT_MAPPER.writeValueAsString(problem);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Problem body could not be serialized", e);
        }
    }
}
