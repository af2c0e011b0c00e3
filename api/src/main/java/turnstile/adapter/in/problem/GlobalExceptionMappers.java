package turnstile.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import turnstile.spi.ProviderMisconfiguredException;
import turnstile.spi.ProviderNotFoundException;
import turnstile.spi.ProviderRejectedException;
import turnstile.spi.ProviderResponseMalformedException;
import turnstile.spi.ProviderTransportException;
import turnstile.spi.UnsupportedChannelException;

/**
 * Global exception mappers for converting provider failures to RFC 7807 Problem Details.
 *
 * <p>Upstream failure details are kept in the log; clients receive a short detail
 * naming the provider.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);

    @ServerExceptionMapper
    public Response mapProviderNotFound(ProviderNotFoundException e) {
        LOG.debugv("Provider lookup failed: {0}", e.getMessage());
        return toResponse(GatewayProblem.providerNotFound(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapProviderMisconfigured(ProviderMisconfiguredException e) {
        LOG.errorv("Provider misconfigured: {0}", e.getMessage());
        return toResponse(GatewayProblem.internalError("Provider %s is misconfigured".formatted(e.providerName())));
    }

    @ServerExceptionMapper
    public Response mapUnsupportedChannel(UnsupportedChannelException e) {
        LOG.debugv("Unsupported channel: {0}", e.getMessage());
        return toResponse(GatewayProblem.badRequest(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapProviderTransport(ProviderTransportException e) {
        LOG.warnv("Provider unreachable: {0}", e.getMessage());
        return toResponse(GatewayProblem.gatewayTimeout("OTP provider %s is unavailable".formatted(e.providerName())));
    }

    @ServerExceptionMapper
    public Response mapProviderResponseMalformed(ProviderResponseMalformedException e) {
        LOG.warnv("Provider response unreadable: {0}", e.getMessage());
        return toResponse(
                GatewayProblem.badGateway("OTP provider %s returned an unreadable response".formatted(e.providerName())));
    }

    @ServerExceptionMapper
    public Response mapProviderRejected(ProviderRejectedException e) {
        LOG.warnv("Provider rejected request: {0}", e.getMessage());
        return toResponse(GatewayProblem.providerDeclined(e.providerName(), e.result().providerMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(GatewayProblem.validationError(e.getMessage()));
    }

    private Response toResponse(GatewayProblem problem) {
        return problem.getResponse();
    }
}
