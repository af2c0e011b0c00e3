package turnstile.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import turnstile.adapter.in.dto.OtpRequestDto;
import turnstile.adapter.in.dto.OtpResponseDto;
import turnstile.adapter.in.problem.GatewayProblem;
import turnstile.core.config.SmsConfig;
import turnstile.core.model.message.MessageChannel;
import turnstile.core.port.in.OtpDispatchUseCase;

/**
 * Sends one-time passcodes.
 *
 * <p>Provider failures are rendered by the global exception mappers.
 */
@Path("/otp")
@ApplicationScoped
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class OtpResource {

    private final OtpDispatchUseCase otpDispatch;
    private final SmsConfig config;

    @Inject
    public OtpResource(OtpDispatchUseCase otpDispatch, SmsConfig config) {
        this.otpDispatch = otpDispatch;
        this.config = config;
    }

    @POST
    public Uni<OtpResponseDto> send(OtpRequestDto request) {
        if (!config.enabled()) {
            throw GatewayProblem.featureDisabled("SMS delivery");
        }
        if (request == null || request.phone() == null || request.phone().isBlank()) {
            throw GatewayProblem.validationError("phone is required");
        }

        final var channel = request.channel() == null || request.channel().isBlank()
                ? MessageChannel.SMS
                : MessageChannel.fromWireName(request.channel())
                        .orElseThrow(() -> GatewayProblem.validationError(
                                "Unknown channel: %s".formatted(request.channel())));

        return otpDispatch
                .dispatch(request.phone(), channel, request.provider())
                .map(dispatch -> new OtpResponseDto(dispatch.provider(), dispatch.result().providerMessage()));
    }
}
