package turnstile.core.service.otp;

import java.security.SecureRandom;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.config.SmsConfig;
import turnstile.core.model.message.MessageChannel;
import turnstile.core.model.message.OtpDispatch;
import turnstile.core.model.message.OutboundMessageRequest;
import turnstile.core.model.message.SendOutcome;
import turnstile.core.port.in.OtpDispatchUseCase;
import turnstile.core.port.out.DispatchMetrics;
import turnstile.core.service.provider.ProviderRegistry;
import turnstile.spi.ProviderRejectedException;
import turnstile.spi.ProviderResponseMalformedException;
import turnstile.spi.ProviderTransportException;
import turnstile.spi.SmsProvider;
import turnstile.spi.UnsupportedChannelException;

/**
 * Generates one-time passcodes and hands them to an SMS provider.
 *
 * <p>Exactly one send attempt is made per dispatch. Provider failures propagate
 * unchanged to the caller.
 */
@ApplicationScoped
public class OtpDispatchService implements OtpDispatchUseCase {

    private static final Logger LOG = Logger.getLogger(OtpDispatchService.class);
    private static final String CODE_PLACEHOLDER = "{code}";

    private final ProviderRegistry registry;
    private final SmsConfig config;
    private final DispatchMetrics metrics;
    private final SecureRandom random;

    @Inject
    public OtpDispatchService(ProviderRegistry registry, SmsConfig config, DispatchMetrics metrics) {
        this(registry, config, metrics, new SecureRandom());
    }

    OtpDispatchService(ProviderRegistry registry, SmsConfig config, DispatchMetrics metrics, SecureRandom random) {
        this.registry = registry;
        this.config = config;
        this.metrics = metrics;
        this.random = random;
    }

    @Override
    public Uni<OtpDispatch> dispatch(String phone, MessageChannel channel, String providerName) {
        if (!config.enabled()) {
            return Uni.createFrom().failure(new IllegalStateException("SMS delivery is disabled"));
        }
        if (phone == null || phone.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("phone is required"));
        }
        if (channel == null) {
            return Uni.createFrom().failure(new IllegalArgumentException("channel is required"));
        }

        final SmsProvider provider;
        try {
            provider = providerName == null || providerName.isBlank()
                    ? registry.defaultSmsProvider()
                    : registry.smsProvider(providerName);
        } catch (RuntimeException e) {
            return Uni.createFrom().failure(e);
        }

        final var code = generateCode(config.otpLength());
        final var request = new OutboundMessageRequest(phone, render(code), channel, code);
        final var startTime = System.currentTimeMillis();

        LOG.debugf("Dispatching OTP via %s on channel %s", provider.name(), channel.wireName());

        return provider.sendMessage(request)
                .invoke(result -> metrics.recordSend(
                        provider.name(), SendOutcome.DELIVERED, System.currentTimeMillis() - startTime))
                .onFailure()
                .invoke(error -> {
                    metrics.recordSend(provider.name(), outcomeOf(error), System.currentTimeMillis() - startTime);
                    LOG.warnf("OTP dispatch via %s failed: %s", provider.name(), error.getMessage());
                })
                .map(result -> new OtpDispatch(provider.name(), code, result));
    }

    /**
     * Generate a numeric passcode.
     *
     * @param length number of digits, at least 1
     * @return zero-padded digits
     */
    String generateCode(int length) {
        if (length < 1) {
            throw new IllegalStateException("turnstile.sms.otp-length must be at least 1");
        }
        final var code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            code.append(random.nextInt(10));
        }
        return code.toString();
    }

    private String render(String code) {
        return config.template().replace(CODE_PLACEHOLDER, code);
    }

    private static SendOutcome outcomeOf(Throwable error) {
        if (error instanceof ProviderRejectedException) {
            return SendOutcome.REJECTED;
        }
        if (error instanceof UnsupportedChannelException) {
            return SendOutcome.UNSUPPORTED_CHANNEL;
        }
        if (error instanceof ProviderTransportException) {
            return SendOutcome.TRANSPORT_ERROR;
        }
        if (error instanceof ProviderResponseMalformedException) {
            return SendOutcome.MALFORMED_RESPONSE;
        }
        return SendOutcome.ERROR;
    }
}
