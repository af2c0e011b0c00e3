package turnstile.adapter.out.sms;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.DecodeException;
import io.vertx.mutiny.core.MultiMap;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import turnstile.core.model.message.MessageChannel;
import turnstile.core.model.message.OutboundMessageRequest;
import turnstile.core.model.message.OutboundMessageResult;
import turnstile.spi.ProviderRejectedException;
import turnstile.spi.ProviderResponseMalformedException;
import turnstile.spi.ProviderTransportException;
import turnstile.spi.SmsProvider;
import turnstile.spi.UnsupportedChannelException;

/**
 * Sends one-time passcodes through the Twilio Messages API, over SMS or WhatsApp.
 *
 * <h2>Request Format</h2>
 * <pre>{@code
 * POST {api-base}/Accounts/{account-sid}/Messages.json
 * Authorization: Basic base64(account-sid:auth-token)
 * Content-Type: application/x-www-form-urlencoded
 *
 * To=+15551234567&From=<message-service-sid>&Body=Your code is 123456
 * }</pre>
 *
 * <p>For WhatsApp both numbers carry a {@code whatsapp:} prefix. A 2xx response
 * carries the message {@code sid} and a {@code status}; an error response carries
 * {@code code} and {@code message}.
 */
public class TwilioSmsProvider implements SmsProvider {

    private static final Logger LOG = Logger.getLogger(TwilioSmsProvider.class);

    static final String NAME = "twilio";
    private static final String WHATSAPP_PREFIX = "whatsapp:";
    private static final Set<String> FAILED_STATUSES = Set.of("failed", "undelivered");

    private final WebClient webClient;
    private final String url;
    private final String authorization;
    private final String from;
    private final long timeoutMillis;
    private final boolean logResponseBodies;

    public TwilioSmsProvider(
            WebClient webClient,
            String apiBase,
            String accountSid,
            String authToken,
            String messageServiceSid,
            Duration timeout,
            boolean logResponseBodies) {
        this.webClient = webClient;
        this.url = stripTrailingSlash(apiBase) + "/Accounts/" + accountSid + "/Messages.json";
        this.authorization = "Basic "
                + Base64.getEncoder()
                        .encodeToString((accountSid + ":" + authToken).getBytes(StandardCharsets.UTF_8));
        this.from = messageServiceSid;
        this.timeoutMillis = timeout.toMillis();
        this.logResponseBodies = logResponseBodies;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<MessageChannel> supportedChannels() {
        return Set.of(MessageChannel.SMS, MessageChannel.WHATSAPP);
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("sms-provider-" + NAME)
                .up()
                .withData("provider", NAME)
                .withData("url", url)
                .withData("timeout", Duration.ofMillis(timeoutMillis).toString())
                .build());
    }

    @Override
    public Uni<OutboundMessageResult> sendMessage(OutboundMessageRequest request) {
        if (!supports(request.channel())) {
            return Uni.createFrom().failure(new UnsupportedChannelException(NAME, request.channel()));
        }

        final var prefix = request.channel() == MessageChannel.WHATSAPP ? WHATSAPP_PREFIX : "";
        final var form = MultiMap.caseInsensitiveMultiMap()
                .add("To", prefix + request.recipient())
                .add("From", prefix + from)
                .add("Body", request.body());

        LOG.debugf("Sending Twilio message: url=%s, channel=%s", url, request.channel().wireName());

        return webClient
                .postAbs(url)
                .timeout(timeoutMillis)
                .putHeader("Authorization", authorization)
                .putHeader("Accept", "application/json")
                .sendForm(form)
                .onFailure()
                .transform(error -> new ProviderTransportException(NAME, error))
                .map(this::interpret);
    }

    private OutboundMessageResult interpret(HttpResponse<Buffer> response) {
        ResponseBodies.debugBody(LOG, logResponseBodies, NAME, response);

        final var json = ResponseBodies.parse(NAME, response);
        final var statusCode = response.statusCode();

        if (statusCode < 200 || statusCode >= 300) {
            final var code = json.getValue("code");
            final var message = ResponseBodies.text(json, "message", "");
            LOG.warnf("Twilio rejected message: status=%d, code=%s, message=%s", statusCode, code, message);
            throw new ProviderRejectedException(NAME, String.valueOf(code), message, statusCode);
        }

        final var status = ResponseBodies.text(json, "status", "");
        if (FAILED_STATUSES.contains(status)) {
            final var message = ResponseBodies.text(json, "error_message", status);
            LOG.warnf("Twilio reported message %s: %s", status, message);
            throw new ProviderRejectedException(NAME, status, message, statusCode);
        }

        final var sid = ResponseBodies.text(json, "sid", "");
        if (sid.isBlank()) {
            throw new ProviderResponseMalformedException(
                    NAME, statusCode, new DecodeException("Response has no message sid"));
        }
        return OutboundMessageResult.delivered(sid);
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
