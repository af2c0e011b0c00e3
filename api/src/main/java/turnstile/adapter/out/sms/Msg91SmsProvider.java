package turnstile.adapter.out.sms;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import turnstile.core.model.message.MessageChannel;
import turnstile.core.model.message.OutboundMessageRequest;
import turnstile.core.model.message.OutboundMessageResult;
import turnstile.spi.ProviderRejectedException;
import turnstile.spi.ProviderTransportException;
import turnstile.spi.SmsProvider;
import turnstile.spi.UnsupportedChannelException;

/**
 * Sends one-time passcodes through the Msg91 flow API.
 *
 * <p>The message text is defined by a template registered with Msg91, so only the
 * recipient and the passcode are sent.
 *
 * <h2>Request Format</h2>
 * <pre>{@code
 * POST https://control.msg91.com/api/v5/flow
 * authkey: <auth-key>
 * Content-Type: application/json
 *
 * {
 *   "template_id": "<template-id>",
 *   "recipients": [ { "mobiles": "919999999999", "otp": "123456" } ]
 * }
 * }</pre>
 *
 * <h2>Response Format</h2>
 * <pre>{@code
 * { "message": "3763646c3058373530393134", "type": "success" }
 * }</pre>
 *
 * <p>Any {@code type} other than {@code success} is a rejection, whatever the HTTP status.
 */
public class Msg91SmsProvider implements SmsProvider {

    private static final Logger LOG = Logger.getLogger(Msg91SmsProvider.class);

    static final String NAME = "msg91";
    static final String SUCCESS = "success";

    private final WebClient webClient;
    private final String url;
    private final String authKey;
    private final String templateId;
    private final long timeoutMillis;
    private final boolean logResponseBodies;

    public Msg91SmsProvider(
            WebClient webClient,
            String url,
            String authKey,
            String templateId,
            Duration timeout,
            boolean logResponseBodies) {
        this.webClient = webClient;
        this.url = url;
        this.authKey = authKey;
        this.templateId = templateId;
        this.timeoutMillis = timeout.toMillis();
        this.logResponseBodies = logResponseBodies;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<MessageChannel> supportedChannels() {
        return Set.of(MessageChannel.SMS);
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

        final var payload = new JsonObject()
                .put("template_id", templateId)
                .put("recipients", new JsonArray()
                        .add(new JsonObject().put("mobiles", request.recipient()).put("otp", request.code())));

        LOG.debugf("Sending Msg91 flow request: url=%s, template=%s", url, templateId);

        return webClient
                .postAbs(url)
                .timeout(timeoutMillis)
                .putHeader("accept", "application/json")
                .putHeader("content-type", "application/json")
                .putHeader("authkey", authKey)
                .sendJsonObject(payload)
                .onFailure()
                .transform(error -> new ProviderTransportException(NAME, error))
                .map(this::interpret);
    }

    private OutboundMessageResult interpret(HttpResponse<Buffer> response) {
        ResponseBodies.debugBody(LOG, logResponseBodies, NAME, response);

        final var json = ResponseBodies.parse(NAME, response);
        final var type = ResponseBodies.text(json, "type", "");
        final var text = ResponseBodies.text(json, "message", "");

        if (!SUCCESS.equals(type)) {
            LOG.warnf("Msg91 rejected message: status=%d, type=%s, message=%s", response.statusCode(), type, text);
            throw new ProviderRejectedException(NAME, type, text, response.statusCode());
        }
        return OutboundMessageResult.delivered(text);
    }
}
