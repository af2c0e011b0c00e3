package turnstile.adapter.out.sms;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import org.jboss.logging.Logger;

import turnstile.spi.ProviderResponseMalformedException;

/**
 * Shared response handling for the HTTP-based SMS providers.
 */
final class ResponseBodies {

    private ResponseBodies() {}

    /**
     * Parse a response body as a JSON object.
     *
     * @throws ProviderResponseMalformedException if the body is empty or not a JSON object
     */
    static JsonObject parse(String providerName, HttpResponse<Buffer> response) {
        final var body = response.bodyAsString();
        if (body == null || body.isBlank()) {
            throw new ProviderResponseMalformedException(
                    providerName, response.statusCode(), new DecodeException("Empty response body"));
        }
        try {
            return new JsonObject(body);
        } catch (DecodeException | ClassCastException e) {
            throw new ProviderResponseMalformedException(providerName, response.statusCode(), e);
        }
    }

    /**
     * Field value rendered as text, or the fallback when the field is absent or null.
     */
    static String text(JsonObject json, String field, String fallback) {
        final var value = json.getValue(field);
        return value == null ? fallback : value.toString();
    }

    /**
     * Log a raw response body when troubleshooting is switched on.
     */
    static void debugBody(Logger log, boolean enabled, String providerName, HttpResponse<Buffer> response) {
        if (enabled && log.isDebugEnabled()) {
            log.debugf(
                    "%s response: status=%d, body=%s", providerName, response.statusCode(), response.bodyAsString());
        }
    }
}
