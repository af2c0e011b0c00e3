package turnstile.adapter.out.sms;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import turnstile.core.model.message.MessageChannel;
import turnstile.core.model.message.OutboundMessageRequest;
import turnstile.spi.ProviderRejectedException;
import turnstile.spi.ProviderResponseMalformedException;

@DisplayName("TwilioSmsProvider")
class TwilioSmsProviderTest {

    private static final String MESSAGES_PATH = "/2010-04-01/Accounts/AC123/Messages.json";

    private WireMockServer wireMockServer;
    private Vertx vertx;
    private TwilioSmsProvider provider;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
        provider = new TwilioSmsProvider(
                WebClient.create(vertx),
                wireMockServer.baseUrl() + "/2010-04-01/",
                "AC123",
                "token",
                "+15550000000",
                Duration.ofSeconds(5),
                false);
    }

    @AfterEach
    void tearDown() {
        wireMockServer.stop();
        vertx.close().await().indefinitely();
    }

    private void respondWith(int status, String body) {
        wireMockServer.stubFor(post(urlEqualTo(MESSAGES_PATH))
                .willReturn(aResponse()
                        .withStatus(status)
                        .withHeader("Content-Type", "application/json")
                        .withBody(body)));
    }

    private static OutboundMessageRequest request(MessageChannel channel) {
        return new OutboundMessageRequest("+15551234567", "Your code is 123456", channel, "123456");
    }

    @Test
    @DisplayName("should return the message sid on success")
    void shouldDeliver() {
        respondWith(201, "{\"sid\":\"SM123\",\"status\":\"queued\"}");

        var result = provider.sendMessage(request(MessageChannel.SMS)).await().indefinitely();

        assertTrue(result.delivered());
        assertEquals("SM123", result.providerMessage());
        wireMockServer.verify(postRequestedFor(urlEqualTo(MESSAGES_PATH))
                .withHeader("Authorization", equalTo("Basic QUMxMjM6dG9rZW4="))
                .withFormParam("To", equalTo("+15551234567"))
                .withFormParam("From", equalTo("+15550000000"))
                .withFormParam("Body", equalTo("Your code is 123456")));
    }

    @Test
    @DisplayName("should prefix both numbers for WhatsApp")
    void shouldPrefixWhatsapp() {
        respondWith(201, "{\"sid\":\"SM456\",\"status\":\"queued\"}");

        provider.sendMessage(request(MessageChannel.WHATSAPP)).await().indefinitely();

        wireMockServer.verify(postRequestedFor(urlEqualTo(MESSAGES_PATH))
                .withFormParam("To", equalTo("whatsapp:+15551234567"))
                .withFormParam("From", equalTo("whatsapp:+15550000000")));
    }

    @Test
    @DisplayName("should reject error responses with the provider message")
    void shouldRejectErrorResponse() {
        respondWith(400, "{\"code\":21211,\"message\":\"Invalid 'To' Phone Number\",\"status\":400}");

        var e = assertThrows(ProviderRejectedException.class, () -> provider.sendMessage(
                        request(MessageChannel.SMS))
                .await()
                .indefinitely());

        assertEquals("Invalid 'To' Phone Number", e.result().providerMessage());
        assertEquals(400, e.statusCode());
        assertTrue(e.getMessage().contains("21211"));
    }

    @Test
    @DisplayName("should reject messages reported as failed")
    void shouldRejectFailedStatus() {
        respondWith(201, "{\"sid\":\"SM789\",\"status\":\"failed\",\"error_message\":\"Carrier rejected\"}");

        var e = assertThrows(ProviderRejectedException.class, () -> provider.sendMessage(
                        request(MessageChannel.SMS))
                .await()
                .indefinitely());

        assertEquals("Carrier rejected", e.result().providerMessage());
    }

    @Test
    @DisplayName("should treat a success body without sid as malformed")
    void shouldRequireSid() {
        respondWith(201, "{\"status\":\"queued\"}");

        var e = assertThrows(ProviderResponseMalformedException.class, () -> provider.sendMessage(
                        request(MessageChannel.SMS))
                .await()
                .indefinitely());

        assertEquals(201, e.statusCode());
    }
}
