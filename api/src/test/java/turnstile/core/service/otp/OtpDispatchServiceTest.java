package turnstile.core.service.otp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.security.SecureRandom;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import turnstile.core.config.SmsConfig;
import turnstile.core.model.message.MessageChannel;
import turnstile.core.model.message.OutboundMessageRequest;
import turnstile.core.model.message.OutboundMessageResult;
import turnstile.core.model.message.SendOutcome;
import turnstile.core.port.out.DispatchMetrics;
import turnstile.core.service.provider.ProviderRegistry;
import turnstile.spi.ProviderNotFoundException;
import turnstile.spi.ProviderRejectedException;
import turnstile.spi.ProviderTransportException;
import turnstile.spi.SmsProvider;

@DisplayName("OtpDispatchService")
@ExtendWith(MockitoExtension.class)
class OtpDispatchServiceTest {

    @Mock
    private ProviderRegistry registry;

    @Mock
    private SmsConfig config;

    @Mock
    private DispatchMetrics metrics;

    @Mock
    private SmsProvider provider;

    private OtpDispatchService service;

    @BeforeEach
    void setUp() {
        lenient().when(config.enabled()).thenReturn(true);
        lenient().when(config.otpLength()).thenReturn(6);
        lenient().when(config.template()).thenReturn("Your code is {code}");
        lenient().when(provider.name()).thenReturn("msg91");
        lenient().when(registry.defaultSmsProvider()).thenReturn(provider);
        lenient().when(registry.smsProvider("msg91")).thenReturn(provider);

        service = new OtpDispatchService(registry, config, metrics, new SecureRandom());
    }

    @Nested
    @DisplayName("Successful dispatch")
    class SuccessfulDispatch {

        @Test
        @DisplayName("should send a rendered numeric code through the default provider")
        void shouldSendThroughDefault() {
            var captor = ArgumentCaptor.forClass(OutboundMessageRequest.class);
            when(provider.sendMessage(captor.capture()))
                    .thenReturn(Uni.createFrom().item(OutboundMessageResult.delivered("req-1")));

            var dispatch = service.dispatch("919999999999", MessageChannel.SMS, null)
                    .await()
                    .indefinitely();

            var request = captor.getValue();
            assertEquals("msg91", dispatch.provider());
            assertEquals("req-1", dispatch.result().providerMessage());
            assertTrue(dispatch.code().matches("\\d{6}"));
            assertEquals(dispatch.code(), request.code());
            assertEquals("Your code is " + dispatch.code(), request.body());
            assertEquals("919999999999", request.recipient());
            verify(metrics).recordSend(eq("msg91"), eq(SendOutcome.DELIVERED), anyLong());
        }

        @Test
        @DisplayName("should use the named provider when given")
        void shouldUseNamedProvider() {
            when(provider.sendMessage(any())).thenReturn(Uni.createFrom().item(OutboundMessageResult.delivered("ok")));

            service.dispatch("919999999999", MessageChannel.SMS, "msg91").await().indefinitely();

            verify(registry).smsProvider("msg91");
            verify(registry, never()).defaultSmsProvider();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should propagate rejections and record them")
        void shouldPropagateRejection() {
            when(provider.sendMessage(any()))
                    .thenReturn(Uni.createFrom()
                            .failure(new ProviderRejectedException("msg91", "error", "Invalid template", 200)));

            var e = assertThrows(ProviderRejectedException.class, () -> service.dispatch(
                            "919999999999", MessageChannel.SMS, null)
                    .await()
                    .indefinitely());

            assertEquals("Invalid template", e.result().providerMessage());
            verify(metrics).recordSend(eq("msg91"), eq(SendOutcome.REJECTED), anyLong());
        }

        @Test
        @DisplayName("should record transport errors")
        void shouldRecordTransportError() {
            when(provider.sendMessage(any()))
                    .thenReturn(Uni.createFrom()
                            .failure(new ProviderTransportException("msg91", new RuntimeException("timeout"))));

            assertThrows(ProviderTransportException.class, () -> service.dispatch(
                            "919999999999", MessageChannel.SMS, null)
                    .await()
                    .indefinitely());

            verify(metrics).recordSend(eq("msg91"), eq(SendOutcome.TRANSPORT_ERROR), anyLong());
        }

        @Test
        @DisplayName("should fail lookups of unknown providers without sending")
        void shouldFailUnknownProvider() {
            when(registry.smsProvider("acme")).thenThrow(new ProviderNotFoundException("acme"));

            var e = assertThrows(ProviderNotFoundException.class, () -> service.dispatch(
                            "919999999999", MessageChannel.SMS, "acme")
                    .await()
                    .indefinitely());

            assertEquals("acme", e.providerName());
            verify(provider, never()).sendMessage(any());
        }

        @Test
        @DisplayName("should refuse when delivery is disabled")
        void shouldRefuseWhenDisabled() {
            when(config.enabled()).thenReturn(false);

            assertThrows(IllegalStateException.class, () -> service.dispatch(
                            "919999999999", MessageChannel.SMS, null)
                    .await()
                    .indefinitely());
        }
    }

    @Nested
    @DisplayName("Code generation")
    class CodeGeneration {

        @Test
        @DisplayName("should honour the configured length")
        void shouldHonourLength() {
            assertEquals(8, service.generateCode(8).length());
            assertTrue(service.generateCode(4).chars().allMatch(Character::isDigit));
        }

        @Test
        @DisplayName("should reject a non-positive length")
        void shouldRejectZeroLength() {
            assertThrows(IllegalStateException.class, () -> service.generateCode(0));
        }

        @Test
        @DisplayName("should draw digits from the injected source")
        void shouldUseInjectedRandom() {
            var seeded = new OtpDispatchService(registry, config, metrics, new FixedRandom());

            assertEquals("0000", seeded.generateCode(4));
        }
    }

    private static final class FixedRandom extends SecureRandom {
        @Override
        public int nextInt(int bound) {
            return 0;
        }
    }
}
