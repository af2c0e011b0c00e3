package turnstile.core.service.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import turnstile.core.config.SmsConfig;
import turnstile.core.model.provider.IdentityProviderType;
import turnstile.core.model.provider.SmsProviderType;
import turnstile.core.port.out.ProviderFactory;
import turnstile.spi.IdentityProvider;
import turnstile.spi.ProviderMisconfiguredException;
import turnstile.spi.ProviderNotFoundException;
import turnstile.spi.SmsProvider;

@DisplayName("ProviderRegistry")
@ExtendWith(MockitoExtension.class)
class ProviderRegistryTest {

    @Mock
    private ProviderFactory factory;

    @Mock
    private SmsConfig smsConfig;

    private IdentityProvider github;
    private SmsProvider msg91;
    private ProviderRegistry registry;

    @BeforeEach
    void setUp() {
        github = mock(IdentityProvider.class);
        msg91 = mock(SmsProvider.class);

        lenient().when(factory.isEnabled(any(IdentityProviderType.class))).thenReturn(false);
        lenient().when(factory.isEnabled(any(SmsProviderType.class))).thenReturn(false);
        lenient().when(factory.isEnabled(IdentityProviderType.GITHUB)).thenReturn(true);
        lenient().when(factory.isEnabled(SmsProviderType.MSG91)).thenReturn(true);
        lenient().when(factory.createIdentityProvider(IdentityProviderType.GITHUB)).thenReturn(github);
        lenient().when(factory.createSmsProvider(SmsProviderType.MSG91)).thenReturn(msg91);
        lenient().when(smsConfig.enabled()).thenReturn(true);
        lenient().when(smsConfig.provider()).thenReturn("msg91");

        registry = new ProviderRegistry(factory, smsConfig);
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @Test
        @DisplayName("should return an enabled provider")
        void shouldReturnEnabledProvider() {
            assertSame(github, registry.identityProvider("github"));
            assertSame(msg91, registry.smsProvider("msg91"));
        }

        @Test
        @DisplayName("should look up names case-insensitively")
        void shouldIgnoreCase() {
            assertSame(github, registry.identityProvider("GitHub"));
        }

        @Test
        @DisplayName("should report unknown names")
        void shouldRejectUnknownName() {
            var e = assertThrows(ProviderNotFoundException.class, () -> registry.identityProvider("acme"));

            assertEquals("acme", e.providerName());
            assertTrue(e.getMessage().contains("acme"));
        }

        @Test
        @DisplayName("should report known but disabled providers as not found")
        void shouldRejectDisabledProvider() {
            var e = assertThrows(ProviderNotFoundException.class, () -> registry.identityProvider("gitlab"));

            assertEquals("gitlab", e.providerName());
        }

        @Test
        @DisplayName("should resolve the default SMS provider from configuration")
        void shouldResolveDefault() {
            assertSame(msg91, registry.defaultSmsProvider());
        }

        @Test
        @DisplayName("should list what was built")
        void shouldListEnabled() {
            assertEquals(1, registry.enabledIdentityProviders().size());
            assertEquals(1, registry.enabledSmsProviders().size());
        }
    }

    @Nested
    @DisplayName("Initialization")
    class Initialization {

        @Test
        @DisplayName("should build providers once")
        void shouldBuildOnce() {
            registry.initialize();
            registry.initialize();
            registry.identityProvider("github");

            verify(factory, times(1)).createIdentityProvider(IdentityProviderType.GITHUB);
        }

        @Test
        @DisplayName("should fail when an enabled provider is misconfigured")
        void shouldFailOnMisconfiguration() {
            when(factory.createIdentityProvider(IdentityProviderType.GITHUB))
                    .thenThrow(new ProviderMisconfiguredException("github", "missing required setting client-id"));

            var e = assertThrows(ProviderMisconfiguredException.class, registry::initialize);

            assertEquals("github", e.providerName());
        }

        @Test
        @DisplayName("should fail when SMS is enabled without its default provider")
        void shouldFailWithoutDefaultSmsProvider() {
            when(smsConfig.provider()).thenReturn("twilio");

            assertThrows(ProviderMisconfiguredException.class, registry::initialize);
        }

        @Test
        @DisplayName("should fail when the default SMS provider is unknown")
        void shouldFailWithUnknownDefault() {
            when(smsConfig.provider()).thenReturn("acme");

            var e = assertThrows(ProviderMisconfiguredException.class, registry::initialize);

            assertEquals("acme", e.providerName());
        }
    }
}
