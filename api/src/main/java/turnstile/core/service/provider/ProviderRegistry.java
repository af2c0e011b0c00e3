package turnstile.core.service.provider;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import turnstile.core.config.SmsConfig;
import turnstile.core.model.provider.IdentityProviderType;
import turnstile.core.model.provider.SmsProviderType;
import turnstile.core.port.out.ProviderFactory;
import turnstile.spi.IdentityProvider;
import turnstile.spi.ProviderMisconfiguredException;
import turnstile.spi.ProviderNotFoundException;
import turnstile.spi.SmsProvider;

/**
 * Registry of the external identity and SMS providers enabled by configuration.
 *
 * <p>The set of supported providers is closed: {@link IdentityProviderType} and
 * {@link SmsProviderType}. Every enabled member is built once at startup through the
 * {@link ProviderFactory} and reused for the life of the process. A provider with
 * missing credentials fails startup with {@link ProviderMisconfiguredException}.
 *
 * <p>Lookups are case-insensitive. Unknown or disabled names fail with
 * {@link ProviderNotFoundException}.
 */
@ApplicationScoped
public class ProviderRegistry {

    private static final Logger LOG = Logger.getLogger(ProviderRegistry.class);

    private final ProviderFactory factory;
    private final SmsConfig smsConfig;

    private volatile Map<IdentityProviderType, IdentityProvider> identityProviders;
    private volatile Map<SmsProviderType, SmsProvider> smsProviders;

    @Inject
    public ProviderRegistry(ProviderFactory factory, SmsConfig smsConfig) {
        this.factory = factory;
        this.smsConfig = smsConfig;
    }

    /**
     * Build all enabled providers at startup so misconfiguration aborts boot
     * instead of failing the first request.
     */
    void onStart(@Observes StartupEvent event) {
        initialize();
    }

    /**
     * Build every enabled provider. Idempotent.
     *
     * @throws ProviderMisconfiguredException if an enabled provider cannot be built, or
     *         SMS delivery is enabled without its default provider
     */
    public synchronized void initialize() {
        if (identityProviders != null) {
            return;
        }

        final var identities = new EnumMap<IdentityProviderType, IdentityProvider>(IdentityProviderType.class);
        for (IdentityProviderType type : IdentityProviderType.values()) {
            if (factory.isEnabled(type)) {
                identities.put(type, factory.createIdentityProvider(type));
            }
        }

        final var sms = new EnumMap<SmsProviderType, SmsProvider>(SmsProviderType.class);
        for (SmsProviderType type : SmsProviderType.values()) {
            if (factory.isEnabled(type)) {
                sms.put(type, factory.createSmsProvider(type));
            }
        }

        if (smsConfig.enabled()) {
            final var defaultName = smsConfig.provider();
            final var defaultType = SmsProviderType.fromName(defaultName)
                    .orElseThrow(() -> new ProviderMisconfiguredException(defaultName, "unsupported SMS provider"));
            if (!sms.containsKey(defaultType)) {
                throw new ProviderMisconfiguredException(
                        defaultName, "SMS is enabled but the default provider is not enabled");
            }
        }

        identityProviders = Collections.unmodifiableMap(identities);
        smsProviders = Collections.unmodifiableMap(sms);

        LOG.infof(
                "Provider registry initialized: identity=%s, sms=%s",
                identities.keySet().stream().map(IdentityProviderType::providerName).toList(),
                sms.keySet().stream().map(SmsProviderType::providerName).toList());
    }

    /**
     * Look up an identity provider by name.
     *
     * @param name provider name, case-insensitive
     * @return the bound provider
     * @throws ProviderNotFoundException if the name is unknown or the provider is not enabled
     */
    public IdentityProvider identityProvider(String name) {
        final var type = IdentityProviderType.fromName(name).orElseThrow(() -> new ProviderNotFoundException(name));
        final var provider = identityProviders().get(type);
        if (provider == null) {
            throw new ProviderNotFoundException(name, "Provider %s is not enabled".formatted(name));
        }
        return provider;
    }

    /**
     * Look up an SMS provider by name.
     *
     * @param name provider name, case-insensitive
     * @return the bound provider
     * @throws ProviderNotFoundException if the name is unknown or the provider is not enabled
     */
    public SmsProvider smsProvider(String name) {
        final var type = SmsProviderType.fromName(name).orElseThrow(() -> new ProviderNotFoundException(name));
        final var provider = smsProviders().get(type);
        if (provider == null) {
            throw new ProviderNotFoundException(name, "Provider %s is not enabled".formatted(name));
        }
        return provider;
    }

    /**
     * The SMS provider named by {@code turnstile.sms.provider}.
     */
    public SmsProvider defaultSmsProvider() {
        return smsProvider(smsConfig.provider());
    }

    public List<IdentityProvider> enabledIdentityProviders() {
        return List.copyOf(identityProviders().values());
    }

    public List<SmsProvider> enabledSmsProviders() {
        return List.copyOf(smsProviders().values());
    }

    private Map<IdentityProviderType, IdentityProvider> identityProviders() {
        if (identityProviders == null) {
            initialize();
        }
        return identityProviders;
    }

    private Map<SmsProviderType, SmsProvider> smsProviders() {
        if (smsProviders == null) {
            initialize();
        }
        return smsProviders;
    }
}
