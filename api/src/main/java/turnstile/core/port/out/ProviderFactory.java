package turnstile.core.port.out;

import turnstile.core.model.provider.IdentityProviderType;
import turnstile.core.model.provider.SmsProviderType;
import turnstile.spi.IdentityProvider;
import turnstile.spi.ProviderMisconfiguredException;
import turnstile.spi.SmsProvider;

/**
 * Port for binding provider adapters to their configuration.
 */
public interface ProviderFactory {

    /**
     * Whether configuration enables the given identity provider.
     */
    boolean isEnabled(IdentityProviderType type);

    /**
     * Whether configuration enables the given SMS provider.
     */
    boolean isEnabled(SmsProviderType type);

    /**
     * Build an identity provider bound to its configured client registration.
     *
     * @throws ProviderMisconfiguredException if a required credential is missing
     */
    IdentityProvider createIdentityProvider(IdentityProviderType type);

    /**
     * Build an SMS provider bound to its configured credentials.
     *
     * @throws ProviderMisconfiguredException if a required credential is missing
     */
    SmsProvider createSmsProvider(SmsProviderType type);
}
