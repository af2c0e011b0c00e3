package turnstile.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Credentials for the external OAuth identity providers.
 *
 * <p>Configuration prefix: {@code turnstile.external}
 *
 * <p>Providers are disabled by default. An enabled provider must have its client id,
 * secret and redirect URI set, otherwise startup fails.
 */
@ConfigMapping(prefix = "turnstile.external")
public interface ExternalProviderConfig {

    OAuthProviderProperties github();

    OAuthProviderProperties bitbucket();

    OAuthProviderProperties gitlab();

    OAuthProviderProperties google();

    /**
     * Client registration for one OAuth provider.
     */
    interface OAuthProviderProperties {

        @WithDefault("false")
        boolean enabled();

        @WithName("client-id")
        Optional<String> clientId();

        Optional<String> secret();

        @WithName("redirect-uri")
        Optional<String> redirectUri();

        /**
         * Base URL override, for self-hosted instances (Gitlab).
         */
        Optional<String> url();
    }
}
