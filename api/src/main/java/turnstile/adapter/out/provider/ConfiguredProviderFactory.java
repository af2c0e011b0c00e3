package turnstile.adapter.out.provider;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;

import turnstile.adapter.out.identity.BitbucketIdentityProvider;
import turnstile.adapter.out.identity.GithubIdentityProvider;
import turnstile.adapter.out.identity.GitlabIdentityProvider;
import turnstile.adapter.out.identity.GoogleIdentityProvider;
import turnstile.adapter.out.sms.Msg91SmsProvider;
import turnstile.adapter.out.sms.TwilioSmsProvider;
import turnstile.core.config.ExternalProviderConfig;
import turnstile.core.config.ExternalProviderConfig.OAuthProviderProperties;
import turnstile.core.config.SmsConfig;
import turnstile.core.model.provider.IdentityProviderType;
import turnstile.core.model.provider.SmsProviderType;
import turnstile.core.port.out.ProviderFactory;
import turnstile.spi.IdentityProvider;
import turnstile.spi.ProviderMisconfiguredException;
import turnstile.spi.SmsProvider;

/**
 * Builds provider adapters from {@link ExternalProviderConfig} and {@link SmsConfig}.
 *
 * <p>All SMS providers share one {@link WebClient}.
 */
@ApplicationScoped
public class ConfiguredProviderFactory implements ProviderFactory {

    private final ExternalProviderConfig external;
    private final SmsConfig sms;
    private final WebClient webClient;

    @Inject
    public ConfiguredProviderFactory(Vertx vertx, ExternalProviderConfig external, SmsConfig sms) {
        this(WebClient.create(vertx), external, sms);
    }

    ConfiguredProviderFactory(WebClient webClient, ExternalProviderConfig external, SmsConfig sms) {
        this.webClient = webClient;
        this.external = external;
        this.sms = sms;
    }

    @Override
    public boolean isEnabled(IdentityProviderType type) {
        return properties(type).enabled();
    }

    @Override
    public boolean isEnabled(SmsProviderType type) {
        return switch (type) {
            case MSG91 -> sms.msg91().enabled();
            case TWILIO -> sms.twilio().enabled();
        };
    }

    @Override
    public IdentityProvider createIdentityProvider(IdentityProviderType type) {
        final var name = type.providerName();
        final var props = properties(type);
        final var clientId = require(name, "client-id", props.clientId());
        final var secret = require(name, "secret", props.secret());
        final var redirectUri = require(name, "redirect-uri", props.redirectUri());

        return switch (type) {
            case GITHUB -> new GithubIdentityProvider(clientId, secret, redirectUri);
            case BITBUCKET -> new BitbucketIdentityProvider(clientId, secret, redirectUri);
            case GITLAB -> new GitlabIdentityProvider(clientId, secret, redirectUri, props.url().orElse(null));
            case GOOGLE -> new GoogleIdentityProvider(clientId, secret, redirectUri);
        };
    }

    @Override
    public SmsProvider createSmsProvider(SmsProviderType type) {
        return switch (type) {
            case MSG91 -> createMsg91();
            case TWILIO -> createTwilio();
        };
    }

    private SmsProvider createMsg91() {
        final var name = SmsProviderType.MSG91.providerName();
        final var msg91 = sms.msg91();
        return new Msg91SmsProvider(
                webClient,
                msg91.apiBase(),
                require(name, "auth-key", msg91.authKey()),
                require(name, "template-id", msg91.templateId()),
                sms.timeout(),
                sms.logResponseBodies());
    }

    private SmsProvider createTwilio() {
        final var name = SmsProviderType.TWILIO.providerName();
        final var twilio = sms.twilio();
        return new TwilioSmsProvider(
                webClient,
                twilio.apiBase(),
                require(name, "account-sid", twilio.accountSid()),
                require(name, "auth-token", twilio.authToken()),
                require(name, "message-service-sid", twilio.messageServiceSid()),
                sms.timeout(),
                sms.logResponseBodies());
    }

    private OAuthProviderProperties properties(IdentityProviderType type) {
        return switch (type) {
            case GITHUB -> external.github();
            case BITBUCKET -> external.bitbucket();
            case GITLAB -> external.gitlab();
            case GOOGLE -> external.google();
        };
    }

    private static String require(String provider, String field, Optional<String> value) {
        return value.filter(v -> !v.isBlank())
                .orElseThrow(() -> new ProviderMisconfiguredException(provider, "missing required setting " + field));
    }
}
