package turnstile.adapter.out.identity;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import turnstile.spi.IdentityProvider;

/**
 * Authorization-code OAuth2 client bound to one provider registration.
 *
 * <p>Subclasses supply the provider's endpoints and default scopes.
 */
public abstract class OAuth2IdentityProvider implements IdentityProvider {

    private final String clientId;
    private final String secret;
    private final String redirectUri;

    protected OAuth2IdentityProvider(String clientId, String secret, String redirectUri) {
        this.clientId = clientId;
        this.secret = secret;
        this.redirectUri = redirectUri;
    }

    /**
     * @return endpoint the user agent is sent to for consent
     */
    protected abstract String authorizationEndpoint();

    @Override
    public String authCodeUrl(String state) {
        final var params = new LinkedHashMap<String, String>();
        params.put("client_id", clientId);
        params.put("redirect_uri", redirectUri);
        params.put("response_type", "code");
        params.put("scope", String.join(" ", scopes()));
        if (state != null && !state.isEmpty()) {
            params.put("state", state);
        }
        return authorizationEndpoint() + "?" + encode(params);
    }

    @Override
    public Map<String, String> tokenRequestParameters(String authorizationCode) {
        final var params = new LinkedHashMap<String, String>();
        params.put("grant_type", "authorization_code");
        params.put("code", authorizationCode);
        params.put("redirect_uri", redirectUri);
        params.put("client_id", clientId);
        params.put("client_secret", secret);
        return params;
    }

    @Override
    public String clientId() {
        return clientId;
    }

    @Override
    public String redirectUri() {
        return redirectUri;
    }

    private static String encode(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[clientId=" + clientId + ", redirectUri=" + redirectUri + "]";
    }
}
