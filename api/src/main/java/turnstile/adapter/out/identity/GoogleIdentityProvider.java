package turnstile.adapter.out.identity;

import java.util.List;

/**
 * Google OAuth 2.0 web client.
 */
public class GoogleIdentityProvider extends OAuth2IdentityProvider {

    static final String NAME = "google";

    public GoogleIdentityProvider(String clientId, String secret, String redirectUri) {
        super(clientId, secret, redirectUri);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String authorizationEndpoint() {
        return "https://accounts.google.com/o/oauth2/auth";
    }

    @Override
    public String tokenEndpoint() {
        return "https://oauth2.googleapis.com/token";
    }

    @Override
    public String userInfoEndpoint() {
        return "https://www.googleapis.com/userinfo/v2/me";
    }

    @Override
    public List<String> scopes() {
        return List.of("email", "profile");
    }
}
