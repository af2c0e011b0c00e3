package turnstile.adapter.out.identity;

import java.util.List;

/**
 * GitHub OAuth app.
 */
public class GithubIdentityProvider extends OAuth2IdentityProvider {

    static final String NAME = "github";

    public GithubIdentityProvider(String clientId, String secret, String redirectUri) {
        super(clientId, secret, redirectUri);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String authorizationEndpoint() {
        return "https://github.com/login/oauth/authorize";
    }

    @Override
    public String tokenEndpoint() {
        return "https://github.com/login/oauth/access_token";
    }

    @Override
    public String userInfoEndpoint() {
        return "https://api.github.com/user";
    }

    @Override
    public List<String> scopes() {
        return List.of("user:email");
    }
}
