package turnstile.adapter.out.identity;

import java.util.List;

/**
 * Bitbucket Cloud OAuth consumer.
 */
public class BitbucketIdentityProvider extends OAuth2IdentityProvider {

    static final String NAME = "bitbucket";

    public BitbucketIdentityProvider(String clientId, String secret, String redirectUri) {
        super(clientId, secret, redirectUri);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String authorizationEndpoint() {
        return "https://bitbucket.org/site/oauth2/authorize";
    }

    @Override
    public String tokenEndpoint() {
        return "https://bitbucket.org/site/oauth2/access_token";
    }

    @Override
    public String userInfoEndpoint() {
        return "https://api.bitbucket.org/2.0/user";
    }

    @Override
    public List<String> scopes() {
        return List.of("account", "email");
    }
}
