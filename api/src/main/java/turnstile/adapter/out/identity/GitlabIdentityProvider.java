package turnstile.adapter.out.identity;

import java.util.List;

/**
 * GitLab OAuth application, on gitlab.com or a self-hosted instance.
 */
public class GitlabIdentityProvider extends OAuth2IdentityProvider {

    static final String NAME = "gitlab";
    static final String DEFAULT_URL = "https://gitlab.com";

    private final String baseUrl;

    public GitlabIdentityProvider(String clientId, String secret, String redirectUri, String baseUrl) {
        super(clientId, secret, redirectUri);
        this.baseUrl = normalize(baseUrl);
    }

    @Override
    public String name() {
        return NAME;
    }

    public String baseUrl() {
        return baseUrl;
    }

    @Override
    protected String authorizationEndpoint() {
        return baseUrl + "/oauth/authorize";
    }

    @Override
    public String tokenEndpoint() {
        return baseUrl + "/oauth/token";
    }

    @Override
    public String userInfoEndpoint() {
        return baseUrl + "/api/v4/user";
    }

    @Override
    public List<String> scopes() {
        return List.of("read_user");
    }

    private static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return DEFAULT_URL;
        }
        var result = url.trim();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
