package turnstile.spi;

import java.util.List;
import java.util.Map;

/**
 * SPI for an OAuth identity provider used for social sign-in.
 *
 * <p>An instance is bound to one client registration (client id, secret and redirect
 * URI) at startup. It knows the provider's endpoints and how to build the
 * authorization redirect.
 *
 * <p>This service only starts sign-in. Exchanging the authorization code and fetching
 * the user profile are done by the component that receives the provider's redirect.
 * {@link #tokenEndpoint()}, {@link #tokenRequestParameters(String)} and
 * {@link #userInfoEndpoint()} describe those two calls for that component.
 */
public interface IdentityProvider {

    /**
     * @return provider name (e.g., "github")
     */
    String name();

    /**
     * Build the URL the user agent is redirected to in order to start sign-in.
     *
     * @param state opaque CSRF state echoed back by the provider
     * @return absolute authorization URL
     */
    String authCodeUrl(String state);

    /**
     * Form parameters for exchanging an authorization code at {@link #tokenEndpoint()}
     * using client_secret_post authentication.
     *
     * @param authorizationCode code returned on the redirect
     * @return form parameters, in insertion order
     */
    Map<String, String> tokenRequestParameters(String authorizationCode);

    /**
     * @return endpoint the authorization code is exchanged at
     */
    String tokenEndpoint();

    /**
     * @return endpoint that returns the signed-in user's profile for an access token
     */
    String userInfoEndpoint();

    String clientId();

    String redirectUri();

    List<String> scopes();
}
