package turnstile.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for inbound bearer authentication and audience resolution.
 *
 * <p>Configuration prefix: {@code turnstile.auth}
 *
 * <p>Example configuration:
 * <pre>{@code
 * turnstile.auth.protected-paths=user,logout,admin/user,admin/users
 * turnstile.auth.jwt.secret=${TURNSTILE_JWT_SECRET}
 * turnstile.auth.jwt.aud=default-aud
 * }</pre>
 */
@ConfigMapping(prefix = "turnstile.auth")
public interface AuthConfig {

    /**
     * Enable bearer authentication on protected paths.
     *
     * <p>When disabled, protected paths are served without a token. Audience
     * resolution still runs for every request.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Path prefixes (relative, without leading slash) that require a bearer token.
     */
    @WithName("protected-paths")
    @WithDefault("user,logout,admin/user,admin/users")
    List<String> protectedPaths();

    /**
     * Request header that overrides the audience for a single request.
     */
    @WithName("audience-header")
    @WithDefault("X-JWT-AUD")
    String audienceHeader();

    /**
     * Token verification settings.
     */
    JwtProperties jwt();

    /**
     * Settings for verifying inbound JWTs.
     */
    interface JwtProperties {

        /**
         * Shared HMAC secret. Must be at least as long as the hash output of
         * {@link #algorithm()}.
         */
        Optional<String> secret();

        /**
         * The only signing algorithm accepted on inbound tokens.
         *
         * <p>Supported values: HS256, HS384, HS512.
         */
        @WithDefault("HS256")
        String algorithm();

        /**
         * Audience used when neither the audience header nor the token names one.
         */
        String aud();

        /**
         * Allowed clock skew when checking exp and nbf.
         */
        @WithName("clock-skew")
        @WithDefault("PT30S")
        Duration clockSkew();
    }
}
