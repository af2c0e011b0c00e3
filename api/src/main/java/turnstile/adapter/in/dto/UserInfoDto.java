package turnstile.adapter.in.dto;

import java.util.Map;

import turnstile.core.model.RequestContext;

/**
 * The authenticated caller as seen by a protected endpoint.
 *
 * @param subject  the {@code sub} claim, or null if absent
 * @param audience audience resolved for this request
 * @param claims   all verified claims
 */
public record UserInfoDto(String subject, String audience, Map<String, Object> claims) {

    public static UserInfoDto fromContext(RequestContext context) {
        final var claims = context.claims();
        return new UserInfoDto(
                claims.flatMap(c -> c.subject()).orElse(null),
                context.audience(),
                claims.map(c -> c.values()).orElse(Map.of()));
    }
}
