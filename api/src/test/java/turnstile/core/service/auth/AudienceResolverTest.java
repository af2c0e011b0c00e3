package turnstile.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import turnstile.core.model.auth.Claims;

@DisplayName("AudienceResolver")
class AudienceResolverTest {

    private final AudienceResolver resolver = new AudienceResolver("X-JWT-AUD", "default-aud");

    @Test
    @DisplayName("header wins over the aud claim")
    void headerWins() {
        var claims = Claims.of(Map.of("aud", "tenant-y"));

        assertEquals("tenant-x", resolver.resolve(Optional.of("tenant-x"), Optional.of(claims)));
    }

    @Test
    @DisplayName("aud claim is used when no header is present")
    void claimUsedWithoutHeader() {
        var claims = Claims.of(Map.of("aud", "tenant-y"));

        assertEquals("tenant-y", resolver.resolve(Optional.empty(), Optional.of(claims)));
    }

    @Test
    @DisplayName("blank header falls through to the claim")
    void blankHeaderIgnored() {
        var claims = Claims.of(Map.of("aud", "tenant-y"));

        assertEquals("tenant-y", resolver.resolve(Optional.of("  "), Optional.of(claims)));
    }

    @Test
    @DisplayName("default is used with neither header nor claims")
    void defaultUsed() {
        assertEquals("default-aud", resolver.resolve(Optional.empty(), Optional.empty()));
    }

    @Test
    @DisplayName("non-string aud claim falls through to the default")
    void listAudienceIgnored() {
        var claims = Claims.of(Map.of("aud", List.of("a", "b")));

        assertEquals("default-aud", resolver.resolve(Optional.empty(), Optional.of(claims)));
    }

    @Test
    @DisplayName("refuses a blank default audience")
    void refusesBlankDefault() {
        assertThrows(IllegalStateException.class, () -> new AudienceResolver("X-JWT-AUD", " "));
    }
}
