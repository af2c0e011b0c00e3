package turnstile.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("BearerTokenExtractor")
class BearerTokenExtractorTest {

    @Test
    @DisplayName("should extract token after capitalized scheme")
    void shouldExtractCapitalized() {
        assertEquals("abc.def.ghi", BearerTokenExtractor.extract("Bearer abc.def.ghi").orElseThrow());
    }

    @Test
    @DisplayName("should extract token after lowercase scheme")
    void shouldExtractLowercase() {
        assertEquals("abc.def.ghi", BearerTokenExtractor.extract("bearer abc.def.ghi").orElseThrow());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(
            strings = {
                "Basic dXNlcjpwYXNz",
                "Bearer",
                "Bearer ",
                "Bearer  abc",
                "Bearer abc def",
                "BEARER abc",
                "Token abc",
                "abc"
            })
    @DisplayName("should reject anything but a single token after the scheme")
    void shouldRejectNonMatching(String header) {
        assertTrue(BearerTokenExtractor.extract(header).isEmpty());
    }
}
