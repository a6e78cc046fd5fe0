package tech.tessera.identity.credential;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for JwtTokenService.
 */
class JwtTokenServiceTest {

    private static final String SECRET = "acme-secret";
    private static final Instant ISSUED = Instant.parse("2026-01-15T10:00:00Z");

    private final JwtTokenService service = new JwtTokenService("tessera");

    @Test
    @DisplayName("tryDecode should return the claims and expiry of a token it signed")
    void tryDecode_shouldReturnClaims_whenSignedWithSameSecret() {
        String token = service.generate(Map.of("sub", "usr_1", "token_type", "reset_token"),
            ISSUED, ISSUED.plus(Duration.ofHours(1)), SECRET);

        DecodedToken decoded = service.tryDecode(token, SECRET).orElseThrow();

        assertThat(decoded.claim("sub")).isEqualTo("usr_1");
        assertThat(decoded.claim("token_type")).isEqualTo("reset_token");
        assertThat(decoded.claim("iss")).isEqualTo("tessera");
        assertThat(decoded.validTo()).isEqualTo(ISSUED.plus(Duration.ofHours(1)));
    }

    @Test
    @DisplayName("tryDecode should still decode an expired token so the caller can report expiry")
    void tryDecode_shouldDecodeExpiredToken() {
        Instant longAgo = Instant.parse("2020-01-01T00:00:00Z");
        String token = service.generate(Map.of("sub", "usr_1"), longAgo, longAgo.plusSeconds(60), SECRET);

        DecodedToken decoded = service.tryDecode(token, SECRET).orElseThrow();

        assertThat(decoded.isExpiredAt(ISSUED)).isTrue();
    }

    @Test
    @DisplayName("tryDecode should return empty for a foreign signature or garbage")
    void tryDecode_shouldReturnEmpty_whenTokenInvalid() {
        String token = service.generate(Map.of("sub", "usr_1"), ISSUED, ISSUED.plusSeconds(60), SECRET);

        assertThat(service.tryDecode(token, "another-secret")).isEmpty();
        assertThat(service.tryDecode("not.a.jwt", SECRET)).isEmpty();
        assertThat(service.tryDecode("", SECRET)).isEmpty();
    }
}
