package tech.tessera.identity.credential;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Signs and decodes the membership-keyed tokens of the credential flows.
 */
public interface TokenService {

    /**
     * @param claims        private claims; registered claims are set from the other arguments
     * @param signingSecret membership secret the signing key is derived from
     */
    String generate(Map<String, Object> claims, Instant issuedAt, Instant expiresAt, String signingSecret);

    /**
     * Verify the signature and read the claims, without any time-based check.
     *
     * @return empty when the token is malformed or signed with another key
     */
    Optional<DecodedToken> tryDecode(String token, String signingSecret);
}
