package tech.tessera.identity.credential;

import java.time.Instant;
import java.util.Map;

/**
 * Claims of a token whose signature checked out. Expiry is not evaluated.
 *
 * @param validTo the {@code exp} claim, null when the token has none
 */
public record DecodedToken(Map<String, Object> claims, Instant validTo) {

    public DecodedToken {
        claims = Map.copyOf(claims);
    }

    /**
     * String claim, or null when absent or not a string.
     */
    public String claim(String name) {
        Object value = claims.get(name);
        return value instanceof String text ? text : null;
    }

    public boolean isExpiredAt(Instant now) {
        return validTo != null && validTo.isBefore(now);
    }
}
