package tech.tessera.identity.credential;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * An issued password reset token.
 *
 * @param expiresIn lifetime in seconds from {@code createdAt}
 */
public record ResetPasswordToken(
    @JsonProperty("token") String token,
    @JsonProperty("expires_in") long expiresIn,
    @JsonProperty("created_at") Instant createdAt
) {

    public Instant expiresAt() {
        return createdAt.plusSeconds(expiresIn);
    }
}
