package tech.tessera.identity.membership;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import tech.tessera.identity.common.SysModel;

/**
 * A tenant: the isolation boundary for users, roles and user types.
 *
 * @param expiresIn             access token lifetime in seconds
 * @param refreshTokenExpiresIn refresh token lifetime in seconds
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Membership(
    @JsonProperty("_id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("secret_key") String secretKey,
    @JsonProperty("hash_algorithm") HashAlgorithm hashAlgorithm,
    @JsonProperty("default_language") String defaultLanguage,
    @JsonProperty("expires_in") Long expiresIn,
    @JsonProperty("refresh_token_expires_in") Long refreshTokenExpiresIn,
    @JsonProperty("sys") SysModel sys
) {

    public static final String COLLECTION = "memberships";

    /**
     * Copy safe to publish in events and responses: the secret key is dropped.
     */
    public Membership withoutSecret() {
        return new Membership(id, name, null, hashAlgorithm, defaultLanguage, expiresIn, refreshTokenExpiresIn, sys);
    }

    @Override
    public String toString() {
        return "Membership[id=" + id + ", name=" + name + ", hashAlgorithm=" + hashAlgorithm + "]";
    }
}
