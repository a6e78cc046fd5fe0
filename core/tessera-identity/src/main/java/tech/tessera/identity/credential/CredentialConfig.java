package tech.tessera.identity.credential;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Password policy and reset token settings.
 */
@ConfigMapping(prefix = "tessera.credentials")
public interface CredentialConfig {

    @WithDefault("6")
    int minPasswordLength();

    /**
     * Lifetime of a password reset token.
     */
    @WithDefault("1h")
    Duration resetTokenTtl();

    /**
     * {@code iss} claim of issued tokens.
     */
    @WithDefault("tessera")
    String issuer();

    /**
     * Path of the front end page that redeems a reset link.
     */
    @WithDefault("/set-password")
    String resetLinkPath();
}
