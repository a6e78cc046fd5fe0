package tech.tessera.identity.credential;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.tessera.identity.common.errors.IdentityException;
import tech.tessera.identity.membership.HashAlgorithm;
import tech.tessera.identity.membership.Membership;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Password policy and hashing with the membership's configured algorithm.
 *
 * Argon2id parameters:
 * - Memory: 65536 KiB (64 MiB)
 * - Iterations: 3
 * - Parallelism: 4
 * - Hash length: 32 bytes
 *
 * SHA-2 hashes are hex digests of membership id + password.
 */
@ApplicationScoped
public class PasswordService {

    private static final Logger LOG = Logger.getLogger(PasswordService.class);

    private static final int MEMORY_COST = 65536;  // 64 MiB in KiB
    private static final int ITERATIONS = 3;
    private static final int PARALLELISM = 4;
    private static final int HASH_LENGTH = 32;
    private static final int SALT_LENGTH = 16;

    private static final HashAlgorithm DEFAULT_ALGORITHM = HashAlgorithm.SHA2_256;

    private final Argon2 argon2;
    private final int minPasswordLength;

    @Inject
    public PasswordService(CredentialConfig config) {
        this(config.minPasswordLength());
    }

    public PasswordService(int minPasswordLength) {
        this.minPasswordLength = minPasswordLength;
        this.argon2 = Argon2Factory.create(
            Argon2Factory.Argon2Types.ARGON2id,
            SALT_LENGTH,
            HASH_LENGTH
        );
    }

    /**
     * Enforce the password policy.
     *
     * @return the password, unchanged
     * @throws IdentityException PASSWORD_REQUIRED for a missing or blank password,
     *                           PASSWORD_TOO_SHORT below the minimum length
     */
    public String ensurePassword(String password) {
        if (password == null || password.isBlank()) {
            throw IdentityException.passwordRequired();
        }
        if (password.length() < minPasswordLength) {
            throw IdentityException.passwordTooShort(minPasswordLength);
        }
        return password;
    }

    public String hash(Membership membership, String password) {
        HashAlgorithm algorithm = algorithmOf(membership);
        if (algorithm.isDeterministic()) {
            return digest(algorithm, membership.id(), password);
        }
        // PHC format, e.g. $argon2id$v=19$m=65536,t=3,p=4$...
        return argon2.hash(ITERATIONS, MEMORY_COST, PARALLELISM, password.toCharArray());
    }

    /**
     * Check a password against a stored hash of the membership's algorithm.
     * Comparison is constant-time.
     */
    public boolean verify(Membership membership, String password, String passwordHash) {
        if (password == null || password.isEmpty() || passwordHash == null) {
            return false;
        }
        HashAlgorithm algorithm = algorithmOf(membership);
        if (algorithm.isDeterministic()) {
            return MessageDigest.isEqual(
                digest(algorithm, membership.id(), password).getBytes(StandardCharsets.UTF_8),
                passwordHash.getBytes(StandardCharsets.UTF_8));
        }
        try {
            return argon2.verify(passwordHash, password.toCharArray());
        } catch (RuntimeException e) {
            LOG.debugf("Stored hash of membership %s is not a valid Argon2 hash: %s", membership.id(), e.getMessage());
            return false;
        }
    }

    private static HashAlgorithm algorithmOf(Membership membership) {
        return membership.hashAlgorithm() != null ? membership.hashAlgorithm() : DEFAULT_ALGORITHM;
    }

    private static String digest(HashAlgorithm algorithm, String salt, String password) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm.digestName());
            digest.update(salt.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest(password.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm.digestName() + " not available", e);
        }
    }
}
