package tech.tessera.identity.membership;

/**
 * Password hash algorithm chosen per membership.
 *
 * The SHA-2 variants are deterministic digests salted with the membership id,
 * kept for memberships migrated from older deployments. ARGON2ID produces a
 * salted PHC string and is verified, not recomputed.
 */
public enum HashAlgorithm {
    SHA2_256("SHA-256"),
    SHA2_384("SHA-384"),
    SHA2_512("SHA-512"),
    ARGON2ID(null);

    private final String digestName;

    HashAlgorithm(String digestName) {
        this.digestName = digestName;
    }

    /**
     * JCA digest name, or null for non-digest algorithms.
     */
    public String digestName() {
        return digestName;
    }

    public boolean isDeterministic() {
        return digestName != null;
    }
}
