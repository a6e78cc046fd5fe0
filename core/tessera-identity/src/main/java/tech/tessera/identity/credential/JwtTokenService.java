package tech.tessera.identity.credential;

import io.smallrye.jwt.algorithm.SignatureAlgorithm;
import io.smallrye.jwt.build.Jwt;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * HS256 JWTs signed with a key derived from the membership secret (SHA-256 of
 * the secret, so any secret length yields a 256-bit key).
 *
 * Tokens are built with SmallRye JWT. Decoding uses jose4j directly with all
 * claim validators skipped, so the caller can tell an expired token from a
 * forged one.
 */
@ApplicationScoped
public class JwtTokenService implements TokenService {

    private static final Logger LOG = Logger.getLogger(JwtTokenService.class);

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final String issuer;

    @Inject
    public JwtTokenService(CredentialConfig config) {
        this(config.issuer());
    }

    public JwtTokenService(String issuer) {
        this.issuer = issuer;
    }

    @Override
    public String generate(Map<String, Object> claims, Instant issuedAt, Instant expiresAt, String signingSecret) {
        return Jwt.claims(claims)
            .issuer(issuer)
            .issuedAt(issuedAt)
            .expiresAt(expiresAt)
            .jws()
            .algorithm(SignatureAlgorithm.HS256)
            .sign(signingKey(signingSecret));
    }

    @Override
    public Optional<DecodedToken> tryDecode(String token, String signingSecret) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        JwtConsumer consumer = new JwtConsumerBuilder()
            .setSkipAllValidators()
            .setVerificationKey(new HmacKey(signingKey(signingSecret).getEncoded()))
            .setRelaxVerificationKeyValidation()
            .setJwsAlgorithmConstraints(AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256)
            .build();
        try {
            JwtClaims claims = consumer.processToClaims(token);
            NumericDate expiration = claims.getExpirationTime();
            Instant validTo = expiration == null ? null : Instant.ofEpochSecond(expiration.getValue());
            return Optional.of(new DecodedToken(claims.getClaimsMap(), validTo));
        } catch (InvalidJwtException | MalformedClaimException e) {
            LOG.debugf("Token rejected: %s", e.getMessage());
            return Optional.empty();
        }
    }

    private static SecretKey signingKey(String signingSecret) {
        try {
            byte[] key = MessageDigest.getInstance("SHA-256").digest(signingSecret.getBytes(StandardCharsets.UTF_8));
            return new SecretKeySpec(key, HMAC_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
