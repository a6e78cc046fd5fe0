package tech.tessera.identity.credential;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.tessera.identity.common.Json;
import tech.tessera.identity.common.Utilizer;
import tech.tessera.identity.common.errors.FieldError;
import tech.tessera.identity.common.errors.IdentityException;
import tech.tessera.identity.common.errors.ValidationErrors;
import tech.tessera.identity.document.DynamicDocument;
import tech.tessera.identity.event.EventEmitter;
import tech.tessera.identity.event.IdentityEvent;
import tech.tessera.identity.event.IdentityEventType;
import tech.tessera.identity.membership.Membership;
import tech.tessera.identity.membership.MembershipService;
import tech.tessera.identity.role.Role;
import tech.tessera.identity.role.RoleService;
import tech.tessera.identity.user.UserFields;
import tech.tessera.identity.user.UserService;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Password change, reset token issuance and redemption, and password checks.
 *
 * <p>Reset and redemption are open to administrators, the server role, system
 * utilizers and the user themself.
 */
@ApplicationScoped
public class CredentialService {

    private static final Logger LOG = Logger.getLogger(CredentialService.class);

    public static final String TOKEN_TYPE_CLAIM = "token_type";
    public static final String RESET_TOKEN_TYPE = "reset_token";

    static final String RESOURCE = "credential";
    static final String IDENTIFIER_FIELD = "username_or_email";

    private final MembershipService membershipService;
    private final UserService userService;
    private final RoleService roleService;
    private final PasswordService passwordService;
    private final TokenService tokenService;
    private final StringCipher cipher;
    private final EventEmitter eventEmitter;
    private final Clock clock;
    private final Duration resetTokenTtl;
    private final String resetLinkPath;

    @Inject
    public CredentialService(
            MembershipService membershipService,
            UserService userService,
            RoleService roleService,
            PasswordService passwordService,
            TokenService tokenService,
            StringCipher cipher,
            EventEmitter eventEmitter,
            Clock clock,
            CredentialConfig config) {
        this.membershipService = membershipService;
        this.userService = userService;
        this.roleService = roleService;
        this.passwordService = passwordService;
        this.tokenService = tokenService;
        this.cipher = cipher;
        this.eventEmitter = eventEmitter;
        this.clock = clock;
        this.resetTokenTtl = config.resetTokenTtl();
        this.resetLinkPath = config.resetLinkPath();
    }

    // ========================================================================
    // Change
    // ========================================================================

    /**
     * Hash and store a new password.
     *
     * @return the updated user without {@code password_hash}
     */
    public DynamicDocument changePassword(Utilizer utilizer, String membershipId, String userId, String newPassword) {
        Membership membership = membershipService.require(membershipId);
        userService.getUserWithPassword(membershipId, userId)
            .orElseThrow(() -> IdentityException.userNotFound(userId));

        String password = passwordService.ensurePassword(newPassword);
        DynamicDocument updated = userService.replacePasswordHash(
            utilizer, membershipId, userId, passwordService.hash(membership, password));
        LOG.infof("Password changed for user %s in membership %s by %s", userId, membershipId, utilizer.id());
        return updated;
    }

    // ========================================================================
    // Reset
    // ========================================================================

    /**
     * Issue a reset token for the user named by {@code usernameOrEmail} and
     * publish it, with its redemption link, for mail delivery.
     */
    public ResetPasswordToken resetPassword(Utilizer utilizer, String membershipId, String usernameOrEmail,
                                            ResetLinkContext linkContext) {
        Membership membership = membershipService.require(membershipId);
        requireIdentifier(usernameOrEmail);
        DynamicDocument user = userService.getUserWithPasswordByIdentifier(membershipId, usernameOrEmail)
            .orElseThrow(() -> IdentityException.userNotFound(usernameOrEmail));
        authorize(utilizer, membershipId, user.id());

        Instant issuedAt = clock.instant();
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("jti", UUID.randomUUID().toString());
        claims.put("sub", user.id());
        claims.put("membership_id", membershipId);
        putIfPresent(claims, UserFields.USERNAME, user.getString(UserFields.USERNAME));
        putIfPresent(claims, UserFields.EMAIL_ADDRESS, user.getString(UserFields.EMAIL_ADDRESS));
        putIfPresent(claims, UserFields.ROLE, user.getString(UserFields.ROLE));
        claims.put(TOKEN_TYPE_CLAIM, RESET_TOKEN_TYPE);
        String token = tokenService.generate(claims, issuedAt, issuedAt.plus(resetTokenTtl), membership.secretKey());

        String link = resetLink(membership, user, token, linkContext);
        user.remove(UserFields.PASSWORD_HASH);

        ObjectNode payload = Json.MAPPER.createObjectNode();
        payload.put("resetPasswordToken", token);
        payload.put("resetPasswordLink", link);
        payload.set("user", user.node());
        payload.set("membership", Json.MAPPER.<JsonNode>valueToTree(membership.withoutSecret()));
        eventEmitter.emit(IdentityEvent.of(IdentityEventType.USER_PASSWORD_RESET, utilizer, membershipId, clock)
            .subjectId(user.id())
            .document(payload)
            .build());

        LOG.infof("Reset token issued for user %s in membership %s by %s", user.id(), membershipId, utilizer.id());
        return new ResetPasswordToken(token, resetTokenTtl.toSeconds(), issuedAt);
    }

    /**
     * Redeem a reset token and set the new password.
     *
     * @throws IdentityException INVALID_TOKEN when the token does not verify, is not a
     *                           reset token or belongs to another user; TOKEN_EXPIRED
     *                           when it is past its expiry
     */
    public DynamicDocument setPassword(Utilizer utilizer, String membershipId, String resetToken,
                                       String usernameOrEmail, String newPassword) {
        Membership membership = membershipService.require(membershipId);
        requireIdentifier(usernameOrEmail);
        DynamicDocument user = userService.getUserWithPasswordByIdentifier(membershipId, usernameOrEmail)
            .orElseThrow(() -> IdentityException.userNotFound(usernameOrEmail));
        authorize(utilizer, membershipId, user.id());

        DecodedToken decoded = tokenService.tryDecode(resetToken, membership.secretKey())
            .orElseThrow(() -> IdentityException.invalidToken("Reset token could not be decoded"));
        if (decoded.isExpiredAt(clock.instant())) {
            throw IdentityException.tokenExpired(decoded.validTo());
        }
        if (!RESET_TOKEN_TYPE.equals(decoded.claim(TOKEN_TYPE_CLAIM))) {
            throw IdentityException.invalidToken("Token is not a reset token");
        }
        if (!Objects.equals(decoded.claim("sub"), user.id())) {
            throw IdentityException.invalidToken("Reset token was issued for another user");
        }

        return changePassword(utilizer, membershipId, user.id(), newPassword);
    }

    // ========================================================================
    // Check
    // ========================================================================

    /**
     * Whether {@code password} is the utilizer's current password. Empty input is
     * simply a mismatch.
     */
    public boolean checkPassword(Utilizer utilizer, String password) {
        if (password == null || password.isEmpty()) {
            return false;
        }
        Membership membership = membershipService.require(utilizer.membershipId());
        DynamicDocument user = userService.getUserWithPassword(utilizer.membershipId(), utilizer.id())
            .orElseThrow(() -> IdentityException.userNotFound(utilizer.id()));
        return passwordService.verify(membership, password, user.getString(UserFields.PASSWORD_HASH));
    }

    // ========================================================================
    // Internals
    // ========================================================================

    private static void requireIdentifier(String usernameOrEmail) {
        if (usernameOrEmail == null || usernameOrEmail.isBlank()) {
            new ValidationErrors().add(FieldError.required(IDENTIFIER_FIELD)).throwIfAny(RESOURCE);
        }
    }

    private void authorize(Utilizer utilizer, String membershipId, String userId) {
        if (utilizer.isSystem() || Objects.equals(utilizer.id(), userId)) {
            return;
        }
        Optional<Role> role = utilizer.role() == null
            ? Optional.empty()
            : roleService.getBySlug(membershipId, utilizer.role());
        boolean privileged = role
            .map(Role::slug)
            .filter(slug -> Role.ADMINISTRATOR.equals(slug) || Role.SERVER.equals(slug))
            .isPresent();
        if (!privileged) {
            throw IdentityException.accessDenied(
                "Only an administrator, the server or the user themself can reset or set a password");
        }
    }

    /**
     * {@code https://{host}{path}?token=} + URL-encoded {@code {membershipId}:{cipher(payload)}},
     * where the payload carries the secret key and token individually encrypted.
     */
    private String resetLink(Membership membership, DynamicDocument user, String token, ResetLinkContext linkContext) {
        String secret = membership.secretKey();
        String membershipId = membership.id();
        String payload = "emailAddress=" + Objects.toString(user.getString(UserFields.EMAIL_ADDRESS), "")
            + "&encryptedSecretKey=" + cipher.encrypt(secret, secret, membershipId)
            + "&serverUrl=" + Objects.toString(linkContext.serverUrl(), "")
            + "&membershipId=" + membershipId
            + "&encryptedResetPasswordToken=" + cipher.encrypt(token, secret, membershipId);
        String encoded = URLEncoder.encode(membershipId + ":" + cipher.encrypt(payload, secret, membershipId),
            StandardCharsets.UTF_8);
        return "https://" + linkContext.host() + resetLinkPath + "?token=" + encoded;
    }

    private static void putIfPresent(Map<String, Object> claims, String name, String value) {
        if (value != null) {
            claims.put(name, value);
        }
    }
}
