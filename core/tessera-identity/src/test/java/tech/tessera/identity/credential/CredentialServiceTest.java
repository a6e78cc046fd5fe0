package tech.tessera.identity.credential;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.tessera.identity.common.Utilizer;
import tech.tessera.identity.common.errors.CumulativeValidationException;
import tech.tessera.identity.common.errors.ErrorKind;
import tech.tessera.identity.common.errors.IdentityException;
import tech.tessera.identity.document.DynamicDocument;
import tech.tessera.identity.event.IdentityEventType;
import tech.tessera.identity.role.Role;
import tech.tessera.identity.test.CoreFixture;
import tech.tessera.identity.user.UserFields;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CredentialService: reset token issuance, redemption and
 * password checks over an in-memory store.
 */
class CredentialServiceTest {

    private static final ResetLinkContext LINK = new ResetLinkContext("https://api.acme.test", "id.acme.test");

    private CoreFixture core;
    private String membershipId;
    private DynamicDocument ann;
    private DynamicDocument bob;
    private Utilizer asAnn;
    private Utilizer asBob;
    private Utilizer asAdministrator;

    @BeforeEach
    void setUp() {
        core = new CoreFixture();
        membershipId = core.membership("Acme").id();
        core.role(membershipId, "Editor", List.of("blog.posts.*"));
        ann = core.user(membershipId, "ann", "editor");
        bob = core.user(membershipId, "bob", "editor");
        asAnn = Utilizer.human(ann.id(), "ann", "editor", membershipId);
        asBob = Utilizer.human(bob.id(), "bob", "editor", membershipId);
        asAdministrator = Utilizer.human("usr_root", "root", Role.ADMINISTRATOR, membershipId);
        core.events.clear();
    }

    // User of a root custom type: neither username nor email_address
    private void storeDeviceUser() {
        core.store.collection(UserFields.COLLECTION).insert(DynamicDocument.parse("{\"_id\":\"usr_device\","
            + "\"membership_id\":\"" + membershipId + "\",\"user_type\":\"device\",\"serial\":\"D-1\","
            + "\"password_hash\":\"device-hash\"}"));
    }

    // ========================================
    // RESET TESTS
    // ========================================

    @Test
    @DisplayName("resetPassword should deny a non-privileged utilizer acting for another user")
    void resetPassword_shouldDenyAccess_whenNotSelfNorPrivileged() {
        assertThatThrownBy(() -> core.credentials.resetPassword(asBob, membershipId, "ann", LINK))
            .isInstanceOfSatisfying(IdentityException.class,
                e -> assertThat(e.kind()).isEqualTo(ErrorKind.ACCESS_DENIED));
        assertThat(core.events.all()).isEmpty();
    }

    @Test
    @DisplayName("resetPassword should issue a one hour reset token to the user themself")
    void resetPassword_shouldIssueResetToken_whenSelf() {
        // Act
        ResetPasswordToken issued = core.credentials.resetPassword(asAnn, membershipId, "ann@acme.test", LINK);

        // Assert
        assertThat(issued.expiresIn()).isEqualTo(3600);
        assertThat(issued.createdAt()).isEqualTo(CoreFixture.START);
        assertThat(issued.expiresAt()).isEqualTo(CoreFixture.START.plus(Duration.ofHours(1)));
        DecodedToken decoded = core.tokens.tryDecode(issued.token(), CoreFixture.SECRET).orElseThrow();
        assertThat(decoded.claim(CredentialService.TOKEN_TYPE_CLAIM)).isEqualTo(CredentialService.RESET_TOKEN_TYPE);
        assertThat(decoded.claim("sub")).isEqualTo(ann.id());
        assertThat(decoded.claim("membership_id")).isEqualTo(membershipId);
        assertThat(decoded.validTo()).isEqualTo(CoreFixture.START.plus(Duration.ofHours(1)));
    }

    @Test
    @DisplayName("resetPassword should be allowed for the server role")
    void resetPassword_shouldAllowServerRole() {
        Utilizer server = Utilizer.human("svc", "svc", Role.SERVER, membershipId);

        assertThat(core.credentials.resetPassword(server, membershipId, "ann", LINK).token()).isNotBlank();
    }

    @Test
    @DisplayName("resetPassword should publish a link the front end can decrypt and a sanitized payload")
    void resetPassword_shouldPublishDecryptableLink() {
        ResetPasswordToken issued = core.credentials.resetPassword(asAdministrator, membershipId, "ann", LINK);

        JsonNode payload = core.events.ofType(IdentityEventType.USER_PASSWORD_RESET).get(0).document();
        String link = payload.get("resetPasswordLink").textValue();
        assertThat(link).startsWith("https://id.acme.test/set-password?token=");

        String token = URLDecoder.decode(link.substring(link.indexOf("token=") + 6), StandardCharsets.UTF_8);
        assertThat(token).startsWith(membershipId + ":");
        String decrypted = core.cipher.decrypt(token.substring(membershipId.length() + 1), CoreFixture.SECRET, membershipId);
        assertThat(decrypted)
            .contains("emailAddress=ann@acme.test")
            .contains("serverUrl=https://api.acme.test")
            .contains("membershipId=" + membershipId);

        assertThat(payload.get("resetPasswordToken").textValue()).isEqualTo(issued.token());
        assertThat(payload.get("user").has("password_hash")).isFalse();
        assertThat(payload.get("membership").has("secret_key")).isFalse();
    }

    @Test
    @DisplayName("resetPassword should fail with NOT_FOUND for an unknown user")
    void resetPassword_shouldFail_whenUserUnknown() {
        assertThatThrownBy(() -> core.credentials.resetPassword(asAdministrator, membershipId, "ghost", LINK))
            .isInstanceOfSatisfying(IdentityException.class,
                e -> assertThat(e.code()).isEqualTo("USER_NOT_FOUND"));
    }

    @Test
    @DisplayName("resetPassword should require an identifier instead of matching a user without username or email")
    void resetPassword_shouldFailValidation_whenIdentifierMissing() {
        // Arrange
        storeDeviceUser();

        // Act & Assert
        for (String identifier : new String[] {null, " "}) {
            assertThatThrownBy(() -> core.credentials.resetPassword(asAdministrator, membershipId, identifier, LINK))
                .isInstanceOfSatisfying(CumulativeValidationException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.VALIDATION_FAILED);
                    assertThat(e.hasErrorFor("username_or_email")).isTrue();
                });
        }
        assertThat(core.events.ofType(IdentityEventType.USER_PASSWORD_RESET)).isEmpty();
    }

    // ========================================
    // SET PASSWORD TESTS
    // ========================================

    @Test
    @DisplayName("setPassword should change the password when the reset token is valid")
    void setPassword_shouldChangePassword_whenTokenValid() {
        // Arrange
        String token = core.credentials.resetPassword(asAnn, membershipId, "ann", LINK).token();

        // Act
        DynamicDocument updated = core.credentials.setPassword(asAnn, membershipId, token, "ann", "n3w-password");

        // Assert
        assertThat(updated.contains("password_hash")).isFalse();
        assertThat(core.credentials.checkPassword(asAnn, "n3w-password")).isTrue();
        assertThat(core.credentials.checkPassword(asAnn, "s3cret-pass")).isFalse();
        assertThat(core.events.ofType(IdentityEventType.USER_PASSWORD_CHANGED)).singleElement()
            .satisfies(event -> assertThat(event.document().has("password_hash")).isFalse());
    }

    @Test
    @DisplayName("setPassword should report TOKEN_EXPIRED once the token lifetime has passed")
    void setPassword_shouldFailWithTokenExpired_whenTokenExpired() {
        String token = core.credentials.resetPassword(asAnn, membershipId, "ann", LINK).token();
        core.clock.advance(Duration.ofHours(2));

        assertThatThrownBy(() -> core.credentials.setPassword(asAnn, membershipId, token, "ann", "n3w-password"))
            .isInstanceOfSatisfying(IdentityException.class,
                e -> assertThat(e.kind()).isEqualTo(ErrorKind.TOKEN_EXPIRED));
        assertThat(core.credentials.checkPassword(asAnn, "s3cret-pass")).isTrue();
    }

    @Test
    @DisplayName("setPassword should report INVALID_TOKEN for a token that does not decode")
    void setPassword_shouldFailWithInvalidToken_whenGarbage() {
        assertThatThrownBy(() -> core.credentials.setPassword(asAnn, membershipId, "garbage", "ann", "n3w-password"))
            .isInstanceOfSatisfying(IdentityException.class,
                e -> assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_TOKEN));
    }

    @Test
    @DisplayName("setPassword should reject a reset token issued for another user")
    void setPassword_shouldFailWithInvalidToken_whenTokenBelongsToOtherUser() {
        String bobsToken = core.credentials.resetPassword(asAdministrator, membershipId, "bob", LINK).token();

        assertThatThrownBy(() -> core.credentials.setPassword(asAdministrator, membershipId, bobsToken, "ann", "n3w-password"))
            .isInstanceOfSatisfying(IdentityException.class,
                e -> assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_TOKEN));
    }

    @Test
    @DisplayName("setPassword should reject a token that is not a reset token")
    void setPassword_shouldFailWithInvalidToken_whenTokenTypeWrong() {
        String accessToken = core.tokens.generate(Map.of("sub", ann.id()),
            CoreFixture.START, CoreFixture.START.plus(Duration.ofHours(1)), CoreFixture.SECRET);

        assertThatThrownBy(() -> core.credentials.setPassword(asAnn, membershipId, accessToken, "ann", "n3w-password"))
            .isInstanceOfSatisfying(IdentityException.class,
                e -> assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_TOKEN));
    }

    @Test
    @DisplayName("setPassword should enforce the password policy on the new password")
    void setPassword_shouldThrowPasswordTooShort_whenNewPasswordTooShort() {
        String token = core.credentials.resetPassword(asAnn, membershipId, "ann", LINK).token();

        assertThatThrownBy(() -> core.credentials.setPassword(asAnn, membershipId, token, "ann", "abc"))
            .isInstanceOfSatisfying(IdentityException.class,
                e -> assertThat(e.code()).isEqualTo("PASSWORD_TOO_SHORT"));
    }

    @Test
    @DisplayName("setPassword should require an identifier and leave every password unchanged")
    void setPassword_shouldFailValidation_whenIdentifierMissing() {
        // Arrange
        storeDeviceUser();
        String token = core.credentials.resetPassword(asAdministrator, membershipId, "ann", LINK).token();

        // Act & Assert
        assertThatThrownBy(() -> core.credentials.setPassword(asAdministrator, membershipId, token, null, "n3w-password"))
            .isInstanceOfSatisfying(CumulativeValidationException.class,
                e -> assertThat(e.hasErrorFor("username_or_email")).isTrue());
        assertThat(core.events.ofType(IdentityEventType.USER_PASSWORD_CHANGED)).isEmpty();
        assertThat(core.users.getUserWithPassword(membershipId, "usr_device").orElseThrow()
            .getString("password_hash")).isEqualTo("device-hash");
    }

    // ========================================
    // CHECK TESTS
    // ========================================

    @Test
    @DisplayName("checkPassword should return false for an empty password without touching the store")
    void checkPassword_shouldReturnFalse_whenEmpty() {
        Utilizer ghost = Utilizer.human("usr_ghost", "ghost", "editor", membershipId);

        assertThat(core.credentials.checkPassword(ghost, "")).isFalse();
        assertThat(core.credentials.checkPassword(ghost, null)).isFalse();
    }

    @Test
    @DisplayName("checkPassword should fail with USER_NOT_FOUND for an unknown utilizer")
    void checkPassword_shouldFail_whenUserUnknown() {
        Utilizer ghost = Utilizer.human("usr_ghost", "ghost", "editor", membershipId);

        assertThatThrownBy(() -> core.credentials.checkPassword(ghost, "s3cret-pass"))
            .isInstanceOfSatisfying(IdentityException.class,
                e -> assertThat(e.code()).isEqualTo("USER_NOT_FOUND"));
    }
}
