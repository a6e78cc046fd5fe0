package tech.tessera.identity.common.errors;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed failure of an identity core operation.
 *
 * <p>Carries an {@link ErrorKind}, a stable machine code (e.g. {@code ROLE_NOT_FOUND})
 * and a details map safe to render to callers. Secrets are never placed in details.
 */
public class IdentityException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;
    private final Map<String, Object> details;

    public IdentityException(ErrorKind kind, String code, String message, Map<String, Object> details) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public IdentityException(ErrorKind kind, String code, String message) {
        this(kind, code, message, Map.of());
    }

    public ErrorKind kind() {
        return kind;
    }

    public String code() {
        return code;
    }

    public Map<String, Object> details() {
        return details;
    }

    // ========================================================================
    // Not found
    // ========================================================================

    public static IdentityException membershipNotFound(String membershipId) {
        return notFound("membership", membershipId);
    }

    public static IdentityException roleNotFound(String roleId) {
        return notFound("role", roleId);
    }

    public static IdentityException userNotFound(String userId) {
        return notFound("user", userId);
    }

    public static IdentityException userTypeNotFound(String nameOrSlug) {
        return notFound("user_type", nameOrSlug);
    }

    public static IdentityException notFound(String resource, String id) {
        return new IdentityException(
            ErrorKind.NOT_FOUND,
            resource.toUpperCase() + "_NOT_FOUND",
            resource.replace('_', ' ') + " not found (" + id + ")",
            Map.of("id", String.valueOf(id)));
    }

    // ========================================================================
    // Validation and business rules
    // ========================================================================

    public static IdentityException identicalDocument(String resource) {
        return new IdentityException(
            ErrorKind.IDENTICAL_DOCUMENT,
            "IDENTICAL_DOCUMENT",
            "The " + resource + " payload is identical to the current document, nothing to update");
    }

    public static IdentityException reservedRoleName(String slug) {
        return new IdentityException(
            ErrorKind.RESERVED_NAME_VIOLATION,
            "RESERVED_ROLE_NAME",
            "'" + slug + "' is a reserved role name and can only be managed by the system",
            Map.of("slug", slug));
    }

    public static IdentityException immutable(String resource, String field) {
        return new IdentityException(
            ErrorKind.IMMUTABLE,
            resource.toUpperCase() + "_" + field.toUpperCase() + "_IMMUTABLE",
            field + " of a " + resource.replace('_', ' ') + " cannot be changed",
            Map.of("field", field));
    }

    public static IdentityException userTypeRequired() {
        return new IdentityException(
            ErrorKind.VALIDATION_FAILED,
            "USER_TYPE_REQUIRED",
            "user_type is required for users of an external source provider",
            Map.of("field", "user_type"));
    }

    public static IdentityException abstractUserType(String slug) {
        return new IdentityException(
            ErrorKind.VALIDATION_FAILED,
            "ABSTRACT_USER_TYPE",
            "User type '" + slug + "' is abstract and cannot be assigned to a user",
            Map.of("user_type", slug));
    }

    public static IdentityException passwordRequired() {
        return new IdentityException(
            ErrorKind.VALIDATION_FAILED,
            "PASSWORD_REQUIRED",
            "password is required",
            Map.of("field", "password"));
    }

    public static IdentityException passwordTooShort(int minLength) {
        return new IdentityException(
            ErrorKind.VALIDATION_FAILED,
            "PASSWORD_TOO_SHORT",
            "password must be at least " + minLength + " characters long",
            Map.of("field", "password", "min_length", minLength));
    }

    public static IdentityException malformedQuery(String reason) {
        return new IdentityException(ErrorKind.VALIDATION_FAILED, "MALFORMED_QUERY", "Malformed query: " + reason);
    }

    // ========================================================================
    // Access and tokens
    // ========================================================================

    public static IdentityException accessDenied(String reason) {
        return new IdentityException(ErrorKind.ACCESS_DENIED, "ACCESS_DENIED", reason);
    }

    public static IdentityException invalidToken(String reason) {
        return new IdentityException(ErrorKind.INVALID_TOKEN, "INVALID_TOKEN", reason);
    }

    public static IdentityException tokenExpired(Instant expiredAt) {
        return new IdentityException(
            ErrorKind.TOKEN_EXPIRED,
            "TOKEN_EXPIRED",
            "Token expired at " + expiredAt,
            Map.of("expired_at", expiredAt.toString()));
    }
}
