package tech.tessera.identity.common.errors;

/**
 * Failure categories surfaced by the identity core.
 *
 * Callers (HTTP controllers, admin UI) map these to status codes; the
 * {@code code} on {@link IdentityException} narrows the reason within a kind.
 */
public enum ErrorKind {

    /** Membership, role, user or user type does not exist. Maps to 404. */
    NOT_FOUND,

    /** One or more field-level validation errors. Maps to 400. */
    VALIDATION_FAILED,

    /** Allow and deny pattern sets contain the same pattern. Maps to 400. */
    CONFLICTING_PATTERNS,

    /** Duplicate slug or unique value, including store-level races. Maps to 409. */
    ALREADY_EXISTS,

    /** Update would leave the document unchanged. Maps to 400. */
    IDENTICAL_DOCUMENT,

    /** Reserved role slug used by a non-system utilizer. Maps to 400. */
    RESERVED_NAME_VIOLATION,

    /** Utilizer is not allowed to perform the operation. Maps to 403. */
    ACCESS_DENIED,

    /** Token cannot be decoded, has a foreign signature or the wrong type. Maps to 401. */
    INVALID_TOKEN,

    /** Token signature is valid but the token has expired. Maps to 401. */
    TOKEN_EXPIRED,

    /** Attempt to change a field that is fixed after creation. Maps to 400. */
    IMMUTABLE
}
