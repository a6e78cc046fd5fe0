package tech.tessera.identity.user;

/**
 * Well-known fields of a user document. Every other field is defined by the
 * membership's user types.
 */
public final class UserFields {

    public static final String COLLECTION = "users";

    public static final String USERNAME = "username";
    public static final String EMAIL_ADDRESS = "email_address";
    public static final String ROLE = "role";
    public static final String USER_TYPE = "user_type";
    public static final String SOURCE_PROVIDER = "sourceProvider";

    /**
     * Plain password accepted on create only; never stored.
     */
    public static final String PASSWORD = "password";
    public static final String PASSWORD_HASH = "password_hash";

    private UserFields() {
        // Constants class
    }
}
