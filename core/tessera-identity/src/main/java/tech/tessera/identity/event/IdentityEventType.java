package tech.tessera.identity.event;

/**
 * Event types emitted by the identity core.
 * Codes follow {app}:{domain}:{aggregate}:{action}.
 */
public enum IdentityEventType {

    USER_CREATED("user", "created"),
    USER_UPDATED("user", "updated"),
    USER_DELETED("user", "deleted"),
    USER_PASSWORD_CHANGED("user", "password-changed"),
    USER_PASSWORD_RESET("user", "password-reset"),

    ROLE_CREATED("role", "created"),
    ROLE_UPDATED("role", "updated"),
    ROLE_DELETED("role", "deleted"),

    USER_TYPE_CREATED("user-type", "created");

    public static final String APP_DOMAIN = "tessera:identity";

    private final String aggregate;
    private final String action;

    IdentityEventType(String aggregate, String action) {
        this.aggregate = aggregate;
        this.action = action;
    }

    public String aggregate() {
        return aggregate;
    }

    public String action() {
        return action;
    }

    /**
     * e.g. "tessera:identity:role:created"
     */
    public String code() {
        return APP_DOMAIN + ":" + aggregate + ":" + action;
    }
}
