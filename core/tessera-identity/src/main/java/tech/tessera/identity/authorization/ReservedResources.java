package tech.tessera.identity.authorization;

import java.util.ArrayList;
import java.util.List;

/**
 * Resource kinds owned by the identity platform itself, and the permission set
 * the administrator role holds over them.
 */
public final class ReservedResources {

    public static final List<String> RESOURCES = List.of(
        "memberships",
        "users",
        "user-types",
        "roles",
        "applications",
        "providers",
        "tokens",
        "active-tokens",
        "revoked-tokens",
        "events",
        "webhooks",
        "mailhooks"
    );

    public static final List<String> CRUD_ACTIONS = List.of("create", "read", "update", "delete");

    /**
     * Full CRUD over every reserved resource, any subject and any object,
     * e.g. {@code *.users.update.*}.
     */
    public static List<String> adminPermissions() {
        List<String> permissions = new ArrayList<>(RESOURCES.size() * CRUD_ACTIONS.size());
        for (String resource : RESOURCES) {
            for (String action : CRUD_ACTIONS) {
                permissions.add(new AccessPattern.Rbac(AccessPattern.WILDCARD, resource, action, AccessPattern.WILDCARD).format());
            }
        }
        return List.copyOf(permissions);
    }

    private ReservedResources() {
        // Utility class
    }
}
