package tech.tessera.identity.common;

import java.util.Objects;

/**
 * The acting identity behind an operation.
 *
 * <p>Authorization checks pattern-match on the variant: a {@link Human} carries
 * its user id, username and role slug; a {@link System} identity is used for
 * bootstrap and other system-initiated flows and may touch reserved roles.
 */
public sealed interface Utilizer {

    String SYSTEM_NAME = "system";

    /**
     * Membership the utilizer belongs to.
     */
    String membershipId();

    /**
     * Identifier written to events as the acting utilizer.
     */
    String id();

    /**
     * Name stamped into sys metadata (created_by / modified_by).
     */
    String displayName();

    /**
     * Role slug held by the utilizer.
     */
    String role();

    default boolean isSystem() {
        return this instanceof System;
    }

    static Human human(String id, String username, String role, String membershipId) {
        return new Human(id, username, role, membershipId);
    }

    static System system(String membershipId) {
        return new System(membershipId);
    }

    record Human(String id, String username, String role, String membershipId) implements Utilizer {

        public Human {
            Objects.requireNonNull(id, "id must not be null");
        }

        @Override
        public String displayName() {
            return username != null ? username : id;
        }
    }

    record System(String membershipId) implements Utilizer {

        @Override
        public String id() {
            return SYSTEM_NAME;
        }

        @Override
        public String displayName() {
            return SYSTEM_NAME;
        }

        @Override
        public String role() {
            return SYSTEM_NAME;
        }
    }
}
