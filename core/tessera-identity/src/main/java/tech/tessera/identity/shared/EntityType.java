package tech.tessera.identity.shared;

import java.util.HashMap;
import java.util.Map;

/**
 * Entity types of the identity core with their 3-character ID prefixes.
 *
 * IDs are persisted WITH the prefix: "{prefix}_{tsid}" (e.g., "usr_0HZXEQ5Y8JY5Z").
 * The membership id is part of every document, so a prefixed id can be traced
 * back to its collection without a lookup.
 *
 * Usage:
 * <pre>
 * String id = TsidGenerator.generate(EntityType.ROLE);  // "rol_0HZXEQ5Y8JY5Z"
 * </pre>
 */
public enum EntityType {

    // Tenancy
    MEMBERSHIP("mbr"),

    // Identity
    USER("usr"),
    USER_TYPE("utp"),

    // Authorization
    ROLE("rol"),

    // Events
    EVENT("evn", false);           // High-volume: no prefix

    private final String prefix;
    private final boolean usePrefix;

    private static final Map<String, EntityType> BY_PREFIX = new HashMap<>();

    static {
        for (EntityType type : values()) {
            BY_PREFIX.put(type.prefix, type);
        }
    }

    EntityType(String prefix) {
        this(prefix, true);
    }

    EntityType(String prefix, boolean usePrefix) {
        this.prefix = prefix;
        this.usePrefix = usePrefix;
    }

    /**
     * Returns the prefix used in serialized IDs (e.g., "usr" for USER).
     */
    public String prefix() {
        return prefix;
    }

    public boolean usePrefix() {
        return usePrefix;
    }

    /**
     * Looks up an EntityType by its prefix.
     *
     * @return the EntityType, or null if not found
     */
    public static EntityType fromPrefix(String prefix) {
        return BY_PREFIX.get(prefix);
    }
}
