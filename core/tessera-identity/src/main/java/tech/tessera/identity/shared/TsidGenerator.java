package tech.tessera.identity.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * TSID generation for every persisted identity entity.
 *
 * Format: "{prefix}_{tsid}" (e.g., "rol_0HZXEQ5Y8JY5Z"), time-sortable and URL-safe.
 * Event ids are raw TSIDs without prefix.
 */
public final class TsidGenerator {

    public static final String SEPARATOR = "_";

    /**
     * Generate a new ID for the given entity type.
     *
     * @param type the entity type
     * @return the ID (with or without prefix depending on entity type)
     */
    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        String tsid = TsidCreator.getTsid().toString();
        return type.usePrefix() ? type.prefix() + SEPARATOR + tsid : tsid;
    }

    /**
     * Resolve the entity type of a typed ID.
     *
     * @param typedId the typed ID (e.g., "usr_0HZXEQ5Y8JY5Z")
     * @return the entity type, or null when the prefix is unknown or missing
     */
    public static EntityType typeOf(String typedId) {
        if (typedId == null || typedId.isBlank()) {
            return null;
        }
        int separatorIndex = typedId.indexOf(SEPARATOR);
        if (separatorIndex == -1) {
            return null;
        }
        return EntityType.fromPrefix(typedId.substring(0, separatorIndex));
    }

    private TsidGenerator() {
        // Utility class
    }
}
