package tech.tessera.identity.user;

import java.util.Locale;

/**
 * Where a user account originates. Only {@link #TESSERA} accounts hold a password.
 */
public enum SourceProvider {
    TESSERA,
    GOOGLE,
    FACEBOOK,
    MICROSOFT,
    APPLE;

    public static final SourceProvider DEFAULT = TESSERA;

    /**
     * Case-insensitive lookup. A missing tag means {@link #DEFAULT}.
     *
     * @throws IllegalArgumentException for an unknown tag
     */
    public static SourceProvider parse(String tag) {
        if (tag == null || tag.isBlank()) {
            return DEFAULT;
        }
        return valueOf(tag.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isLocal() {
        return this == TESSERA;
    }
}
