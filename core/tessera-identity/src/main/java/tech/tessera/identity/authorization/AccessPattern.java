package tech.tessera.identity.authorization;

import java.util.ArrayList;
import java.util.List;

/**
 * Wildcard-capable access pattern, an ordered tuple of dot separated segments.
 *
 * <p>Two variants:
 * <ul>
 *   <li>{@link Rbac} - role level: {@code subject.resource.action.object}.
 *       The three segment form {@code resource.action.object} implies the
 *       wildcard subject.</li>
 *   <li>{@link Ubac} - user level: {@code resource.action.object}. The subject
 *       is the user the pattern is attached to.</li>
 * </ul>
 *
 * <p>Each segment is a literal or the wildcard {@code *}. Record equality is the
 * structural equality used for allow/deny conflict detection: two patterns are
 * equal when their normalized segments are equal. {@link #matches(AccessPattern)}
 * is the wildcard-aware check used when evaluating a concrete access.
 */
public sealed interface AccessPattern permits AccessPattern.Rbac, AccessPattern.Ubac {

    String WILDCARD = "*";
    String SEPARATOR = ".";

    List<String> segments();

    /**
     * Canonical text form; {@code parse(format())} yields an equal pattern.
     */
    default String format() {
        return String.join(SEPARATOR, segments());
    }

    /**
     * Wildcard-aware comparison of same-variant patterns: a wildcard segment on
     * either side matches any literal in the same position.
     */
    default boolean matches(AccessPattern other) {
        if (other == null || other.getClass() != getClass()) {
            return false;
        }
        List<String> mine = segments();
        List<String> theirs = other.segments();
        for (int i = 0; i < mine.size(); i++) {
            String a = mine.get(i);
            String b = theirs.get(i);
            if (!a.equals(WILDCARD) && !b.equals(WILDCARD) && !a.equals(b)) {
                return false;
            }
        }
        return true;
    }

    record Rbac(String subject, String resource, String action, String object) implements AccessPattern {

        public static Rbac parse(String text) throws MalformedPatternException {
            List<String> parts = split(text, 3, 4);
            if (parts.size() == 3) {
                return new Rbac(WILDCARD, parts.get(0), parts.get(1), parts.get(2));
            }
            return new Rbac(parts.get(0), parts.get(1), parts.get(2), parts.get(3));
        }

        @Override
        public List<String> segments() {
            return List.of(subject, resource, action, object);
        }

        @Override
        public String toString() {
            return format();
        }
    }

    record Ubac(String resource, String action, String object) implements AccessPattern {

        public static Ubac parse(String text) throws MalformedPatternException {
            List<String> parts = split(text, 3, 3);
            return new Ubac(parts.get(0), parts.get(1), parts.get(2));
        }

        @Override
        public List<String> segments() {
            return List.of(resource, action, object);
        }

        @Override
        public String toString() {
            return format();
        }
    }

    private static List<String> split(String text, int minSegments, int maxSegments) throws MalformedPatternException {
        if (text == null || text.isBlank()) {
            throw new MalformedPatternException(String.valueOf(text), "pattern is empty");
        }
        String[] raw = text.trim().split("\\.", -1);
        if (raw.length < minSegments || raw.length > maxSegments) {
            String expected = minSegments == maxSegments
                ? String.valueOf(minSegments)
                : minSegments + " or " + maxSegments;
            throw new MalformedPatternException(text, "expected " + expected + " segments but found " + raw.length);
        }
        List<String> segments = new ArrayList<>(raw.length);
        for (String segment : raw) {
            String trimmed = segment.trim();
            if (trimmed.isEmpty()) {
                throw new MalformedPatternException(text, "segments must not be empty");
            }
            if (trimmed.chars().anyMatch(Character::isWhitespace)) {
                throw new MalformedPatternException(text, "segments must not contain whitespace");
            }
            if (trimmed.contains(WILDCARD) && !trimmed.equals(WILDCARD)) {
                throw new MalformedPatternException(text, "a wildcard must make up the whole segment");
            }
            segments.add(trimmed);
        }
        return segments;
    }
}
