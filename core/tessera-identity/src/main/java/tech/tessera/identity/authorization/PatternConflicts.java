package tech.tessera.identity.authorization;

import tech.tessera.identity.common.errors.FieldError;
import tech.tessera.identity.common.errors.ValidationErrors;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Allow/deny conflict detection over permission pattern sets.
 *
 * <p>A conflict is a pattern present (structurally, after normalization) in both
 * sets. "blog.posts.*" allowed with "blog.posts.delete" denied is a legitimate
 * carve-out, not a conflict.
 */
public final class PatternConflicts {

    public static final String PERMISSIONS_FIELD = "permissions";
    public static final String FORBIDDEN_FIELD = "forbidden";

    @FunctionalInterface
    public interface Parser<P extends AccessPattern> {
        P parse(String text) throws MalformedPatternException;
    }

    /**
     * Patterns present in both sets, in allow-set order, without duplicates.
     * Pairwise comparison over |allow| x |deny|.
     */
    public static <P extends AccessPattern> List<P> findConflicts(Collection<P> allow, Collection<P> deny) {
        Set<P> conflicts = new LinkedHashSet<>();
        for (P permitted : allow) {
            for (P forbidden : deny) {
                if (permitted.equals(forbidden)) {
                    conflicts.add(permitted);
                }
            }
        }
        return new ArrayList<>(conflicts);
    }

    /**
     * Parse both pattern lists and record malformed entries and conflicts as field errors.
     * Null lists are treated as empty.
     */
    public static <P extends AccessPattern> void validate(
            List<String> permissions,
            List<String> forbidden,
            Parser<P> parser,
            ValidationErrors errors) {
        List<P> allow = parseAll(PERMISSIONS_FIELD, permissions, parser, errors);
        List<P> deny = parseAll(FORBIDDEN_FIELD, forbidden, parser, errors);
        for (P conflict : findConflicts(allow, deny)) {
            errors.add(FieldError.conflictingPattern(PERMISSIONS_FIELD, conflict.format()));
        }
    }

    private static <P extends AccessPattern> List<P> parseAll(
            String field,
            List<String> texts,
            Parser<P> parser,
            ValidationErrors errors) {
        List<P> parsed = new ArrayList<>();
        if (texts == null) {
            return parsed;
        }
        for (int i = 0; i < texts.size(); i++) {
            try {
                parsed.add(parser.parse(texts.get(i)));
            } catch (MalformedPatternException e) {
                errors.add(FieldError.invalid(field + "[" + i + "]", "MALFORMED_PATTERN", e.getMessage(), e.pattern()));
            }
        }
        return parsed;
    }

    private PatternConflicts() {
        // Utility class
    }
}
