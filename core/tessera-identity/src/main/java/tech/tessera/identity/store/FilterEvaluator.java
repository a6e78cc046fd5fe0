package tech.tessera.identity.store;

import com.fasterxml.jackson.databind.JsonNode;
import tech.tessera.identity.document.DynamicDocument;
import tech.tessera.identity.document.JsonValues;

import java.util.Locale;
import java.util.Optional;
import java.util.function.IntPredicate;

/**
 * Evaluates a {@link DocumentFilter} against a document in memory.
 * Semantics follow MongoDB: equality against an array field matches any element,
 * and equality with null matches a missing field.
 */
public final class FilterEvaluator {

    public static boolean matches(DocumentFilter filter, DynamicDocument document) {
        if (filter instanceof DocumentFilter.Eq eq) {
            return valueMatches(document.get(eq.field()).orElse(null), eq.value());
        }
        if (filter instanceof DocumentFilter.In in) {
            JsonNode actual = document.get(in.field()).orElse(null);
            return in.values().stream().anyMatch(expected -> valueMatches(actual, expected));
        }
        if (filter instanceof DocumentFilter.Range range) {
            return rangeMatches(range, document);
        }
        if (filter instanceof DocumentFilter.And and) {
            return and.filters().stream().allMatch(f -> matches(f, document));
        }
        if (filter instanceof DocumentFilter.Or or) {
            return or.filters().stream().anyMatch(f -> matches(f, document));
        }
        if (filter instanceof DocumentFilter.FullText text) {
            return text.keyword() != null && containsText(document.node(), text.keyword().toLowerCase(Locale.ROOT));
        }
        if (filter instanceof DocumentFilter.Exists exists) {
            return document.contains(exists.field()) == exists.exists();
        }
        throw new IllegalArgumentException("Unsupported filter: " + filter);
    }

    private static boolean valueMatches(JsonNode actual, JsonNode expected) {
        if (actual != null && actual.isArray() && (expected == null || !expected.isArray())) {
            for (JsonNode element : actual) {
                if (JsonValues.equivalent(element, expected)) {
                    return true;
                }
            }
            return false;
        }
        return JsonValues.equivalent(actual, expected);
    }

    private static boolean rangeMatches(DocumentFilter.Range range, DynamicDocument document) {
        Optional<JsonNode> value = document.get(range.field());
        if (value.isEmpty() || JsonValues.isNullish(value.get())) {
            return false;
        }
        JsonNode actual = value.get();
        return bound(actual, range.gt(), c -> c > 0)
            && bound(actual, range.gte(), c -> c >= 0)
            && bound(actual, range.lt(), c -> c < 0)
            && bound(actual, range.lte(), c -> c <= 0);
    }

    private static boolean bound(JsonNode actual, JsonNode limit, IntPredicate accept) {
        if (limit == null) {
            return true;
        }
        return JsonValues.comparable(actual, limit) && accept.test(JsonValues.compare(actual, limit));
    }

    private static boolean containsText(JsonNode node, String keyword) {
        if (node.isTextual()) {
            return node.textValue().toLowerCase(Locale.ROOT).contains(keyword);
        }
        if (node.isContainerNode()) {
            for (JsonNode child : node) {
                if (containsText(child, keyword)) {
                    return true;
                }
            }
        }
        return false;
    }

    private FilterEvaluator() {
        // Utility class
    }
}
