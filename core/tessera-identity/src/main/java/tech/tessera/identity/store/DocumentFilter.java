package tech.tessera.identity.store;

import com.fasterxml.jackson.databind.JsonNode;
import tech.tessera.identity.common.Json;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Store-neutral query model. Adapters translate it to their native form
 * ({@link FilterEvaluator} in memory, BSON for MongoDB).
 */
public sealed interface DocumentFilter permits
    DocumentFilter.Eq,
    DocumentFilter.In,
    DocumentFilter.Range,
    DocumentFilter.And,
    DocumentFilter.Or,
    DocumentFilter.FullText,
    DocumentFilter.Exists {

    /**
     * Value at {@code field} equals {@code value}. Against an array field, any element may match.
     */
    record Eq(String field, JsonNode value) implements DocumentFilter {}

    record In(String field, List<JsonNode> values) implements DocumentFilter {
        public In {
            values = List.copyOf(values);
        }
    }

    /**
     * Bounds on an ordered value; null bounds are open.
     */
    record Range(String field, JsonNode gt, JsonNode gte, JsonNode lt, JsonNode lte) implements DocumentFilter {}

    /**
     * Conjunction; an empty conjunction matches every document.
     */
    record And(List<DocumentFilter> filters) implements DocumentFilter {
        public And {
            filters = List.copyOf(filters);
        }
    }

    /**
     * Disjunction; an empty disjunction matches nothing.
     */
    record Or(List<DocumentFilter> filters) implements DocumentFilter {
        public Or {
            filters = List.copyOf(filters);
        }
    }

    /**
     * Keyword search over the text content of a document.
     *
     * @param language text-search language hint, may be null
     */
    record FullText(String keyword, String language) implements DocumentFilter {}

    record Exists(String field, boolean exists) implements DocumentFilter {}

    // ========================================================================
    // Factories
    // ========================================================================

    static DocumentFilter all() {
        return new And(List.of());
    }

    static Eq eq(String field, Object value) {
        return new Eq(field, toNode(value));
    }

    static In in(String field, List<?> values) {
        List<JsonNode> nodes = new ArrayList<>(values.size());
        for (Object value : values) {
            nodes.add(toNode(value));
        }
        return new In(field, nodes);
    }

    static And and(DocumentFilter... filters) {
        return new And(Arrays.asList(filters));
    }

    static Or or(DocumentFilter... filters) {
        return new Or(Arrays.asList(filters));
    }

    static FullText text(String keyword, String language) {
        return new FullText(keyword, language);
    }

    static Exists exists(String field) {
        return new Exists(field, true);
    }

    private static JsonNode toNode(Object value) {
        return value instanceof JsonNode ? (JsonNode) value : Json.MAPPER.<JsonNode>valueToTree(value);
    }
}
