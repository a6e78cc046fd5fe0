package tech.tessera.identity.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeType;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Value semantics over Jackson trees: numeric-tolerant equivalence and a total
 * ordering used by filters and sorting.
 */
public final class JsonValues {

    /**
     * Equality where {@code 5}, {@code 5L} and {@code 5.0} are the same value and
     * a missing node equals an explicit null.
     */
    public static boolean equivalent(JsonNode a, JsonNode b) {
        if (isNullish(a) || isNullish(b)) {
            return isNullish(a) && isNullish(b);
        }
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        if (a.isArray() && b.isArray()) {
            if (a.size() != b.size()) {
                return false;
            }
            for (int i = 0; i < a.size(); i++) {
                if (!equivalent(a.get(i), b.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (a.isObject() && b.isObject()) {
            if (a.size() != b.size()) {
                return false;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = a.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!b.has(field.getKey()) || !equivalent(field.getValue(), b.get(field.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    /**
     * Total order: nulls, numbers, strings, booleans, then containers (by size).
     */
    public static int compare(JsonNode a, JsonNode b) {
        int rankA = rank(a);
        int rankB = rank(b);
        if (rankA != rankB) {
            return Integer.compare(rankA, rankB);
        }
        return switch (rankA) {
            case 0 -> 0;
            case 1 -> a.decimalValue().compareTo(b.decimalValue());
            case 2 -> a.asText().compareTo(b.asText());
            case 3 -> Boolean.compare(a.booleanValue(), b.booleanValue());
            default -> Integer.compare(a.size(), b.size());
        };
    }

    /**
     * Whether two values can be meaningfully ordered against each other
     * (both numbers, both strings or both booleans).
     */
    public static boolean comparable(JsonNode a, JsonNode b) {
        int rank = rank(a);
        return rank > 0 && rank < 4 && rank == rank(b);
    }

    public static boolean isNullish(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static int rank(JsonNode node) {
        if (isNullish(node)) {
            return 0;
        }
        JsonNodeType type = node.getNodeType();
        return switch (type) {
            case NUMBER -> 1;
            case STRING -> 2;
            case BOOLEAN -> 3;
            default -> 4;
        };
    }

    private JsonValues() {
        // Utility class
    }
}
