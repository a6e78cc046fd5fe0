package tech.tessera.identity.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import tech.tessera.identity.common.Json;
import tech.tessera.identity.common.errors.IdentityException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses a MongoDB-style JSON query into a {@link DocumentFilter}.
 *
 * <p>Supported: plain equality, {@code $eq $gt $gte $lt $lte $in $exists} field
 * operators, {@code $and}/{@code $or} arrays and {@code $text: {$search, $language}}.
 * Several top-level entries are ANDed.
 */
public final class FilterParser {

    public static DocumentFilter parse(String json) {
        if (json == null || json.isBlank()) {
            return DocumentFilter.all();
        }
        try {
            return parse(Json.MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw IdentityException.malformedQuery("query is not valid JSON");
        }
    }

    public static DocumentFilter parse(JsonNode query) {
        if (query == null || query.isNull() || query.isMissingNode()) {
            return DocumentFilter.all();
        }
        if (!query.isObject()) {
            throw IdentityException.malformedQuery("query must be a JSON object");
        }
        List<DocumentFilter> clauses = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = query.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            clauses.add(clause(entry.getKey(), entry.getValue()));
        }
        return clauses.size() == 1 ? clauses.get(0) : new DocumentFilter.And(clauses);
    }

    private static DocumentFilter clause(String key, JsonNode value) {
        switch (key) {
            case "$and":
                return new DocumentFilter.And(subQueries(key, value));
            case "$or":
                return new DocumentFilter.Or(subQueries(key, value));
            case "$text":
                if (!value.isObject() || !value.path("$search").isTextual()) {
                    throw IdentityException.malformedQuery("$text requires a $search string");
                }
                JsonNode language = value.get("$language");
                return DocumentFilter.text(value.get("$search").textValue(),
                    language != null && language.isTextual() ? language.textValue() : null);
            default:
                if (key.startsWith("$")) {
                    throw IdentityException.malformedQuery("unsupported operator " + key);
                }
                return isOperatorObject(value) ? operators(key, value) : new DocumentFilter.Eq(key, value);
        }
    }

    private static List<DocumentFilter> subQueries(String operator, JsonNode value) {
        if (!value.isArray()) {
            throw IdentityException.malformedQuery(operator + " requires an array");
        }
        List<DocumentFilter> filters = new ArrayList<>();
        for (JsonNode element : value) {
            filters.add(parse(element));
        }
        return filters;
    }

    private static boolean isOperatorObject(JsonNode value) {
        if (!value.isObject() || value.isEmpty()) {
            return false;
        }
        Iterator<String> names = value.fieldNames();
        while (names.hasNext()) {
            if (!names.next().startsWith("$")) {
                return false;
            }
        }
        return true;
    }

    private static DocumentFilter operators(String field, JsonNode operators) {
        List<DocumentFilter> clauses = new ArrayList<>();
        JsonNode gt = null;
        JsonNode gte = null;
        JsonNode lt = null;
        JsonNode lte = null;
        Iterator<Map.Entry<String, JsonNode>> entries = operators.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            JsonNode operand = entry.getValue();
            switch (entry.getKey()) {
                case "$eq":
                    clauses.add(new DocumentFilter.Eq(field, operand));
                    break;
                case "$gt":
                    gt = operand;
                    break;
                case "$gte":
                    gte = operand;
                    break;
                case "$lt":
                    lt = operand;
                    break;
                case "$lte":
                    lte = operand;
                    break;
                case "$in":
                    if (!operand.isArray()) {
                        throw IdentityException.malformedQuery("$in on " + field + " requires an array");
                    }
                    List<JsonNode> values = new ArrayList<>();
                    operand.forEach(values::add);
                    clauses.add(new DocumentFilter.In(field, values));
                    break;
                case "$exists":
                    clauses.add(new DocumentFilter.Exists(field, operand.asBoolean()));
                    break;
                default:
                    throw IdentityException.malformedQuery("unsupported operator " + entry.getKey() + " on " + field);
            }
        }
        if (gt != null || gte != null || lt != null || lte != null) {
            clauses.add(new DocumentFilter.Range(field, gt, gte, lt, lte));
        }
        return clauses.size() == 1 ? clauses.get(0) : new DocumentFilter.And(clauses);
    }

    private FilterParser() {
        // Utility class
    }
}
