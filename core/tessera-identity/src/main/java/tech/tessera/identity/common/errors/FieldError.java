package tech.tessera.identity.common.errors;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One field-scoped validation problem.
 *
 * @param field   dotted path of the offending field
 * @param code    machine reason (e.g. {@code REQUIRED}, {@code NOT_UNIQUE})
 * @param message human readable reason
 * @param value   offending value where safe to echo, otherwise null
 * @param kind    category the problem belongs to
 */
public record FieldError(String field, String code, String message, Object value, ErrorKind kind) {

    public static FieldError invalid(String field, String code, String message) {
        return new FieldError(field, code, message, null, ErrorKind.VALIDATION_FAILED);
    }

    public static FieldError invalid(String field, String code, String message, Object value) {
        return new FieldError(field, code, message, value, ErrorKind.VALIDATION_FAILED);
    }

    public static FieldError required(String field) {
        return invalid(field, "REQUIRED", field + " is a required field");
    }

    public static FieldError unsluggableName(String field, String name) {
        return invalid(field, "INVALID_NAME", field + " must contain at least one letter or digit", name);
    }

    public static FieldError notUnique(String field, Object value) {
        return new FieldError(field, "NOT_UNIQUE", field + " must be unique, the value is already in use",
            value, ErrorKind.ALREADY_EXISTS);
    }

    public static FieldError conflictingPattern(String field, String pattern) {
        return new FieldError(field, "CONFLICTING_PATTERN",
            "Permitted and forbidden sets are conflicted. The same permission is there in both sets ('" + pattern + "')",
            pattern, ErrorKind.CONFLICTING_PATTERNS);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("field", field);
        map.put("code", code);
        map.put("message", message);
        if (value != null) {
            map.put("value", value);
        }
        return map;
    }
}
