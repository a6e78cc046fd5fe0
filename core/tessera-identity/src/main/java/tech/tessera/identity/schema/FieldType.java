package tech.tessera.identity.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Declared kind of a user type property.
 */
public enum FieldType {
    STRING,
    NUMBER,
    INTEGER,
    BOOLEAN,
    OBJECT,
    ARRAY,
    EMAIL,
    DATE,
    REFERENCE;

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    /**
     * Whether a non-null value satisfies this kind. References are checked by
     * the reference resolver, not here.
     */
    public boolean accepts(JsonNode value) {
        return switch (this) {
            case STRING -> value.isTextual();
            case NUMBER -> value.isNumber();
            case INTEGER -> value.isIntegralNumber();
            case BOOLEAN -> value.isBoolean();
            case OBJECT -> value.isObject();
            case ARRAY -> value.isArray();
            case EMAIL -> value.isTextual() && EMAIL_PATTERN.matcher(value.textValue()).matches();
            case DATE -> value.isTextual() && isIsoDate(value.textValue());
            case REFERENCE -> true;
        };
    }

    private static boolean isIsoDate(String text) {
        try {
            if (text.length() == 10) {
                LocalDate.parse(text);
            } else {
                Instant.parse(text);
            }
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
