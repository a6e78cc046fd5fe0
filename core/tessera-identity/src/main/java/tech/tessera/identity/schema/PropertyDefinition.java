package tech.tessera.identity.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One declared property of a user type.
 *
 * @param path        dotted path of the property inside the document
 * @param type        declared kind
 * @param unique      whether the value must be unique within the membership
 * @param cardinality single or multiple, for references only
 * @param contentType user type the referenced documents must be (or inherit from), optional
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PropertyDefinition(
    @JsonProperty("path") String path,
    @JsonProperty("type") FieldType type,
    @JsonProperty("unique") boolean unique,
    @JsonProperty("cardinality") ReferenceCardinality cardinality,
    @JsonProperty("content_type") String contentType
) {

    public PropertyDefinition {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (type == FieldType.REFERENCE && cardinality == null) {
            cardinality = ReferenceCardinality.SINGLE;
        }
    }

    public static PropertyDefinition plain(String path, FieldType type) {
        return new PropertyDefinition(path, type, false, null, null);
    }

    public static PropertyDefinition unique(String path, FieldType type) {
        return new PropertyDefinition(path, type, true, null, null);
    }

    public static PropertyDefinition reference(String path, ReferenceCardinality cardinality, String contentType) {
        return new PropertyDefinition(path, FieldType.REFERENCE, false, cardinality, contentType);
    }

    public boolean isReference() {
        return type == FieldType.REFERENCE;
    }
}
