package tech.tessera.identity.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.tessera.identity.common.errors.FieldError;
import tech.tessera.identity.common.errors.ValidationErrors;
import tech.tessera.identity.document.DynamicDocument;
import tech.tessera.identity.document.JsonValues;
import tech.tessera.identity.store.DocumentFilter;
import tech.tessera.identity.store.DocumentStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves reference properties to the documents they point at and embeds them.
 *
 * <p>A reference value is an id, or a previously embedded document carrying
 * {@code _id}. Targets live in the same collection and membership. When the
 * property declares a content type, the target's {@code user_type} must be that
 * type or inherit from it. Failures are field errors; a multi-reference with
 * any unresolved element is left untouched.
 */
@ApplicationScoped
public class ReferenceResolver {

    /**
     * Fields never embedded from a referenced document.
     */
    public static final List<String> HIDDEN_FIELDS = List.of("password_hash");

    private final DocumentStore store;
    private final UserTypeService userTypeService;

    @Inject
    public ReferenceResolver(DocumentStore store, UserTypeService userTypeService) {
        this.store = store;
        this.userTypeService = userTypeService;
    }

    public void resolve(DynamicDocument document, List<PropertyDefinition> properties,
                        ValidationContext context, ValidationErrors errors) {
        for (PropertyDefinition property : properties) {
            if (!property.isReference()) {
                continue;
            }
            Optional<JsonNode> value = document.get(property.path());
            if (value.isEmpty() || JsonValues.isNullish(value.get())) {
                continue;
            }
            if (property.cardinality() == ReferenceCardinality.MULTIPLE) {
                resolveMultiple(document, property, value.get(), context, errors);
            } else {
                resolveSingle(property.path(), value.get(), property, context, errors)
                    .ifPresent(resolved -> document.set(property.path(), resolved.node()));
            }
        }
    }

    private void resolveMultiple(DynamicDocument document, PropertyDefinition property, JsonNode value,
                                 ValidationContext context, ValidationErrors errors) {
        if (!value.isArray()) {
            errors.add(FieldError.invalid(property.path(), "INVALID_REFERENCE",
                property.path() + " must be an array of ids"));
            return;
        }
        List<DynamicDocument> resolved = new ArrayList<>(value.size());
        boolean complete = true;
        for (int i = 0; i < value.size(); i++) {
            Optional<DynamicDocument> item = resolveSingle(property.path() + "." + i, value.get(i), property, context, errors);
            if (item.isPresent()) {
                resolved.add(item.get());
            } else {
                complete = false;
            }
        }
        if (complete) {
            ArrayNode embedded = JsonNodeFactory.instance.arrayNode();
            resolved.forEach(item -> embedded.add(item.node()));
            document.set(property.path(), embedded);
        }
    }

    private Optional<DynamicDocument> resolveSingle(String field, JsonNode value, PropertyDefinition property,
                                                    ValidationContext context, ValidationErrors errors) {
        String id = referencedId(value);
        if (id == null) {
            errors.add(FieldError.invalid(field, "INVALID_REFERENCE", field + " must be a document id"));
            return Optional.empty();
        }

        Optional<DynamicDocument> target = store.collection(context.collection()).findOne(DocumentFilter.and(
            DocumentFilter.eq(DynamicDocument.ID, id),
            DocumentFilter.eq("membership_id", context.membershipId())));
        if (target.isEmpty()) {
            errors.add(FieldError.invalid(field, "REFERENCE_NOT_FOUND",
                "Referenced document not found for " + property.path(), id));
            return Optional.empty();
        }

        if (property.contentType() != null) {
            String targetType = target.get().getString(UserType.TYPE_FIELD);
            if (targetType == null) {
                errors.add(FieldError.invalid(field, "CONTENT_TYPE_MISSING",
                    "Referenced document has no content type, " + property.path() + " requires " + property.contentType(), id));
                return Optional.empty();
            }
            if (!userTypeService.isInheritFrom(context.membershipId(), targetType, property.contentType())) {
                errors.add(FieldError.invalid(field, "CONTENT_TYPE_MISMATCH",
                    property.path() + " requires " + property.contentType() + " but the referenced document is " + targetType, id));
                return Optional.empty();
            }
        }

        DynamicDocument embedded = target.get();
        HIDDEN_FIELDS.forEach(embedded::remove);
        return Optional.of(embedded);
    }

    private static String referencedId(JsonNode value) {
        if (value.isTextual() && !value.textValue().isBlank()) {
            return value.textValue();
        }
        if (value.isObject() && value.path(DynamicDocument.ID).isTextual()) {
            return value.get(DynamicDocument.ID).textValue();
        }
        return null;
    }
}
