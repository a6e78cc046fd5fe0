package tech.tessera.identity.schema;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.tessera.identity.authorization.AccessPattern;
import tech.tessera.identity.authorization.PatternConflicts;
import tech.tessera.identity.common.Paging;
import tech.tessera.identity.common.errors.FieldError;
import tech.tessera.identity.common.errors.IdentityException;
import tech.tessera.identity.common.errors.ValidationErrors;
import tech.tessera.identity.document.DynamicDocument;
import tech.tessera.identity.document.JsonValues;
import tech.tessera.identity.store.DocumentFilter;
import tech.tessera.identity.store.DocumentStore;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Validates a dynamic document against its user type.
 *
 * <p>The abstract-type and type-immutability rules fail immediately. Structure,
 * uniqueness, references and permission conflicts then all append to the
 * caller's accumulator, so one failure reports every problem of the payload.
 *
 * <p>The uniqueness pre-check is check-then-act. Every unique property also
 * gets a store-level unique index on first use, which rejects the losing
 * writer of a race.
 */
@ApplicationScoped
public class SchemaValidator {

    private static final String MEMBERSHIP_ID = "membership_id";

    private final DocumentStore store;
    private final UserTypeService userTypeService;
    private final ReferenceResolver referenceResolver;
    private final Set<String> ensuredIndexes = ConcurrentHashMap.newKeySet();

    @Inject
    public SchemaValidator(DocumentStore store, UserTypeService userTypeService, ReferenceResolver referenceResolver) {
        this.store = store;
        this.userTypeService = userTypeService;
        this.referenceResolver = referenceResolver;
    }

    /**
     * Run every validation step. Reference properties of {@code document} are
     * replaced by the embedded targets when they resolve.
     *
     * @throws IdentityException for an abstract type or a changed user type
     */
    public void validate(DynamicDocument document, UserType type, ValidationContext context, ValidationErrors errors) {
        if (type.isAbstract()) {
            throw IdentityException.abstractUserType(type.slug());
        }
        if (context.isUpdate()) {
            String priorType = context.prior().getString(UserType.TYPE_FIELD);
            if (priorType != null && !Objects.equals(priorType, document.getString(UserType.TYPE_FIELD))) {
                throw IdentityException.immutable("user", UserType.TYPE_FIELD);
            }
        }

        List<PropertyDefinition> properties = userTypeService.effectiveProperties(context.membershipId(), type);
        validateStructure(document, properties, userTypeService.effectiveRequiredFields(context.membershipId(), type), errors);
        validateUniqueness(document, properties, context, errors);
        referenceResolver.resolve(document, properties, context, errors);
        PatternConflicts.validate(
            document.getStringList(PatternConflicts.PERMISSIONS_FIELD),
            document.getStringList(PatternConflicts.FORBIDDEN_FIELD),
            AccessPattern.Ubac::parse,
            errors);
    }

    void validateStructure(DynamicDocument document, List<PropertyDefinition> properties,
                           List<String> requiredFields, ValidationErrors errors) {
        for (String required : requiredFields) {
            Optional<JsonNode> value = document.get(required);
            if (value.isEmpty() || JsonValues.isNullish(value.get())
                    || (value.get().isTextual() && value.get().textValue().isBlank())) {
                errors.add(FieldError.required(required));
            }
        }
        for (PropertyDefinition property : properties) {
            Optional<JsonNode> value = document.get(property.path());
            if (value.isEmpty() || JsonValues.isNullish(value.get())) {
                continue;
            }
            if (!property.type().accepts(value.get())) {
                errors.add(FieldError.invalid(property.path(), "INVALID_TYPE",
                    property.path() + " must be of type " + property.type().name().toLowerCase()));
            }
        }
    }

    void validateUniqueness(DynamicDocument document, List<PropertyDefinition> properties,
                            ValidationContext context, ValidationErrors errors) {
        for (PropertyDefinition property : properties) {
            if (!property.unique()) {
                continue;
            }
            ensureUniqueIndex(context.collection(), property.path());
            Optional<JsonNode> value = document.get(property.path());
            if (value.isEmpty() || JsonValues.isNullish(value.get())) {
                continue;
            }
            List<DynamicDocument> holders = store.collection(context.collection())
                .find(DocumentFilter.and(
                        DocumentFilter.eq(MEMBERSHIP_ID, context.membershipId()),
                        DocumentFilter.eq(property.path(), value.get())),
                    Paging.of(0, 2).withoutCount())
                .items();
            boolean takenByOther = holders.stream().anyMatch(holder -> !Objects.equals(holder.id(), context.documentId()));
            if (takenByOther) {
                errors.add(FieldError.notUnique(property.path(), value.get().isTextual() ? value.get().textValue() : null));
            }
        }
    }

    private void ensureUniqueIndex(String collection, String path) {
        if (ensuredIndexes.add(collection + ":" + path)) {
            store.collection(collection).ensureUniqueIndex(List.of(MEMBERSHIP_ID, path));
        }
    }
}
