package tech.tessera.identity.crud;

import tech.tessera.identity.common.Utilizer;
import tech.tessera.identity.common.errors.IdentityException;
import tech.tessera.identity.common.errors.ValidationErrors;
import tech.tessera.identity.document.DynamicDocument;
import tech.tessera.identity.event.IdentityEventType;
import tech.tessera.identity.membership.Membership;
import tech.tessera.identity.schema.ValidationContext;
import tech.tessera.identity.shared.EntityType;

import java.util.List;

/**
 * Per-document-type rules plugged into {@link MembershipDocumentEngine}.
 */
public interface DocumentPolicy {

    /**
     * Resource name used in error codes and messages, e.g. "role".
     */
    String resource();

    String collection();

    EntityType entityType();

    IdentityEventType createdEvent();

    IdentityEventType updatedEvent();

    IdentityEventType deletedEvent();

    /**
     * Fields the core owns; removed from every caller payload before anything else.
     */
    default List<String> managedFields() {
        return List.of(DynamicDocument.ID, MembershipDocumentEngine.MEMBERSHIP_ID, MembershipDocumentEngine.SYS);
    }

    /**
     * Fields never returned to callers.
     */
    default List<String> hiddenFields() {
        return List.of();
    }

    /**
     * Unique indexes backing the pre-checks, each led by {@code membership_id}.
     */
    default List<List<String>> uniqueIndexes() {
        return List.of();
    }

    /**
     * Adjust a stripped, membership-stamped create payload before validation.
     */
    default void beforeCreate(Utilizer utilizer, Membership membership, DynamicDocument document) {
    }

    /**
     * Adjust or reject a merged update before validation.
     *
     * @param merged  current document overridden by the stripped partial payload, without {@code _id}
     * @param current persisted document
     * @param partial stripped caller payload
     */
    default void beforeUpdate(Utilizer utilizer, Membership membership, DynamicDocument merged,
                              DynamicDocument current, DynamicDocument partial) {
    }

    /**
     * Reject a delete before it is issued.
     */
    default void beforeDelete(Utilizer utilizer, DynamicDocument current) {
    }

    void validate(Utilizer utilizer, DynamicDocument document, ValidationContext context, ValidationErrors errors);

    IdentityException notFound(String id);
}
