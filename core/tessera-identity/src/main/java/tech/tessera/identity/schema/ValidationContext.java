package tech.tessera.identity.schema;

import tech.tessera.identity.document.DynamicDocument;

/**
 * Where and against what a document is being validated.
 *
 * @param membershipId owning membership
 * @param collection   collection the document lives in (uniqueness and reference lookups)
 * @param documentId   id of the document being updated, null on create
 * @param prior        persisted state before the update, null on create
 */
public record ValidationContext(String membershipId, String collection, String documentId, DynamicDocument prior) {

    public static ValidationContext forCreate(String membershipId, String collection) {
        return new ValidationContext(membershipId, collection, null, null);
    }

    public static ValidationContext forUpdate(String membershipId, String collection, DynamicDocument prior) {
        return new ValidationContext(membershipId, collection, prior.id(), prior);
    }

    public boolean isUpdate() {
        return prior != null;
    }
}
