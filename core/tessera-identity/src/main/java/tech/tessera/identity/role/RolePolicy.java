package tech.tessera.identity.role;

import tech.tessera.identity.authorization.AccessPattern;
import tech.tessera.identity.authorization.PatternConflicts;
import tech.tessera.identity.common.Paging;
import tech.tessera.identity.common.Utilizer;
import tech.tessera.identity.common.errors.FieldError;
import tech.tessera.identity.common.errors.IdentityException;
import tech.tessera.identity.common.errors.ValidationErrors;
import tech.tessera.identity.crud.DocumentPolicy;
import tech.tessera.identity.crud.MembershipDocumentEngine;
import tech.tessera.identity.document.DynamicDocument;
import tech.tessera.identity.event.IdentityEventType;
import tech.tessera.identity.membership.Membership;
import tech.tessera.identity.schema.ValidationContext;
import tech.tessera.identity.shared.EntityType;
import tech.tessera.identity.shared.Slugs;
import tech.tessera.identity.store.DocumentFilter;
import tech.tessera.identity.store.DocumentStore;

import java.util.List;
import java.util.Objects;

/**
 * Role rules: slug derived from the name on create and fixed afterwards,
 * reserved slugs managed by system utilizers only, no-op updates rejected,
 * and non-conflicting allow/deny sets.
 */
class RolePolicy implements DocumentPolicy {

    static final String RESOURCE = "role";
    static final String NAME = "name";
    static final String SLUG = "slug";

    private final DocumentStore store;

    RolePolicy(DocumentStore store) {
        this.store = store;
    }

    @Override
    public String resource() {
        return RESOURCE;
    }

    @Override
    public String collection() {
        return Role.COLLECTION;
    }

    @Override
    public EntityType entityType() {
        return EntityType.ROLE;
    }

    @Override
    public IdentityEventType createdEvent() {
        return IdentityEventType.ROLE_CREATED;
    }

    @Override
    public IdentityEventType updatedEvent() {
        return IdentityEventType.ROLE_UPDATED;
    }

    @Override
    public IdentityEventType deletedEvent() {
        return IdentityEventType.ROLE_DELETED;
    }

    @Override
    public List<List<String>> uniqueIndexes() {
        return List.of(List.of(MembershipDocumentEngine.MEMBERSHIP_ID, SLUG));
    }

    @Override
    public void beforeCreate(Utilizer utilizer, Membership membership, DynamicDocument document) {
        String name = document.getString(NAME);
        if (name == null || name.isBlank()) {
            document.remove(SLUG);
            return;
        }
        String slug = Slugs.slugify(name);
        document.set(SLUG, slug);
        guardReserved(utilizer, slug);
    }

    @Override
    public void beforeUpdate(Utilizer utilizer, Membership membership, DynamicDocument merged,
                             DynamicDocument current, DynamicDocument partial) {
        String currentSlug = current.getString(SLUG);
        String requestedSlug = partial.getString(SLUG);
        if (requestedSlug != null && !requestedSlug.equals(currentSlug)) {
            throw IdentityException.immutable(RESOURCE, SLUG);
        }
        guardReserved(utilizer, currentSlug);

        DynamicDocument before = current.copy();
        before.remove(DynamicDocument.ID);
        before.remove(MembershipDocumentEngine.SYS);
        DynamicDocument after = merged.copy();
        after.remove(MembershipDocumentEngine.SYS);
        if (after.isEquivalentTo(before)) {
            throw IdentityException.identicalDocument(RESOURCE);
        }
    }

    @Override
    public void beforeDelete(Utilizer utilizer, DynamicDocument current) {
        guardReserved(utilizer, current.getString(SLUG));
    }

    @Override
    public void validate(Utilizer utilizer, DynamicDocument document, ValidationContext context, ValidationErrors errors) {
        String name = document.getString(NAME);
        if (name == null || name.isBlank()) {
            errors.add(FieldError.required(NAME));
        }
        if (document.getString(MembershipDocumentEngine.MEMBERSHIP_ID) == null) {
            errors.add(FieldError.required(MembershipDocumentEngine.MEMBERSHIP_ID));
        }
        PatternConflicts.validate(
            document.getStringList(PatternConflicts.PERMISSIONS_FIELD),
            document.getStringList(PatternConflicts.FORBIDDEN_FIELD),
            AccessPattern.Rbac::parse,
            errors);

        String slug = document.getString(SLUG);
        if (slug != null && slug.isEmpty()) {
            errors.add(FieldError.unsluggableName(NAME, name));
        } else if (slug != null && slugTakenByOther(slug, context)) {
            errors.add(FieldError.notUnique(SLUG, slug));
        }
    }

    @Override
    public IdentityException notFound(String id) {
        return IdentityException.roleNotFound(id);
    }

    // Pre-check only; the [membership_id, slug] unique index settles races.
    private boolean slugTakenByOther(String slug, ValidationContext context) {
        return store.collection(Role.COLLECTION)
            .find(DocumentFilter.and(
                    DocumentFilter.eq(MembershipDocumentEngine.MEMBERSHIP_ID, context.membershipId()),
                    DocumentFilter.eq(SLUG, slug)),
                Paging.of(0, 2).withoutCount())
            .items().stream()
            .anyMatch(holder -> !Objects.equals(holder.id(), context.documentId()));
    }

    private static void guardReserved(Utilizer utilizer, String slug) {
        if (Role.isReservedSlug(slug) && !utilizer.isSystem()) {
            throw IdentityException.reservedRoleName(slug);
        }
    }
}
