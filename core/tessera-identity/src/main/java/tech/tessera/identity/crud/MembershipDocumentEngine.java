package tech.tessera.identity.crud;

import com.fasterxml.jackson.databind.JsonNode;
import org.jboss.logging.Logger;
import tech.tessera.identity.common.BulkDeleteResult;
import tech.tessera.identity.common.Json;
import tech.tessera.identity.common.PagedResult;
import tech.tessera.identity.common.Paging;
import tech.tessera.identity.common.SysModel;
import tech.tessera.identity.common.Utilizer;
import tech.tessera.identity.common.errors.CumulativeValidationException;
import tech.tessera.identity.common.errors.FieldError;
import tech.tessera.identity.common.errors.IdentityException;
import tech.tessera.identity.common.errors.ValidationErrors;
import tech.tessera.identity.document.DynamicDocument;
import tech.tessera.identity.event.EventEmitter;
import tech.tessera.identity.event.IdentityEvent;
import tech.tessera.identity.event.IdentityEventType;
import tech.tessera.identity.membership.Membership;
import tech.tessera.identity.membership.MembershipService;
import tech.tessera.identity.schema.ValidationContext;
import tech.tessera.identity.shared.TsidGenerator;
import tech.tessera.identity.store.DocumentCollection;
import tech.tessera.identity.store.DocumentFilter;
import tech.tessera.identity.store.DocumentStore;
import tech.tessera.identity.store.DuplicateKeyException;
import tech.tessera.identity.store.FilterParser;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;

/**
 * Tenant-scoped create/read/update/delete pipeline over dynamic documents.
 *
 * <p>Every operation resolves the membership first and ANDs {@code membership_id}
 * into every store query. Mutations run: strip managed fields, stamp, validate,
 * write, emit the event, run listeners. Validation completes before the write.
 *
 * <p>Cancellation: an interrupted calling thread is refused with
 * {@link CancellationException} up to the last checkpoint before the write.
 * Once the write is issued the operation completes (write, event, listeners)
 * and the interrupt flag is left set for the caller.
 */
public class MembershipDocumentEngine {

    private static final Logger LOG = Logger.getLogger(MembershipDocumentEngine.class);

    public static final String MEMBERSHIP_ID = "membership_id";
    public static final String SYS = "sys";

    private final DocumentStore store;
    private final MembershipService membershipService;
    private final DocumentPolicy policy;
    private final EventEmitter eventEmitter;
    private final List<MutationListener> listeners;
    private final Clock clock;

    public MembershipDocumentEngine(
            DocumentStore store,
            MembershipService membershipService,
            DocumentPolicy policy,
            EventEmitter eventEmitter,
            List<MutationListener> listeners,
            Clock clock) {
        this.store = store;
        this.membershipService = membershipService;
        this.policy = policy;
        this.eventEmitter = eventEmitter;
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
        policy.uniqueIndexes().forEach(collection()::ensureUniqueIndex);
    }

    // ========================================================================
    // Reads
    // ========================================================================

    public Optional<DynamicDocument> get(String membershipId, String id) {
        membershipService.require(membershipId);
        return findInMembership(membershipId, id).map(this::hide);
    }

    public PagedResult<DynamicDocument> list(String membershipId, Paging paging) {
        return query(membershipId, DocumentFilter.all(), paging, null);
    }

    /**
     * Caller filter ANDed with the membership clause, with optional field projection.
     */
    public PagedResult<DynamicDocument> query(String membershipId, DocumentFilter filter, Paging paging,
                                              Map<String, Boolean> selectFields) {
        membershipService.require(membershipId);
        return collection().find(scoped(membershipId, filter), paging)
            .map(document -> hide(document).project(selectFields));
    }

    public PagedResult<DynamicDocument> query(String membershipId, String jsonQuery, Paging paging,
                                              Map<String, Boolean> selectFields) {
        return query(membershipId, FilterParser.parse(jsonQuery), paging, selectFields);
    }

    public PagedResult<DynamicDocument> search(String membershipId, String keyword, Paging paging) {
        Membership membership = membershipService.require(membershipId);
        return collection().find(
                scoped(membershipId, DocumentFilter.text(keyword, membership.defaultLanguage())), paging)
            .map(this::hide);
    }

    /**
     * First document of the membership matching the filter, hidden fields included.
     * For in-core credential checks only; never hand the result to a caller.
     */
    public Optional<DynamicDocument> findOneWithHiddenFields(String membershipId, DocumentFilter filter) {
        return collection().findOne(scoped(membershipId, filter));
    }

    // ========================================================================
    // Create
    // ========================================================================

    public DynamicDocument create(Utilizer utilizer, String membershipId, DynamicDocument payload) {
        return create(utilizer, membershipId, payload, document -> { });
    }

    /**
     * @param customizer applied after managed fields are stripped and stamped,
     *                   before validation (e.g. to set a computed managed field)
     */
    public DynamicDocument create(Utilizer utilizer, String membershipId, DynamicDocument payload,
                                  Consumer<DynamicDocument> customizer) {
        checkCancelled();
        Membership membership = membershipService.require(membershipId);

        DynamicDocument document = stripManaged(payload);
        document.set(MEMBERSHIP_ID, membershipId);
        customizer.accept(document);
        policy.beforeCreate(utilizer, membership, document);

        ValidationErrors errors = new ValidationErrors();
        policy.validate(utilizer, document, ValidationContext.forCreate(membershipId, policy.collection()), errors);
        errors.throwIfAny(policy.resource());

        checkCancelled();
        String id = TsidGenerator.generate(policy.entityType());
        document.set(DynamicDocument.ID, id);
        document.set(SYS, Json.MAPPER.<JsonNode>valueToTree(SysModel.created(utilizer, clock)));
        insert(document);
        LOG.debugf("Created %s %s in membership %s", policy.resource(), id, membershipId);

        DynamicDocument created = hide(document);
        publish(IdentityEvent.of(policy.createdEvent(), utilizer, membershipId, clock)
            .subjectId(id)
            .document(created.copy().node())
            .build());
        return created;
    }

    // ========================================================================
    // Update
    // ========================================================================

    public DynamicDocument update(Utilizer utilizer, String membershipId, String id, DynamicDocument payload) {
        checkCancelled();
        Membership membership = membershipService.require(membershipId);
        DynamicDocument current = findInMembership(membershipId, id).orElseThrow(() -> policy.notFound(id));

        DynamicDocument partial = stripManaged(payload);
        DynamicDocument merged = current.merge(partial);
        merged.remove(DynamicDocument.ID);
        policy.beforeUpdate(utilizer, membership, merged, current, partial);

        ValidationErrors errors = new ValidationErrors();
        policy.validate(utilizer, merged, ValidationContext.forUpdate(membershipId, policy.collection(), current), errors);
        errors.throwIfAny(policy.resource());

        checkCancelled();
        return write(utilizer, membershipId, id, current, merged, policy.updatedEvent());
    }

    /**
     * Apply a core-controlled change (e.g. a new password hash) to the stored
     * document. Managed fields are not stripped and schema validation does not run.
     */
    public DynamicDocument updateManaged(Utilizer utilizer, String membershipId, String id,
                                         Consumer<DynamicDocument> change, IdentityEventType eventType) {
        checkCancelled();
        membershipService.require(membershipId);
        DynamicDocument current = findInMembership(membershipId, id).orElseThrow(() -> policy.notFound(id));
        DynamicDocument changed = current.copy();
        change.accept(changed);
        changed.remove(DynamicDocument.ID);
        checkCancelled();
        return write(utilizer, membershipId, id, current, changed, eventType);
    }

    private DynamicDocument write(Utilizer utilizer, String membershipId, String id,
                                  DynamicDocument current, DynamicDocument next, IdentityEventType eventType) {
        SysModel priorSys = current.get(SYS)
            .map(node -> Json.MAPPER.convertValue(node, SysModel.class))
            .orElse(SysModel.system(clock));
        next.set(MEMBERSHIP_ID, membershipId);
        next.set(SYS, Json.MAPPER.<JsonNode>valueToTree(priorSys.modified(utilizer, clock)));

        boolean replaced;
        try {
            replaced = collection().replace(id, next);
        } catch (DuplicateKeyException e) {
            throw uniquenessViolation(e, next);
        }
        if (!replaced) {
            throw policy.notFound(id);
        }
        next.set(DynamicDocument.ID, id);
        LOG.debugf("Updated %s %s in membership %s", policy.resource(), id, membershipId);

        DynamicDocument updated = hide(next);
        publish(IdentityEvent.of(eventType, utilizer, membershipId, clock)
            .subjectId(id)
            .document(updated.copy().node())
            .prior(hide(current).node())
            .build());
        return updated;
    }

    // ========================================================================
    // Delete
    // ========================================================================

    public boolean delete(Utilizer utilizer, String membershipId, String id) {
        checkCancelled();
        membershipService.require(membershipId);
        DynamicDocument current = findInMembership(membershipId, id).orElseThrow(() -> policy.notFound(id));
        policy.beforeDelete(utilizer, current);

        checkCancelled();
        if (!collection().delete(id)) {
            throw policy.notFound(id);
        }
        LOG.debugf("Deleted %s %s in membership %s", policy.resource(), id, membershipId);

        publish(IdentityEvent.of(policy.deletedEvent(), utilizer, membershipId, clock)
            .subjectId(id)
            .document(hide(current).node())
            .build());
        return true;
    }

    /**
     * Delete each id independently; an id that cannot be deleted (missing,
     * reserved) fails alone and the rest proceed.
     */
    public BulkDeleteResult bulkDelete(Utilizer utilizer, String membershipId, List<String> ids) {
        membershipService.require(membershipId);
        List<String> succeeded = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (String id : ids) {
            try {
                delete(utilizer, membershipId, id);
                succeeded.add(id);
            } catch (IdentityException e) {
                LOG.debugf("Bulk delete skipped %s %s: %s", policy.resource(), id, e.getMessage());
                failed.add(id);
            }
        }
        return BulkDeleteResult.of(succeeded, failed);
    }

    // ========================================================================
    // Internals
    // ========================================================================

    private Optional<DynamicDocument> findInMembership(String membershipId, String id) {
        if (id == null) {
            return Optional.empty();
        }
        return collection().findOne(scoped(membershipId, DocumentFilter.eq(DynamicDocument.ID, id)));
    }

    private static DocumentFilter scoped(String membershipId, DocumentFilter filter) {
        return DocumentFilter.and(DocumentFilter.eq(MEMBERSHIP_ID, membershipId), filter);
    }

    private DynamicDocument stripManaged(DynamicDocument payload) {
        DynamicDocument document = payload == null ? new DynamicDocument() : payload.copy();
        policy.managedFields().forEach(document::remove);
        return document;
    }

    private DynamicDocument hide(DynamicDocument document) {
        DynamicDocument visible = document.copy();
        policy.hiddenFields().forEach(visible::remove);
        return visible;
    }

    private void insert(DynamicDocument document) {
        try {
            collection().insert(document);
        } catch (DuplicateKeyException e) {
            throw uniquenessViolation(e, document);
        }
    }

    /**
     * Store-level duplicate key, reported exactly like the uniqueness pre-check.
     */
    private CumulativeValidationException uniquenessViolation(DuplicateKeyException e, DynamicDocument document) {
        LOG.debugf("Unique index rejected %s write in %s: %s", policy.resource(), e.collection(), e.getMessage());
        List<String> fields = e.fields().stream().filter(field -> !field.equals(MEMBERSHIP_ID)).toList();
        ValidationErrors errors = new ValidationErrors();
        if (fields.isEmpty()) {
            errors.add(FieldError.notUnique(DynamicDocument.ID, null));
        }
        for (String field : fields) {
            errors.add(FieldError.notUnique(field, document.getString(field)));
        }
        return errors.asException(policy.resource());
    }

    private void publish(IdentityEvent event) {
        eventEmitter.emit(event);
        for (MutationListener listener : listeners) {
            listener.afterMutation(event);
        }
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Operation cancelled before the write was issued");
        }
    }

    private DocumentCollection collection() {
        return store.collection(policy.collection());
    }
}
