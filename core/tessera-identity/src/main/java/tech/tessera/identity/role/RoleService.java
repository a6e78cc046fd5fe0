package tech.tessera.identity.role;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.tessera.identity.common.BulkDeleteResult;
import tech.tessera.identity.common.PagedResult;
import tech.tessera.identity.common.Paging;
import tech.tessera.identity.common.Utilizer;
import tech.tessera.identity.crud.MembershipDocumentEngine;
import tech.tessera.identity.document.DynamicDocument;
import tech.tessera.identity.event.EventEmitter;
import tech.tessera.identity.membership.MembershipService;
import tech.tessera.identity.store.DocumentFilter;
import tech.tessera.identity.store.DocumentStore;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Role management with a per-membership read-through cache.
 *
 * <p>Reads resolve the reserved slugs first, then the cache, then the store;
 * a store fallback does not populate the cache. Every create, update and delete
 * rebuilds the membership's cache entry before returning, so a caller always
 * reads its own writes.
 */
@ApplicationScoped
public class RoleService {

    private static final Logger LOG = Logger.getLogger(RoleService.class);

    private final DocumentStore store;
    private final MembershipService membershipService;
    private final RoleCache cache;
    private final ReservedRoles reservedRoles;
    private final MembershipDocumentEngine engine;

    @Inject
    public RoleService(
            DocumentStore store,
            MembershipService membershipService,
            EventEmitter eventEmitter,
            RoleCache cache,
            ReservedRoles reservedRoles,
            Clock clock) {
        this.store = store;
        this.membershipService = membershipService;
        this.cache = cache;
        this.reservedRoles = reservedRoles;
        this.engine = new MembershipDocumentEngine(
            store,
            membershipService,
            new RolePolicy(store),
            eventEmitter,
            List.of(event -> refreshCache(event.membershipId())),
            clock);
    }

    // ========================================================================
    // Reads
    // ========================================================================

    public Optional<Role> getById(String membershipId, String id) {
        return lookup(membershipId, id, Role::id, DynamicDocument.ID);
    }

    public Optional<Role> getBySlug(String membershipId, String slug) {
        return lookup(membershipId, slug, Role::slug, RolePolicy.SLUG);
    }

    public PagedResult<Role> list(String membershipId, Paging paging) {
        return engine.list(membershipId, paging).map(RoleService::toRole);
    }

    /**
     * Mongo-style JSON filter within the membership. Projected documents may
     * lack role fields, so results stay dynamic.
     */
    public PagedResult<DynamicDocument> query(String membershipId, String jsonQuery, Paging paging,
                                              Map<String, Boolean> selectFields) {
        return engine.query(membershipId, jsonQuery, paging, selectFields);
    }

    public PagedResult<Role> search(String membershipId, String keyword, Paging paging) {
        return engine.search(membershipId, keyword, paging).map(RoleService::toRole);
    }

    private Optional<Role> lookup(String membershipId, String key, Function<Role, String> keyOf, String field) {
        membershipService.require(membershipId);
        Optional<Role> reserved = reservedRoles.find(membershipId, key);
        if (reserved.isPresent()) {
            return reserved;
        }

        Optional<List<Role>> cached = cache.get(membershipId);
        if (cached.isPresent()) {
            LOG.debugf("Role cache hit for membership %s", membershipId);
            return cached.get().stream().filter(role -> Objects.equals(keyOf.apply(role), key)).findFirst();
        }

        LOG.debugf("Role cache miss for membership %s, reading %s from the store", membershipId, key);
        return findStored(membershipId, DocumentFilter.eq(field, key));
    }

    // ========================================================================
    // Mutations
    // ========================================================================

    public Role create(Utilizer utilizer, String membershipId, Role role) {
        return toRole(engine.create(utilizer, membershipId, DynamicDocument.fromObject(role)));
    }

    /**
     * Partial update: null fields of {@code changes} keep their current values.
     */
    public Role update(Utilizer utilizer, String membershipId, String id, Role changes) {
        return toRole(engine.update(utilizer, membershipId, id, DynamicDocument.fromObject(changes)));
    }

    public boolean delete(Utilizer utilizer, String membershipId, String id) {
        return engine.delete(utilizer, membershipId, id);
    }

    public BulkDeleteResult bulkDelete(Utilizer utilizer, String membershipId, List<String> ids) {
        return engine.bulkDelete(utilizer, membershipId, ids);
    }

    /**
     * Replace the membership's cached role list with the store's current one.
     */
    public void refreshCache(String membershipId) {
        List<Role> roles = store.collection(Role.COLLECTION)
            .find(DocumentFilter.eq(MembershipDocumentEngine.MEMBERSHIP_ID, membershipId), Paging.all().withoutCount())
            .items().stream()
            .map(RoleService::toRole)
            .toList();
        cache.replace(membershipId, roles);
        LOG.debugf("Refreshed role cache for membership %s (%d roles)", membershipId, roles.size());
    }

    // ========================================================================
    // Bootstrap
    // ========================================================================

    /**
     * Persist the default administrator role unless the membership already stores one.
     *
     * @return true when the role was created
     */
    public boolean ensureAdministratorRole(String membershipId) {
        if (findStored(membershipId, DocumentFilter.eq(RolePolicy.SLUG, Role.ADMINISTRATOR)).isPresent()) {
            return false;
        }
        Role created = create(Utilizer.system(membershipId), membershipId, ReservedRoles.administratorTemplate(membershipId));
        LOG.infof("Created administrator role %s for membership %s", created.id(), membershipId);
        return true;
    }

    private Optional<Role> findStored(String membershipId, DocumentFilter filter) {
        return engine.findOneWithHiddenFields(membershipId, filter).map(RoleService::toRole);
    }

    private static Role toRole(DynamicDocument document) {
        return document.toObject(Role.class);
    }
}
