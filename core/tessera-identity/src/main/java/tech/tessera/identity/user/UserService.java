package tech.tessera.identity.user;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.tessera.identity.common.BulkDeleteResult;
import tech.tessera.identity.common.PagedResult;
import tech.tessera.identity.common.Paging;
import tech.tessera.identity.common.Utilizer;
import tech.tessera.identity.credential.PasswordService;
import tech.tessera.identity.crud.MembershipDocumentEngine;
import tech.tessera.identity.document.DynamicDocument;
import tech.tessera.identity.event.EventEmitter;
import tech.tessera.identity.event.IdentityEventType;
import tech.tessera.identity.membership.Membership;
import tech.tessera.identity.membership.MembershipService;
import tech.tessera.identity.role.RoleService;
import tech.tessera.identity.schema.SchemaValidator;
import tech.tessera.identity.schema.UserTypeService;
import tech.tessera.identity.store.DocumentFilter;
import tech.tessera.identity.store.DocumentStore;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Users of a membership: schema-validated dynamic documents.
 *
 * <p>{@code password_hash} never leaves this service through a public read or
 * mutation result. The {@code *WithPassword} lookups exist for the credential
 * flows only.
 */
@ApplicationScoped
public class UserService {

    private final MembershipService membershipService;
    private final PasswordService passwordService;
    private final MembershipDocumentEngine engine;

    @Inject
    public UserService(
            DocumentStore store,
            MembershipService membershipService,
            SchemaValidator schemaValidator,
            UserTypeService userTypeService,
            RoleService roleService,
            PasswordService passwordService,
            EventEmitter eventEmitter,
            Clock clock) {
        this.membershipService = membershipService;
        this.passwordService = passwordService;
        this.engine = new MembershipDocumentEngine(
            store,
            membershipService,
            new UserPolicy(schemaValidator, userTypeService, roleService),
            eventEmitter,
            List.of(),
            clock);
    }

    // ========================================================================
    // Reads
    // ========================================================================

    public Optional<DynamicDocument> get(String membershipId, String id) {
        return engine.get(membershipId, id);
    }

    public PagedResult<DynamicDocument> list(String membershipId, Paging paging) {
        return engine.list(membershipId, paging);
    }

    public PagedResult<DynamicDocument> query(String membershipId, String jsonQuery, Paging paging,
                                              Map<String, Boolean> selectFields) {
        return engine.query(membershipId, jsonQuery, paging, selectFields);
    }

    public PagedResult<DynamicDocument> query(String membershipId, DocumentFilter filter, Paging paging,
                                              Map<String, Boolean> selectFields) {
        return engine.query(membershipId, filter, paging, selectFields);
    }

    public PagedResult<DynamicDocument> search(String membershipId, String keyword, Paging paging) {
        return engine.search(membershipId, keyword, paging);
    }

    /**
     * User by id including {@code password_hash}.
     */
    public Optional<DynamicDocument> getUserWithPassword(String membershipId, String id) {
        membershipService.require(membershipId);
        return engine.findOneWithHiddenFields(membershipId, DocumentFilter.eq(DynamicDocument.ID, id));
    }

    /**
     * User whose username or email address equals {@code usernameOrEmail},
     * including {@code password_hash}. Empty for a missing identifier.
     */
    public Optional<DynamicDocument> getUserWithPasswordByIdentifier(String membershipId, String usernameOrEmail) {
        membershipService.require(membershipId);
        // a null value would match users that have neither field
        if (usernameOrEmail == null || usernameOrEmail.isBlank()) {
            return Optional.empty();
        }
        return engine.findOneWithHiddenFields(membershipId, DocumentFilter.or(
            DocumentFilter.eq(UserFields.USERNAME, usernameOrEmail),
            DocumentFilter.eq(UserFields.EMAIL_ADDRESS, usernameOrEmail)));
    }

    // ========================================================================
    // Mutations
    // ========================================================================

    /**
     * Create a user. Locally sourced users must supply {@code password}, which is
     * checked against the password policy and stored only as a hash.
     */
    public DynamicDocument create(Utilizer utilizer, String membershipId, DynamicDocument payload) {
        Membership membership = membershipService.require(membershipId);
        if (!UserPolicy.sourceProvider(payload.copy()).isLocal()) {
            return engine.create(utilizer, membershipId, payload);
        }
        String password = passwordService.ensurePassword(payload.getString(UserFields.PASSWORD));
        String passwordHash = passwordService.hash(membership, password);
        return engine.create(utilizer, membershipId, payload,
            document -> document.set(UserFields.PASSWORD_HASH, passwordHash));
    }

    /**
     * Partial update. Password fields in the payload are ignored; use the
     * credential service to change a password.
     */
    public DynamicDocument update(Utilizer utilizer, String membershipId, String id, DynamicDocument payload) {
        return engine.update(utilizer, membershipId, id, payload);
    }

    public boolean delete(Utilizer utilizer, String membershipId, String id) {
        return engine.delete(utilizer, membershipId, id);
    }

    public BulkDeleteResult bulkDelete(Utilizer utilizer, String membershipId, List<String> ids) {
        return engine.bulkDelete(utilizer, membershipId, ids);
    }

    /**
     * Store a new password hash, bypassing payload stripping and schema validation.
     *
     * @return the updated user without {@code password_hash}
     */
    public DynamicDocument replacePasswordHash(Utilizer utilizer, String membershipId, String id, String passwordHash) {
        return engine.updateManaged(utilizer, membershipId, id,
            document -> document.set(UserFields.PASSWORD_HASH, passwordHash),
            IdentityEventType.USER_PASSWORD_CHANGED);
    }
}
