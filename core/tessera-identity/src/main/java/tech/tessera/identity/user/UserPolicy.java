package tech.tessera.identity.user;

import org.jboss.logging.Logger;
import tech.tessera.identity.common.Utilizer;
import tech.tessera.identity.common.errors.FieldError;
import tech.tessera.identity.common.errors.IdentityException;
import tech.tessera.identity.common.errors.ValidationErrors;
import tech.tessera.identity.crud.DocumentPolicy;
import tech.tessera.identity.crud.MembershipDocumentEngine;
import tech.tessera.identity.document.DynamicDocument;
import tech.tessera.identity.event.IdentityEventType;
import tech.tessera.identity.membership.Membership;
import tech.tessera.identity.role.RoleService;
import tech.tessera.identity.schema.SchemaValidator;
import tech.tessera.identity.schema.UserType;
import tech.tessera.identity.schema.UserTypeService;
import tech.tessera.identity.schema.ValidationContext;
import tech.tessera.identity.shared.EntityType;

import java.util.List;
import java.util.Optional;

/**
 * User rules: schema validation against the user's type, an existing role, and
 * the password fields owned by the credential flows.
 */
class UserPolicy implements DocumentPolicy {

    private static final Logger LOG = Logger.getLogger(UserPolicy.class);

    static final String RESOURCE = "user";

    private final SchemaValidator schemaValidator;
    private final UserTypeService userTypeService;
    private final RoleService roleService;

    UserPolicy(SchemaValidator schemaValidator, UserTypeService userTypeService, RoleService roleService) {
        this.schemaValidator = schemaValidator;
        this.userTypeService = userTypeService;
        this.roleService = roleService;
    }

    @Override
    public String resource() {
        return RESOURCE;
    }

    @Override
    public String collection() {
        return UserFields.COLLECTION;
    }

    @Override
    public EntityType entityType() {
        return EntityType.USER;
    }

    @Override
    public IdentityEventType createdEvent() {
        return IdentityEventType.USER_CREATED;
    }

    @Override
    public IdentityEventType updatedEvent() {
        return IdentityEventType.USER_UPDATED;
    }

    @Override
    public IdentityEventType deletedEvent() {
        return IdentityEventType.USER_DELETED;
    }

    @Override
    public List<String> managedFields() {
        return List.of(
            DynamicDocument.ID,
            UserFields.PASSWORD,
            UserFields.PASSWORD_HASH,
            MembershipDocumentEngine.MEMBERSHIP_ID,
            MembershipDocumentEngine.SYS);
    }

    @Override
    public List<String> hiddenFields() {
        return List.of(UserFields.PASSWORD_HASH);
    }

    @Override
    public List<List<String>> uniqueIndexes() {
        return List.of(
            List.of(MembershipDocumentEngine.MEMBERSHIP_ID, UserFields.USERNAME),
            List.of(MembershipDocumentEngine.MEMBERSHIP_ID, UserFields.EMAIL_ADDRESS));
    }

    @Override
    public void beforeCreate(Utilizer utilizer, Membership membership, DynamicDocument document) {
        SourceProvider provider = sourceProvider(document);
        if (document.getString(UserFields.USER_TYPE) == null) {
            if (!provider.isLocal()) {
                throw IdentityException.userTypeRequired();
            }
            document.set(UserFields.USER_TYPE, UserTypeService.ORIGIN_TYPE);
        }
    }

    @Override
    public void beforeUpdate(Utilizer utilizer, Membership membership, DynamicDocument merged,
                             DynamicDocument current, DynamicDocument partial) {
        sourceProvider(merged);
        if (merged.getString(UserFields.USER_TYPE) == null) {
            merged.set(UserFields.USER_TYPE, UserTypeService.ORIGIN_TYPE);
        }
    }

    @Override
    public void validate(Utilizer utilizer, DynamicDocument document, ValidationContext context, ValidationErrors errors) {
        String typeSlug = document.getString(UserFields.USER_TYPE);
        Optional<UserType> type = userTypeService.findByNameOrSlug(context.membershipId(), typeSlug);
        if (type.isPresent()) {
            schemaValidator.validate(document, type.get(), context, errors);
        } else {
            errors.add(FieldError.invalid(UserFields.USER_TYPE, "USER_TYPE_NOT_FOUND",
                "user type '" + typeSlug + "' does not exist", typeSlug));
        }

        String role = document.getString(UserFields.ROLE);
        if (role != null && !role.isBlank() && roleService.getBySlug(context.membershipId(), role).isEmpty()) {
            errors.add(FieldError.invalid(UserFields.ROLE, "ROLE_NOT_FOUND",
                "role '" + role + "' does not exist", role));
        }
    }

    @Override
    public IdentityException notFound(String id) {
        return IdentityException.userNotFound(id);
    }

    /**
     * Provider of the document. A malformed tag is replaced by the default.
     */
    static SourceProvider sourceProvider(DynamicDocument document) {
        String tag = document.getString(UserFields.SOURCE_PROVIDER);
        try {
            return SourceProvider.parse(tag);
        } catch (IllegalArgumentException e) {
            LOG.warnf("Unknown source provider '%s', falling back to %s", tag, SourceProvider.DEFAULT);
            document.set(UserFields.SOURCE_PROVIDER, SourceProvider.DEFAULT.name());
            return SourceProvider.DEFAULT;
        }
    }
}
