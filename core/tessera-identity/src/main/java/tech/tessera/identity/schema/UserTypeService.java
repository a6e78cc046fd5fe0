package tech.tessera.identity.schema;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.tessera.identity.common.SysModel;
import tech.tessera.identity.common.Utilizer;
import tech.tessera.identity.common.errors.FieldError;
import tech.tessera.identity.common.errors.IdentityException;
import tech.tessera.identity.common.errors.ValidationErrors;
import tech.tessera.identity.document.DynamicDocument;
import tech.tessera.identity.event.EventEmitter;
import tech.tessera.identity.event.IdentityEvent;
import tech.tessera.identity.event.IdentityEventType;
import tech.tessera.identity.membership.MembershipService;
import tech.tessera.identity.shared.EntityType;
import tech.tessera.identity.shared.Slugs;
import tech.tessera.identity.shared.TsidGenerator;
import tech.tessera.identity.store.DocumentCollection;
import tech.tessera.identity.store.DocumentFilter;
import tech.tessera.identity.store.DocumentStore;
import tech.tessera.identity.store.DuplicateKeyException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of user types per membership.
 *
 * <p>Every membership implicitly has the origin type {@code base-user}; tenant
 * types may extend it (or each other) through {@code base_type}.
 */
@ApplicationScoped
public class UserTypeService {

    private static final Logger LOG = Logger.getLogger(UserTypeService.class);

    public static final String ORIGIN_TYPE = "base-user";

    private static final String RESOURCE = "user_type";

    private final DocumentStore store;
    private final MembershipService membershipService;
    private final EventEmitter eventEmitter;
    private final Clock clock;

    @Inject
    public UserTypeService(DocumentStore store, MembershipService membershipService, EventEmitter eventEmitter, Clock clock) {
        this.store = store;
        this.membershipService = membershipService;
        this.eventEmitter = eventEmitter;
        this.clock = clock;
        collection().ensureUniqueIndex(List.of("membership_id", "slug"));
    }

    /**
     * The built-in origin type of a membership.
     */
    public static UserType originType(String membershipId) {
        return new UserType(
            ORIGIN_TYPE,
            membershipId,
            "Base User",
            ORIGIN_TYPE,
            "Origin type every user type descends from",
            null,
            false,
            List.of(
                PropertyDefinition.plain("firstname", FieldType.STRING),
                PropertyDefinition.plain("lastname", FieldType.STRING),
                PropertyDefinition.unique("username", FieldType.STRING),
                PropertyDefinition.unique("email_address", FieldType.EMAIL),
                PropertyDefinition.plain("role", FieldType.STRING),
                PropertyDefinition.plain("permissions", FieldType.ARRAY),
                PropertyDefinition.plain("forbidden", FieldType.ARRAY),
                PropertyDefinition.plain("user_type", FieldType.STRING),
                PropertyDefinition.plain("sourceProvider", FieldType.STRING)
            ),
            List.of("username", "email_address", "role"),
            null);
    }

    public Optional<UserType> findByNameOrSlug(String membershipId, String nameOrSlug) {
        if (nameOrSlug == null) {
            return Optional.empty();
        }
        if (ORIGIN_TYPE.equals(nameOrSlug)) {
            return Optional.of(originType(membershipId));
        }
        return collection()
            .findOne(DocumentFilter.and(
                DocumentFilter.eq("membership_id", membershipId),
                DocumentFilter.or(
                    DocumentFilter.eq("slug", nameOrSlug),
                    DocumentFilter.eq("name", nameOrSlug))))
            .map(document -> document.toObject(UserType.class));
    }

    public UserType require(String membershipId, String nameOrSlug) {
        return findByNameOrSlug(membershipId, nameOrSlug)
            .orElseThrow(() -> IdentityException.userTypeNotFound(nameOrSlug));
    }

    /**
     * Whether {@code typeSlug} equals {@code ancestorSlug} or descends from it
     * through the {@code base_type} chain.
     */
    public boolean isInheritFrom(String membershipId, String typeSlug, String ancestorSlug) {
        Set<String> visited = new HashSet<>();
        String current = typeSlug;
        while (current != null && visited.add(current)) {
            if (current.equals(ancestorSlug)) {
                return true;
            }
            current = findByNameOrSlug(membershipId, current).map(UserType::baseType).orElse(null);
        }
        return false;
    }

    /**
     * Own properties plus inherited ones, a descendant's definition overriding its ancestor's.
     */
    public List<PropertyDefinition> effectiveProperties(String membershipId, UserType type) {
        Map<String, PropertyDefinition> byPath = new LinkedHashMap<>();
        for (UserType ancestor : lineage(membershipId, type)) {
            ancestor.properties().forEach(property -> byPath.put(property.path(), property));
        }
        return new ArrayList<>(byPath.values());
    }

    public List<String> effectiveRequiredFields(String membershipId, UserType type) {
        Set<String> required = new LinkedHashSet<>();
        for (UserType ancestor : lineage(membershipId, type)) {
            required.addAll(ancestor.requiredFields());
        }
        return new ArrayList<>(required);
    }

    public UserType create(Utilizer utilizer, String membershipId, UserType draft) {
        membershipService.require(membershipId);

        String slug = Slugs.slugify(draft.name());
        ValidationErrors errors = new ValidationErrors();
        if (draft.name() == null || draft.name().isBlank()) {
            errors.add(FieldError.required("name"));
        } else if (slug.isEmpty()) {
            errors.add(FieldError.unsluggableName("name", draft.name()));
        }
        boolean slugTaken = slug != null && !slug.isEmpty() && findByNameOrSlug(membershipId, slug).isPresent();
        if (ORIGIN_TYPE.equals(slug) || slugTaken) {
            errors.add(FieldError.notUnique("slug", slug));
        }
        if (draft.baseType() != null && findByNameOrSlug(membershipId, draft.baseType()).isEmpty()) {
            errors.add(FieldError.invalid("base_type", "USER_TYPE_NOT_FOUND",
                "base type '" + draft.baseType() + "' does not exist", draft.baseType()));
        }
        errors.throwIfAny(RESOURCE);

        UserType userType = draft.withIdentity(
            TsidGenerator.generate(EntityType.USER_TYPE), membershipId, slug, SysModel.created(utilizer, clock));
        try {
            collection().insert(DynamicDocument.fromObject(userType));
        } catch (DuplicateKeyException e) {
            throw new ValidationErrors().add(FieldError.notUnique("slug", slug)).asException(RESOURCE);
        }
        LOG.debugf("Created user type %s (%s) in membership %s", userType.id(), slug, membershipId);

        eventEmitter.emit(IdentityEvent.of(IdentityEventType.USER_TYPE_CREATED, utilizer, membershipId, clock)
            .subjectId(userType.id())
            .document(DynamicDocument.fromObject(userType).node())
            .build());
        return userType;
    }

    // Root first
    private List<UserType> lineage(String membershipId, UserType type) {
        List<UserType> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        UserType current = type;
        while (current != null && visited.add(current.slug())) {
            chain.add(0, current);
            current = current.baseType() == null ? null : findByNameOrSlug(membershipId, current.baseType()).orElse(null);
        }
        return chain;
    }

    private DocumentCollection collection() {
        return store.collection(UserType.COLLECTION);
    }
}
