package tech.tessera.identity.membership;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.tessera.identity.common.Paging;
import tech.tessera.identity.common.SysModel;
import tech.tessera.identity.document.DynamicDocument;
import tech.tessera.identity.shared.EntityType;
import tech.tessera.identity.shared.TsidGenerator;
import tech.tessera.identity.store.DocumentCollection;
import tech.tessera.identity.store.DocumentFilter;
import tech.tessera.identity.store.DocumentStore;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Membership lookups backed by the {@code memberships} collection.
 */
@ApplicationScoped
public class StoreMembershipService implements MembershipService {

    private static final Logger LOG = Logger.getLogger(StoreMembershipService.class);

    private final DocumentStore store;
    private final Clock clock;

    @Inject
    public StoreMembershipService(DocumentStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public Optional<Membership> findById(String membershipId) {
        return collection()
            .findOne(DocumentFilter.eq(DynamicDocument.ID, membershipId))
            .map(document -> document.toObject(Membership.class));
    }

    @Override
    public List<Membership> findAll() {
        return collection().find(DocumentFilter.all(), Paging.all().withoutCount())
            .items().stream()
            .map(document -> document.toObject(Membership.class))
            .toList();
    }

    /**
     * Register a membership. Used by tenant provisioning and test fixtures.
     */
    public Membership register(String name, String secretKey, HashAlgorithm hashAlgorithm, String defaultLanguage) {
        Membership membership = new Membership(
            TsidGenerator.generate(EntityType.MEMBERSHIP),
            name,
            secretKey,
            hashAlgorithm,
            defaultLanguage,
            43200L,
            86400L,
            SysModel.system(clock));
        collection().insert(DynamicDocument.fromObject(membership));
        LOG.infof("Registered membership %s (%s)", membership.id(), name);
        return membership;
    }

    private DocumentCollection collection() {
        return store.collection(Membership.COLLECTION);
    }
}
