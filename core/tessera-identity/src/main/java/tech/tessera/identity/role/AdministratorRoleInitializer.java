package tech.tessera.identity.role;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.tessera.identity.membership.Membership;
import tech.tessera.identity.membership.MembershipService;

/**
 * Makes sure every membership has a stored administrator role at startup.
 */
@ApplicationScoped
public class AdministratorRoleInitializer {

    private static final Logger LOG = Logger.getLogger(AdministratorRoleInitializer.class);

    private final MembershipService membershipService;
    private final RoleService roleService;

    @Inject
    public AdministratorRoleInitializer(MembershipService membershipService, RoleService roleService) {
        this.membershipService = membershipService;
        this.roleService = roleService;
    }

    void onStart(@Observes StartupEvent event) {
        LOG.info("Ensuring administrator roles...");
        int created = initialize();
        LOG.infof("Administrator role check complete, %d created", created);
    }

    /**
     * @return number of memberships that received a new administrator role
     */
    public int initialize() {
        int created = 0;
        for (Membership membership : membershipService.findAll()) {
            if (roleService.ensureAdministratorRole(membership.id())) {
                created++;
            }
        }
        return created;
    }
}
