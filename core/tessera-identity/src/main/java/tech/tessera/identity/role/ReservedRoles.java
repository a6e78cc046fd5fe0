package tech.tessera.identity.role;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.tessera.identity.authorization.ReservedResources;
import tech.tessera.identity.common.SysModel;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Synthesized roles that are never read from the store.
 *
 * <p>Built lazily once per membership and slug, never evicted.
 */
@ApplicationScoped
public class ReservedRoles {

    static final String SERVER_DESCRIPTION =
        "An on the fly role instance required for password set/reset etc operations";

    static final List<String> SERVER_PERMISSIONS = List.of(
        "*.users.reset-password.*",
        "*.users.set-password.*");

    private final ConcurrentMap<String, Role> roles = new ConcurrentHashMap<>();
    private final Clock clock;

    @Inject
    public ReservedRoles(Clock clock) {
        this.clock = clock;
    }

    /**
     * The synthesized role for a reserved slug, empty for any other slug.
     */
    public Optional<Role> find(String membershipId, String slug) {
        if (!Role.isReservedSlug(slug)) {
            return Optional.empty();
        }
        return Optional.of(roles.computeIfAbsent(membershipId + ":" + slug, key -> synthesize(membershipId, slug)));
    }

    private Role synthesize(String membershipId, String slug) {
        if (Role.SERVER.equals(slug)) {
            return new Role(Role.SERVER, membershipId, Role.SERVER, Role.SERVER, SERVER_DESCRIPTION,
                SERVER_PERMISSIONS, List.of(), SysModel.system(clock));
        }
        return administratorTemplate(membershipId).toBuilder()
            .id(Role.ADMINISTRATOR)
            .sys(SysModel.system(clock))
            .build();
    }

    /**
     * The administrator role as persisted by tenant bootstrap: full CRUD over
     * every reserved resource.
     */
    static Role administratorTemplate(String membershipId) {
        return Role.builder()
            .membershipId(membershipId)
            .name("Administrator")
            .slug(Role.ADMINISTRATOR)
            .description("Administrator")
            .permissions(ReservedResources.adminPermissions())
            .forbidden(List.of())
            .build();
    }
}
