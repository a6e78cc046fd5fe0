package tech.tessera.identity.membership;

import tech.tessera.identity.common.errors.IdentityException;

import java.util.List;
import java.util.Optional;

/**
 * Read access to memberships. Membership administration lives outside the core.
 */
public interface MembershipService {

    Optional<Membership> findById(String membershipId);

    List<Membership> findAll();

    /**
     * Resolve a membership or fail with MEMBERSHIP_NOT_FOUND.
     */
    default Membership require(String membershipId) {
        if (membershipId == null || membershipId.isBlank()) {
            throw IdentityException.membershipNotFound(membershipId);
        }
        return findById(membershipId).orElseThrow(() -> IdentityException.membershipNotFound(membershipId));
    }
}
