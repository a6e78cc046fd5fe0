package tech.tessera.identity.role;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import tech.tessera.identity.cache.CacheConfig;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Per-membership role list cache using Caffeine.
 *
 * <p>Single-node only. An entry is always the complete role list of one
 * membership; writers swap the whole list, readers never see a partial one.
 */
@Singleton
public class RoleCache {

    private final Cache<String, List<Role>> cache;

    @Inject
    public RoleCache(CacheConfig config) {
        this(config.rolesTtl(), config.maxSize());
    }

    public RoleCache(Duration ttl, long maxSize) {
        this.cache = Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .maximumSize(maxSize)
            .build();
    }

    static String key(String membershipId) {
        return "roles." + membershipId + ".roles";
    }

    public Optional<List<Role>> get(String membershipId) {
        return Optional.ofNullable(cache.getIfPresent(key(membershipId)));
    }

    /**
     * Remove the membership's entry, then place the fresh list with a new TTL.
     */
    public void replace(String membershipId, List<Role> roles) {
        String key = key(membershipId);
        cache.invalidate(key);
        cache.put(key, List.copyOf(roles));
    }
}
