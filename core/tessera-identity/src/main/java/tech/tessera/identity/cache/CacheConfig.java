package tech.tessera.identity.cache;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Configuration for the in-process caches.
 */
@ConfigMapping(prefix = "tessera.cache")
public interface CacheConfig {

    /**
     * Time-to-live of a membership's cached role list.
     */
    @WithDefault("5m")
    Duration rolesTtl();

    /**
     * Maximum number of entries per cache.
     */
    @WithDefault("10000")
    long maxSize();
}
