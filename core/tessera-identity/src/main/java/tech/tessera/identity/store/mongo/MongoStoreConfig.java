package tech.tessera.identity.store.mongo;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for the MongoDB-backed document store.
 */
@ConfigMapping(prefix = "tessera.store.mongo")
public interface MongoStoreConfig {

    /**
     * Database holding the identity collections.
     */
    @WithDefault("tessera")
    String database();
}
