package tech.tessera.identity.store;

/**
 * Persistence seam of the identity core.
 *
 * <p>{@link InMemoryDocumentStore} is the default bean; {@code MongoDocumentStore}
 * is selected as an alternative in deployments backed by MongoDB.
 */
public interface DocumentStore {

    DocumentCollection collection(String name);
}
