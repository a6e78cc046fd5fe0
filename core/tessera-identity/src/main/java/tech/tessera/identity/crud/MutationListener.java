package tech.tessera.identity.crud;

import tech.tessera.identity.event.IdentityEvent;

/**
 * Post-write hook of a document engine.
 *
 * <p>Listeners run synchronously, in registration order, after the write and the
 * event emission, and before the mutating call returns.
 */
@FunctionalInterface
public interface MutationListener {

    void afterMutation(IdentityEvent event);
}
