package tech.tessera.identity.event;

/**
 * Sink for identity events. Delivery (webhooks, mail, outbox) happens behind it.
 */
public interface EventEmitter {

    void emit(IdentityEvent event);
}
