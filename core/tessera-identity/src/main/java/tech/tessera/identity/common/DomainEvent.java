package tech.tessera.identity.common;

import java.time.Instant;

/**
 * Base interface for all domain events emitted by the identity core.
 *
 * <p>Domain events represent facts about what happened (past tense) and follow
 * the CloudEvents structure: id, type, spec version, source, subject, time.
 *
 * <p>Events should be implemented as Java records.
 */
public interface DomainEvent {

    /**
     * Unique identifier for this event (TSID Crockford Base32 string).
     */
    String eventId();

    /**
     * Event type code following the format: {app}:{domain}:{aggregate}:{action}
     * <p>Example: "tessera:identity:role:created"
     */
    String eventType();

    /**
     * Schema version of this event type (e.g., "1.0").
     */
    String specVersion();

    /**
     * Source system that generated this event.
     */
    String source();

    /**
     * Qualified aggregate identifier.
     * <p>Format: {domain}.{aggregate}.{id}
     */
    String subject();

    /**
     * When the event occurred.
     */
    Instant time();

    /**
     * Identity that initiated the action that produced this event.
     */
    String principalId();

    /**
     * Message group for ordering guarantees.
     * <p>Events of the same membership are delivered in order.
     */
    String messageGroup();

    /**
     * Serialize the event-specific data payload to JSON.
     */
    String toDataJson();
}
