package tech.tessera.identity.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import tech.tessera.identity.common.DomainEvent;
import tech.tessera.identity.common.Json;
import tech.tessera.identity.common.Utilizer;
import tech.tessera.identity.shared.EntityType;
import tech.tessera.identity.shared.TsidGenerator;

import java.time.Clock;
import java.time.Instant;

/**
 * Description of one identity mutation, produced synchronously after the write.
 *
 * <p>Event type: {@code tessera:identity:<aggregate>:<action>}
 */
@Builder
public record IdentityEvent(
    String eventId,
    Instant time,
    IdentityEventType type,
    String membershipId,
    String principalId,
    String subjectId,
    JsonNode document,
    JsonNode prior
) implements DomainEvent {

    private static final String SPEC_VERSION = "1.0";
    private static final String SOURCE = IdentityEventType.APP_DOMAIN;

    @Override
    @JsonIgnore
    public String eventType() {
        return type.code();
    }

    @Override
    @JsonIgnore
    public String specVersion() {
        return SPEC_VERSION;
    }

    @Override
    @JsonIgnore
    public String source() {
        return SOURCE;
    }

    @Override
    @JsonIgnore
    public String subject() {
        return "identity." + type.aggregate() + "." + subjectId;
    }

    @Override
    @JsonIgnore
    public String messageGroup() {
        return "tessera:membership:" + membershipId;
    }

    @Override
    @JsonIgnore
    public String toDataJson() {
        try {
            return Json.MAPPER.writeValueAsString(new Data(membershipId, principalId, document, prior));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize event data", e);
        }
    }

    public record Data(
        @JsonProperty("membership_id") String membershipId,
        @JsonProperty("utilizer_id") String utilizerId,
        @JsonProperty("document") JsonNode document,
        @JsonProperty("prior") JsonNode prior
    ) {}

    /**
     * Create a pre-configured builder with event metadata from the acting utilizer.
     */
    public static IdentityEventBuilder of(IdentityEventType type, Utilizer utilizer, String membershipId, Clock clock) {
        return IdentityEvent.builder()
            .eventId(TsidGenerator.generate(EntityType.EVENT))
            .time(clock.instant())
            .type(type)
            .membershipId(membershipId)
            .principalId(utilizer.id());
    }
}
