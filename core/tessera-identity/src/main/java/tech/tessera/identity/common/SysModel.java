package tech.tessera.identity.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.time.Instant;

/**
 * Audit stamp attached to every persisted entity under the {@code sys} key.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SysModel(
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("created_by") String createdBy,
    @JsonProperty("modified_at") Instant modifiedAt,
    @JsonProperty("modified_by") String modifiedBy
) {

    public static final String FIELD = "sys";

    public static SysModel created(Utilizer utilizer, Clock clock) {
        return new SysModel(clock.instant(), utilizer.displayName(), null, null);
    }

    public static SysModel system(Clock clock) {
        return new SysModel(clock.instant(), Utilizer.SYSTEM_NAME, null, null);
    }

    public SysModel modified(Utilizer utilizer, Clock clock) {
        return new SysModel(createdAt, createdBy, clock.instant(), utilizer.displayName());
    }
}
