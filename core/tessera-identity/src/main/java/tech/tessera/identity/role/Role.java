package tech.tessera.identity.role;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import tech.tessera.identity.common.SysModel;

import java.util.List;
import java.util.Set;

/**
 * A named permission set within a membership.
 *
 * <p>Null fields are omitted when the role is turned into a document, so a
 * partially filled role can be used as an update payload.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Role(
    @JsonProperty("_id") String id,
    @JsonProperty("membership_id") String membershipId,
    @JsonProperty("name") String name,
    @JsonProperty("slug") String slug,
    @JsonProperty("description") String description,
    @JsonProperty("permissions") List<String> permissions,
    @JsonProperty("forbidden") List<String> forbidden,
    @JsonProperty("sys") SysModel sys
) {

    public static final String COLLECTION = "roles";

    public static final String ADMINISTRATOR = "administrator";
    public static final String SERVER = "server";

    /**
     * Slugs only a system utilizer may create, modify or delete.
     */
    public static final Set<String> RESERVED_SLUGS = Set.of(ADMINISTRATOR, SERVER);

    public static boolean isReservedSlug(String slug) {
        return slug != null && RESERVED_SLUGS.contains(slug);
    }
}
