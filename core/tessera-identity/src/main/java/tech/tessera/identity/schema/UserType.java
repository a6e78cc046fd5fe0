package tech.tessera.identity.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import tech.tessera.identity.common.SysModel;

import java.util.List;

/**
 * Tenant-defined schema for user documents.
 *
 * @param baseType slug of the parent type, null for root types
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserType(
    @JsonProperty("_id") String id,
    @JsonProperty("membership_id") String membershipId,
    @JsonProperty("name") String name,
    @JsonProperty("slug") String slug,
    @JsonProperty("description") String description,
    @JsonProperty("base_type") String baseType,
    @JsonProperty("is_abstract") boolean isAbstract,
    @JsonProperty("properties") List<PropertyDefinition> properties,
    @JsonProperty("required_fields") List<String> requiredFields,
    @JsonProperty("sys") SysModel sys
) {

    public static final String COLLECTION = "user_types";

    /**
     * Field of a user document naming its user type slug.
     */
    public static final String TYPE_FIELD = "user_type";

    public UserType {
        properties = properties == null ? List.of() : List.copyOf(properties);
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
    }

    UserType withIdentity(String id, String membershipId, String slug, SysModel sys) {
        return new UserType(id, membershipId, name, slug, description, baseType, isAbstract, properties, requiredFields, sys);
    }
}
