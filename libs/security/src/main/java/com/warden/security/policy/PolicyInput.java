package com.warden.security.policy;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Set;

/**
 * Document submitted to the external policy engine.
 *
 * <p>Serialized as the {@code input} member of the engine's request body, so field names follow
 * the engine's snake_case convention.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PolicyInput(
        @JsonProperty("capabilities") Set<String> capabilities,
        @JsonProperty("roles") List<String> roles,
        @JsonProperty("user_id") String userId,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("method") String method,
        @JsonProperty("path") String path,
        @JsonProperty("resource") String resource,
        @JsonProperty("action") String action) {

    public PolicyInput {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        roles = roles == null ? List.of() : List.copyOf(roles);
    }
}
