package com.warden.security.policy;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Outcome of a policy evaluation.
 *
 * @param allow whether the action is permitted
 * @param reason why the action was denied, or null when allowed without comment
 * @param policyVersion version of the policy bundle that decided, when the engine reports one
 * @param evaluatedAt when the decision was made
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PolicyDecision(
        @JsonProperty("allow") boolean allow,
        @JsonProperty("reason") String reason,
        @JsonProperty("policy_version") String policyVersion,
        @JsonProperty("evaluated_at") Instant evaluatedAt) {

    public PolicyDecision {
        evaluatedAt = evaluatedAt == null ? Instant.now() : evaluatedAt;
    }

    public static PolicyDecision allow(String reason) {
        return new PolicyDecision(true, reason, null, null);
    }

    public static PolicyDecision deny(String reason) {
        return new PolicyDecision(false, reason, null, null);
    }
}
