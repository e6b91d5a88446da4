package com.warden.security.policy;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Policy contract types")
class PolicyDecisionTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    @DisplayName("deny carries a reason and an evaluation time")
    void deny() {
        PolicyDecision decision = PolicyDecision.deny("Policy evaluation timeout");
        assertThat(decision.allow()).isFalse();
        assertThat(decision.reason()).isEqualTo("Policy evaluation timeout");
        assertThat(decision.evaluatedAt()).isNotNull();
    }

    @Test
    @DisplayName("request input serializes with snake_case names and omits unused members")
    void inputJson() throws Exception {
        PolicyInput input = new PolicyInput(
                Set.of("app:read"), List.of("user"), "u1", "t1", "GET", "/api/v1/reports", null, null);

        var json = mapper.readTree(mapper.writeValueAsString(input));

        assertThat(json.get("user_id").asText()).isEqualTo("u1");
        assertThat(json.get("tenant_id").asText()).isEqualTo("t1");
        assertThat(json.get("method").asText()).isEqualTo("GET");
        assertThat(json.has("resource")).isFalse();
    }

    @Test
    @DisplayName("decision parses from engine result JSON")
    void decisionJson() throws Exception {
        PolicyDecision decision = mapper.readValue(
                "{\"allow\":true,\"policy_version\":\"v7\"}", PolicyDecision.class);
        assertThat(decision.allow()).isTrue();
        assertThat(decision.policyVersion()).isEqualTo("v7");
        assertThat(decision.evaluatedAt()).isNotNull();
    }
}
