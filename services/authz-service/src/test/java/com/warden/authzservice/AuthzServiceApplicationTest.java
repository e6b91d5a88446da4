package com.warden.authzservice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.warden.authzservice.config.ServiceProperties;
import com.warden.authzservice.infrastructure.scheduling.ScopeReconciliationJob;
import com.warden.security.CapabilityCatalog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Authorization service application")
class AuthzServiceApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;

    @Test
    @DisplayName("loads the context with the role catalog from the classpath")
    void contextLoads() {
        CapabilityCatalog catalog = context.getBean(CapabilityCatalog.class);
        assertThat(catalog.roleNames()).containsSubsequence("viewer", "user", "power_user", "admin");
    }

    @Test
    @DisplayName("binds service properties from the test profile")
    void servicePropertiesAreLoaded() {
        var props = context.getBean(ServiceProperties.class);
        assertThat(props.name()).isEqualTo("authz-service-test");
        assertThat(props.environment()).isEqualTo("test");
    }

    @Test
    @DisplayName("does not schedule the sweep when polling is disabled")
    void sweepDisabled() {
        assertThat(context.getBeanNamesForType(ScopeReconciliationJob.class)).isEmpty();
    }

    @Test
    @DisplayName("serves the info endpoint without a token")
    void serviceInfo() throws Exception {
        mockMvc.perform(get("/api/v1/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("authz-service-test"))
                .andExpect(jsonPath("$.policy_engine").value("disabled"))
                .andExpect(jsonPath("$.status").value("running"));
    }

    @Test
    @DisplayName("reports component health")
    void componentHealth() throws Exception {
        mockMvc.perform(get("/api/v1/health/components"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("HEALTHY"))
                .andExpect(jsonPath("$.checks['scope-store'].status").value("HEALTHY"))
                .andExpect(jsonPath("$.checks['policy-engine'].status").value("HEALTHY"));
    }

    @Test
    @DisplayName("exposes actuator health")
    void actuatorHealth() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }

    @Test
    @DisplayName("echoes the correlation ID header")
    void correlationHeader() throws Exception {
        mockMvc.perform(get("/api/v1/info").header("X-Correlation-ID", "cid-app-test"))
                .andExpect(header().string("X-Correlation-ID", "cid-app-test"));
    }
}
