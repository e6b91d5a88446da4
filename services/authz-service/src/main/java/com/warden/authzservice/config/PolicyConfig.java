package com.warden.authzservice.config;

import com.warden.authzservice.infrastructure.policy.RestClientPolicyEngineClient;
import com.warden.observability.ComponentHealth;
import com.warden.observability.HealthCheckRegistry;
import com.warden.observability.MetricFactory;
import com.warden.observability.SpanHelper;
import java.util.concurrent.CompletableFuture;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Policy engine client with connect and read timeouts bounded by {@code warden.policy.timeout}.
 */
@Configuration
public class PolicyConfig {

    @Bean
    public RestClientPolicyEngineClient policyEngineClient(
            PolicyProperties policy, RestClient.Builder builder, SpanHelper spans, MetricFactory metrics) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) policy.timeout().toMillis());
        requestFactory.setReadTimeout((int) policy.timeout().toMillis());
        RestClient restClient = builder.baseUrl(policy.url()).requestFactory(requestFactory).build();
        return new RestClientPolicyEngineClient(restClient, spans, metrics);
    }

    /** Adds the engine probe, reporting a disabled engine as healthy. */
    @Bean
    public InitializingBean policyEngineHealthRegistration(
            HealthCheckRegistry registry, RestClientPolicyEngineClient client, PolicyProperties policy) {
        return () -> registry.register("policy-engine", () -> policy.enabled()
                ? client.health()
                : CompletableFuture.completedFuture(ComponentHealth.healthy("policy-engine", 0)));
    }
}
