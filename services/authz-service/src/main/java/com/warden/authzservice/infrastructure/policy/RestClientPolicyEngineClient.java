package com.warden.authzservice.infrastructure.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.warden.observability.ComponentHealth;
import com.warden.observability.MetricFactory;
import com.warden.observability.SpanHelper;
import com.warden.security.policy.PolicyDecision;
import com.warden.security.policy.PolicyEngineClient;
import com.warden.security.policy.PolicyInput;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.SpanKind;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * HTTP client for an OPA-style policy engine.
 *
 * <p>Posts {@code {"input": ...}} to {@code /v1/data/<package path>} and reads {@code result},
 * which is either a boolean or an object with {@code allow}, {@code reason} and
 * {@code policy_version}. Every failure becomes a deny:
 *
 * <ul>
 *   <li>non-2xx: "Policy evaluation failed with status N"
 *   <li>timeout: "Policy evaluation timeout"
 *   <li>anything else: "Policy evaluation error: &lt;type&gt;"
 * </ul>
 */
public class RestClientPolicyEngineClient implements PolicyEngineClient {

    private static final Logger log = LoggerFactory.getLogger(RestClientPolicyEngineClient.class);

    static final String TIMEOUT_REASON = "Policy evaluation timeout";

    private final RestClient restClient;
    private final SpanHelper spans;
    private final MetricFactory metrics;

    public RestClientPolicyEngineClient(RestClient restClient, SpanHelper spans, MetricFactory metrics) {
        this.restClient = restClient;
        this.spans = spans;
        this.metrics = metrics;
    }

    @Override
    public PolicyDecision evaluate(String policyPackage, PolicyInput input) {
        String path = "/v1/data/" + policyPackage.replace('.', '/');
        Timer.Sample sample = Timer.start(metrics.registry());
        PolicyDecision decision = spans.inSpan("policy.evaluate", SpanKind.CLIENT,
                Map.of("policy.package", policyPackage), () -> call(path, input));
        sample.stop(metrics.timer(MetricFactory.Names.POLICY_LATENCY, "Policy engine evaluation latency"));
        metrics.increment(MetricFactory.Names.POLICY_DECISIONS, "Policy engine decisions",
                "outcome", decision.allow() ? "allow" : "deny");
        return decision;
    }

    private PolicyDecision call(String path, PolicyInput input) {
        try {
            JsonNode body = restClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("input", input))
                    .retrieve()
                    .body(JsonNode.class);
            return parse(body);
        } catch (RestClientResponseException e) {
            log.warn("Policy engine answered {} for {}", e.getStatusCode().value(), path);
            return PolicyDecision.deny("Policy evaluation failed with status " + e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            if (isTimeout(e)) {
                log.warn("Policy engine timed out for {}", path);
                return PolicyDecision.deny(TIMEOUT_REASON);
            }
            log.warn("Policy engine unreachable for {}: {}", path, e.getMessage());
            return PolicyDecision.deny("Policy evaluation error: " + rootCause(e).getClass().getSimpleName());
        } catch (RestClientException e) {
            log.warn("Policy engine call failed for {}: {}", path, e.getMessage());
            return PolicyDecision.deny("Policy evaluation error: " + e.getClass().getSimpleName());
        }
    }

    static PolicyDecision parse(JsonNode body) {
        JsonNode result = body == null ? null : body.get("result");
        if (result == null || result.isNull()) {
            return PolicyDecision.deny("Policy evaluation returned no result");
        }
        if (result.isBoolean()) {
            return result.booleanValue() ? PolicyDecision.allow(null) : PolicyDecision.deny("Denied by policy");
        }
        boolean allow = result.path("allow").asBoolean(false);
        String reason = result.hasNonNull("reason") ? result.get("reason").asText() : null;
        String version = result.hasNonNull("policy_version") ? result.get("policy_version").asText() : null;
        if (!allow && reason == null) {
            reason = "Denied by policy";
        }
        return new PolicyDecision(allow, reason, version, null);
    }

    /** Probe for the component health registry; calls the engine's {@code /health} endpoint. */
    public CompletableFuture<ComponentHealth> health() {
        return CompletableFuture.supplyAsync(() -> {
            long start = System.nanoTime();
            try {
                restClient.get().uri("/health").retrieve().toBodilessEntity();
                return ComponentHealth.healthy("policy-engine", elapsedMs(start));
            } catch (RestClientException e) {
                return ComponentHealth.unhealthy("policy-engine", e.getMessage(), elapsedMs(start));
            }
        });
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static Throwable rootCause(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root;
    }
}
