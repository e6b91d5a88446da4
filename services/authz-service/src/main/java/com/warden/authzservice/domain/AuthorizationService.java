package com.warden.authzservice.domain;

import com.warden.authzservice.config.PolicyProperties;
import com.warden.observability.MetricFactory;
import com.warden.security.WardenSecurityContext;
import com.warden.security.policy.PolicyDecision;
import com.warden.security.policy.PolicyEngineClient;
import com.warden.security.policy.PolicyInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Answers "may this session do this?" for callers that need a decision beyond a fixed capability.
 *
 * <p>With the policy engine enabled the engine decides and any failure denies. With it disabled the
 * action is checked locally as a capability against the session's snapshot.
 */
@Service
public class AuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationService.class);

    static final String LOCAL_ALLOW = "Allowed by capability";
    static final String LOCAL_DENY = "Insufficient permissions";
    static final String LOCAL_NO_ACTION = "Local evaluation requires an action";

    private final PolicyEngineClient engine;
    private final PolicyProperties properties;
    private final MetricFactory metrics;

    public AuthorizationService(PolicyEngineClient engine, PolicyProperties properties, MetricFactory metrics) {
        this.engine = engine;
        this.properties = properties;
        this.metrics = metrics;
    }

    public PolicyDecision authorize(
            WardenSecurityContext session, String action, String resource, String method, String path) {
        PolicyInput input = new PolicyInput(
                session.capabilities(), session.roles(), session.userId(), session.tenantId(),
                method, path, resource, action);

        PolicyDecision decision;
        if (properties.enabled()) {
            decision = engine.evaluate(properties.policyPackage(), input);
        } else {
            decision = localDecision(session, action);
            metrics.increment(MetricFactory.Names.POLICY_DECISIONS, "Policy decisions",
                    "outcome", decision.allow() ? "allow" : "deny");
        }
        if (!decision.allow()) {
            log.info("Denied {} on {} for {}@{}: {}",
                    action, resource, session.userId(), session.tenantId(), decision.reason());
        }
        return decision;
    }

    private static PolicyDecision localDecision(WardenSecurityContext session, String action) {
        if (action == null || action.isBlank()) {
            return PolicyDecision.deny(LOCAL_NO_ACTION);
        }
        return session.hasCapability(action) ? PolicyDecision.allow(LOCAL_ALLOW) : PolicyDecision.deny(LOCAL_DENY);
    }
}
