package com.warden.security.policy;

/**
 * Port to an external policy engine.
 *
 * <p>Implementations never throw: transport failures, timeouts and non-success responses all
 * become deny decisions whose reason names the failure mode.
 */
public interface PolicyEngineClient {

    /**
     * @param policyPackage dotted policy package, e.g. {@code warden.authz}
     * @param input decision input
     */
    PolicyDecision evaluate(String policyPackage, PolicyInput input);
}
