package com.warden.authzservice.api;

import com.warden.authzservice.api.dto.AuthorizeRequest;
import com.warden.authzservice.domain.AuthorizationService;
import com.warden.authzservice.infrastructure.web.AuthenticatedSession;
import com.warden.security.policy.PolicyDecision;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Decision endpoint for the calling session. A deny is a normal 200 answer with
 * {@code allow=false}; only a missing session is an error.
 */
@RestController
@RequestMapping("/api/v1/authorize")
public class AuthorizationController {

    private final AuthorizationService authorization;

    public AuthorizationController(AuthorizationService authorization) {
        this.authorization = authorization;
    }

    @PostMapping
    public PolicyDecision authorize(@RequestBody AuthorizeRequest body, HttpServletRequest request) {
        return authorization.authorize(
                AuthenticatedSession.require(request), body.action(), body.resource(), body.method(), body.path());
    }
}
