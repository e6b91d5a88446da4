package com.warden.authzservice.api;

import com.warden.authzservice.api.dto.AssignRoleRequest;
import com.warden.authzservice.api.dto.AssignmentResponse;
import com.warden.authzservice.api.dto.CheckCapabilityRequest;
import com.warden.authzservice.api.dto.CheckCapabilityResponse;
import com.warden.authzservice.api.dto.MembershipResponse;
import com.warden.authzservice.api.dto.ScopeVersionResponse;
import com.warden.authzservice.domain.MembershipService;
import com.warden.authzservice.infrastructure.web.AuthenticatedSession;
import com.warden.authzservice.infrastructure.web.RequiresCapability;
import com.warden.scope.RoleAssignmentService;
import com.warden.scope.ScopeKey;
import com.warden.scope.ScopeVersionManager;
import com.warden.security.TenantIsolationEnforcer;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.TreeSet;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Role memberships per user and tenant. Every operation is confined to the caller's tenant unless
 * the caller holds the wildcard.
 */
@RestController
@RequestMapping("/api/v1/memberships")
@RequiresCapability(RoleController.ADMIN_ROLES)
public class MembershipController {

    private final MembershipService memberships;
    private final RoleAssignmentService assignments;
    private final ScopeVersionManager versions;

    public MembershipController(
            MembershipService memberships, RoleAssignmentService assignments, ScopeVersionManager versions) {
        this.memberships = memberships;
        this.assignments = assignments;
        this.versions = versions;
    }

    @PostMapping
    public AssignmentResponse assign(@Valid @RequestBody AssignRoleRequest body, HttpServletRequest request) {
        confineToTenant(request, body.tenantId());
        return AssignmentResponse.from(memberships.assign(body.userId(), body.role(), body.tenantId()));
    }

    @DeleteMapping("/{userId}")
    public ScopeVersionResponse remove(
            @PathVariable String userId,
            @RequestParam(required = false) String tenantId,
            HttpServletRequest request) {
        confineToTenant(request, tenantId);
        String tenant = ScopeKey.normalizeTenant(tenantId);
        long version = memberships.remove(userId, tenant)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No active membership for " + userId + " in " + tenant));
        return new ScopeVersionResponse(userId, tenant, version);
    }

    @GetMapping("/{userId}")
    public MembershipResponse memberships(
            @PathVariable String userId,
            @RequestParam(required = false) String tenantId,
            HttpServletRequest request) {
        confineToTenant(request, tenantId);
        String tenant = ScopeKey.normalizeTenant(tenantId);
        return new MembershipResponse(
                userId,
                tenant,
                assignments.userRoles(userId, tenant),
                new TreeSet<>(assignments.userCapabilities(userId, tenant)),
                versions.getVersion(userId, tenant));
    }

    @PostMapping("/check")
    public CheckCapabilityResponse check(
            @Valid @RequestBody CheckCapabilityRequest body, HttpServletRequest request) {
        confineToTenant(request, body.tenantId());
        return new CheckCapabilityResponse(
                body.userId(),
                ScopeKey.normalizeTenant(body.tenantId()),
                body.capability(),
                assignments.checkCapability(body.userId(), body.capability(), body.tenantId()));
    }

    private static void confineToTenant(HttpServletRequest request, String tenantId) {
        TenantIsolationEnforcer.enforce(AuthenticatedSession.require(request), ScopeKey.normalizeTenant(tenantId));
    }
}
