package com.warden.authzservice.api;

import com.warden.authzservice.api.dto.CreateRoleRequest;
import com.warden.authzservice.api.dto.RoleResponse;
import com.warden.authzservice.infrastructure.web.RequiresCapability;
import com.warden.security.CapabilityResolver;
import com.warden.security.Role;
import jakarta.validation.Valid;
import java.util.LinkedHashSet;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/roles")
public class RoleController {

    static final String ROLES_READ = "roles:read";
    static final String ADMIN_ROLES = "admin:roles";

    private final CapabilityResolver resolver;

    public RoleController(CapabilityResolver resolver) {
        this.resolver = resolver;
    }

    /** Role names in catalog order, static roles first. */
    @GetMapping
    @RequiresCapability(ROLES_READ)
    public List<String> listRoles() {
        return List.copyOf(resolver.listAvailableRoles());
    }

    @GetMapping("/{name}")
    @RequiresCapability(ROLES_READ)
    public RoleResponse role(@PathVariable String name) {
        return resolver.roleDefinition(name)
                .map(RoleResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException("Role '" + name + "' not found"));
    }

    @PostMapping("/custom")
    @ResponseStatus(HttpStatus.CREATED)
    @RequiresCapability(ADMIN_ROLES)
    public RoleResponse createCustomRole(@Valid @RequestBody CreateRoleRequest request) {
        Role role = resolver.createCustomRole(
                request.name(), new LinkedHashSet<>(request.capabilities()), request.description());
        return role(role.name());
    }
}
