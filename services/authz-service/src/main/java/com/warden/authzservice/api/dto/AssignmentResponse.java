package com.warden.authzservice.api.dto;

import com.warden.scope.RoleAssignment;
import java.util.Set;
import java.util.TreeSet;

public record AssignmentResponse(
        String userId,
        String tenantId,
        String role,
        Set<String> capabilities,
        long previousVersion,
        long scopeVersion,
        boolean scopeChanged) {

    public static AssignmentResponse from(RoleAssignment assignment) {
        return new AssignmentResponse(
                assignment.userId(),
                assignment.tenantId(),
                assignment.role(),
                new TreeSet<>(assignment.capabilities()),
                assignment.previousVersion(),
                assignment.scopeVersion(),
                assignment.scopeChanged());
    }
}
