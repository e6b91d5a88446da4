package com.warden.authzservice.api.dto;

import jakarta.validation.constraints.NotBlank;

public record AssignRoleRequest(@NotBlank String userId, @NotBlank String role, String tenantId) {}
