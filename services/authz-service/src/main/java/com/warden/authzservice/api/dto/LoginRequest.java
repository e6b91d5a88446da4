package com.warden.authzservice.api.dto;

import jakarta.validation.constraints.NotBlank;

/** Tenant may be omitted for a global session. */
public record LoginRequest(@NotBlank String userId, String tenantId) {}
