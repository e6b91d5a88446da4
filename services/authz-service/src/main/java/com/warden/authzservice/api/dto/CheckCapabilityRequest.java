package com.warden.authzservice.api.dto;

import jakarta.validation.constraints.NotBlank;

public record CheckCapabilityRequest(@NotBlank String userId, @NotBlank String capability, String tenantId) {}
