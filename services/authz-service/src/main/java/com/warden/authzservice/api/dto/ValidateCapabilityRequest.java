package com.warden.authzservice.api.dto;

import jakarta.validation.constraints.NotNull;

public record ValidateCapabilityRequest(@NotNull String capability) {}
