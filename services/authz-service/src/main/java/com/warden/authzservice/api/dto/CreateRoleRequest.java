package com.warden.authzservice.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record CreateRoleRequest(@NotBlank String name, @NotEmpty List<String> capabilities, String description) {}
