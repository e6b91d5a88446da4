package com.warden.authzservice.api.dto;

public record ValidateCapabilityResponse(String capability, boolean valid) {}
