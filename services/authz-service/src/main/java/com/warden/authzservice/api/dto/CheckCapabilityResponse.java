package com.warden.authzservice.api.dto;

public record CheckCapabilityResponse(String userId, String tenantId, String capability, boolean allowed) {}
