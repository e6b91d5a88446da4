package com.warden.authzservice.api.dto;

public record ScopeVersionResponse(String userId, String tenantId, long version) {}
