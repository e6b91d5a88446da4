package com.warden.authzservice.api.dto;

public record InvalidationResponse(String userId, String tenantId, int sessionsInvalidated) {}
