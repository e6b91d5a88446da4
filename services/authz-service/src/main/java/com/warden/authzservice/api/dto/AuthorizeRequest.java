package com.warden.authzservice.api.dto;

/**
 * Decision request for the calling session.
 *
 * @param action capability-shaped action, e.g. {@code reports:export}; required when the policy
 *     engine is disabled
 * @param resource resource identifier passed through to the policy engine
 * @param method HTTP method of the guarded operation
 * @param path path of the guarded operation
 */
public record AuthorizeRequest(String action, String resource, String method, String path) {}
