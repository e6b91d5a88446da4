package com.warden.authzservice.infrastructure.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Writes the flat {@code {"error": ..., "message": ...}} bodies produced before a request reaches a
 * controller, where {@code @RestControllerAdvice} does not apply.
 */
@Component
public class JsonErrorWriter {

    public static final String INVALID_TOKEN = "invalid_token";
    public static final String SCOPE_OUTDATED = "scope_outdated";
    public static final String AUTHENTICATION_REQUIRED = "authentication_required";
    public static final String INSUFFICIENT_PERMISSIONS = "insufficient_permissions";

    private final ObjectMapper objectMapper;

    public JsonErrorWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(HttpServletResponse response, int status, Map<String, Object> body) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getWriter(), body);
    }
}
