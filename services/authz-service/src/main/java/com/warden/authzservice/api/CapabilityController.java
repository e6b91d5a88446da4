package com.warden.authzservice.api;

import com.warden.authzservice.api.dto.ValidateCapabilityRequest;
import com.warden.authzservice.api.dto.ValidateCapabilityResponse;
import com.warden.security.CapabilityResolver;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Format check for capability strings; open to unauthenticated callers. */
@RestController
@RequestMapping("/api/v1/capabilities")
public class CapabilityController {

    private final CapabilityResolver resolver;

    public CapabilityController(CapabilityResolver resolver) {
        this.resolver = resolver;
    }

    @PostMapping("/validate")
    public ValidateCapabilityResponse validate(@Valid @RequestBody ValidateCapabilityRequest request) {
        return new ValidateCapabilityResponse(
                request.capability(), resolver.validateCapabilityFormat(request.capability()));
    }
}
