package com.warden.authzservice.api;

import com.warden.authzservice.api.dto.InvalidationResponse;
import com.warden.authzservice.api.dto.ScopeVersionResponse;
import com.warden.authzservice.config.ServiceProperties;
import com.warden.authzservice.infrastructure.web.RequiresCapability;
import com.warden.eventmodel.EventEnvelope;
import com.warden.eventmodel.EventFactory;
import com.warden.eventmodel.ScopeChangeNotification;
import com.warden.eventmodel.SessionInvalidatedNotification;
import com.warden.observability.CorrelationContextHolder;
import com.warden.observability.MetricFactory;
import com.warden.scope.ChangeNotifier;
import com.warden.scope.ScopeChangeEvent;
import com.warden.scope.ScopeKey;
import com.warden.scope.ScopeVersionManager;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Scope versions and the change-event log. Events leave this controller wrapped in the platform
 * {@link EventEnvelope}, sequenced by the new scope version.
 */
@RestController
@Validated
@RequestMapping("/api/v1/scopes")
@RequiresCapability(ScopeController.ADMIN_SCOPES)
public class ScopeController {

    static final String ADMIN_SCOPES = "admin:scopes";
    static final String REASON_ADMIN = "admin_invalidation";

    private final ScopeVersionManager versions;
    private final ChangeNotifier notifier;
    private final MetricFactory metrics;
    private final String producer;

    public ScopeController(
            ScopeVersionManager versions,
            ChangeNotifier notifier,
            MetricFactory metrics,
            ServiceProperties service) {
        this.versions = versions;
        this.notifier = notifier;
        this.metrics = metrics;
        this.producer = service.name();
    }

    @GetMapping("/{userId}/version")
    public ScopeVersionResponse version(@PathVariable String userId, @RequestParam(required = false) String tenantId) {
        String tenant = ScopeKey.normalizeTenant(tenantId);
        return new ScopeVersionResponse(userId, tenant, versions.getVersion(userId, tenant));
    }

    /** Unprocessed change events, oldest first. Reading does not mark them processed. */
    @GetMapping("/events/pending")
    public List<EventEnvelope<ScopeChangeNotification>> pendingEvents(
            @RequestParam(defaultValue = "100") @Positive int limit) {
        return envelopes(versions.pendingChangeEvents(limit));
    }

    @GetMapping("/{userId}/history")
    public List<EventEnvelope<ScopeChangeNotification>> history(
            @PathVariable String userId, @RequestParam(required = false) String tenantId) {
        return envelopes(versions.history(userId, tenantId));
    }

    /**
     * Deactivates the scope's sessions captured below {@code minVersion}, defaulting to the current
     * version so that every session issued before the latest change is cut off.
     */
    @PostMapping("/{userId}/invalidate")
    public InvalidationResponse invalidate(
            @PathVariable String userId,
            @RequestParam(required = false) String tenantId,
            @RequestParam(required = false) Long minVersion) {
        String tenant = ScopeKey.normalizeTenant(tenantId);
        long threshold = minVersion != null ? minVersion : versions.getVersion(userId, tenant);
        int invalidated = versions.invalidateSessions(userId, tenant, threshold);
        if (invalidated > 0) {
            metrics.counter(MetricFactory.Names.SESSIONS_INVALIDATED, "Sessions invalidated",
                    "reason", "admin").increment(invalidated);
            notifier.notifySessionInvalidated(SessionInvalidatedNotification.of(userId, tenant, REASON_ADMIN));
        }
        return new InvalidationResponse(userId, tenant, invalidated);
    }

    private List<EventEnvelope<ScopeChangeNotification>> envelopes(List<ScopeChangeEvent> events) {
        String correlationId = CorrelationContextHolder.correlationId().orElse(null);
        return events.stream()
                .map(e -> EventFactory.scopeChanged(e.toNotification(), e.timestamp(), producer, correlationId))
                .toList();
    }
}
