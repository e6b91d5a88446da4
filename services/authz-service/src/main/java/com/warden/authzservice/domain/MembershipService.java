package com.warden.authzservice.domain;

import com.warden.authzservice.config.ScopeProperties;
import com.warden.observability.MetricFactory;
import com.warden.scope.ReconciliationReport;
import com.warden.scope.RoleAssignment;
import com.warden.scope.RoleAssignmentService;
import com.warden.scope.ScopeReconciler;
import com.warden.scope.ScopeVersionManager;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Membership writes as the HTTP layer sees them: the core assignment plus scope-update metrics and
 * an immediate push of the resulting change event.
 *
 * <p>The push is best effort. An event that is not drained here stays pending and is picked up by
 * the next reconciliation sweep.
 */
@Service
public class MembershipService {

    private static final Logger log = LoggerFactory.getLogger(MembershipService.class);

    private final RoleAssignmentService assignments;
    private final ScopeVersionManager versions;
    private final ScopeReconciler reconciler;
    private final MetricFactory metrics;
    private final int batchSize;

    public MembershipService(
            RoleAssignmentService assignments,
            ScopeVersionManager versions,
            ScopeReconciler reconciler,
            MetricFactory metrics,
            ScopeProperties scope) {
        this.assignments = assignments;
        this.versions = versions;
        this.reconciler = reconciler;
        this.metrics = metrics;
        this.batchSize = scope.polling().batchSize();
    }

    public RoleAssignment assign(String userId, String role, String tenantId) {
        RoleAssignment assignment = assignments.assignRole(userId, role, tenantId);
        recordUpdate(assignment.scopeChanged());
        return assignment;
    }

    /** @return the scope version after removal, or empty if the user had no active membership */
    public Optional<Long> remove(String userId, String tenantId) {
        long previous = versions.getVersion(userId, tenantId);
        Optional<Long> version = assignments.removeRole(userId, tenantId);
        version.ifPresent(v -> recordUpdate(v > previous));
        return version;
    }

    private void recordUpdate(boolean changed) {
        metrics.increment(MetricFactory.Names.SCOPE_UPDATES, "Scope update requests",
                "outcome", changed ? "changed" : "unchanged");
        if (changed) {
            ReconciliationReport report = reconciler.publishPendingEvents(batchSize);
            log.debug("Pushed {} change events after membership write", report.eventsPublished());
        }
    }
}
