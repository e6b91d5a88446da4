package com.warden.authzservice.infrastructure.scheduling;

import com.warden.authzservice.config.ScopeProperties;
import com.warden.observability.CorrelationContext;
import com.warden.observability.CorrelationContextHolder;
import com.warden.observability.MetricFactory;
import com.warden.scope.ReconciliationReport;
import com.warden.scope.ScopeReconciler;
import com.warden.scope.SessionRegistry;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

/**
 * Periodic pull-side sweep: publishes pending change events, invalidates stale sessions and expires
 * old ones. Runs every {@code warden.scope.polling.interval} unless polling is disabled.
 */
@Component
@ConditionalOnProperty(prefix = "warden.scope.polling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScopeReconciliationJob implements SchedulingConfigurer {

    private static final Logger log = LoggerFactory.getLogger(ScopeReconciliationJob.class);

    private final ScopeReconciler reconciler;
    private final SessionRegistry sessions;
    private final ScopeProperties.Polling polling;
    private final MetricFactory metrics;

    public ScopeReconciliationJob(
            ScopeReconciler reconciler, SessionRegistry sessions, ScopeProperties properties, MetricFactory metrics) {
        this.reconciler = reconciler;
        this.sessions = sessions;
        this.polling = properties.polling();
        this.metrics = metrics;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.addFixedDelayTask(this::runOnce, polling.interval());
        log.info("Scope reconciliation every {} (batch size {})", polling.interval(), polling.batchSize());
    }

    /** One sweep; never throws so the schedule keeps running. */
    public ReconciliationReport runOnce() {
        CorrelationContextHolder.set(CorrelationContext.anonymous("sweep-" + UUID.randomUUID()));
        try {
            ReconciliationReport report = reconciler.reconcile(polling.batchSize());
            int expired = sessions.cleanupExpired();
            record(report, expired);
            return report;
        } catch (RuntimeException e) {
            log.error("Scope reconciliation failed", e);
            return new ReconciliationReport(0, 0, 0, 0);
        } finally {
            CorrelationContextHolder.clear();
        }
    }

    private void record(ReconciliationReport report, int expired) {
        if (report.sessionsInvalidated() > 0) {
            metrics.counter(MetricFactory.Names.SESSIONS_INVALIDATED, "Sessions invalidated",
                    "reason", "scope_change").increment(report.sessionsInvalidated());
        }
        if (expired > 0) {
            metrics.counter(MetricFactory.Names.SESSIONS_INVALIDATED, "Sessions invalidated",
                    "reason", "expired").increment(expired);
        }
    }
}
