package com.warden.authzservice.infrastructure.notify;

import com.warden.authzservice.config.ScopeProperties;
import com.warden.eventmodel.EventSerializer;
import com.warden.eventmodel.EventValidator;
import com.warden.eventmodel.ScopeChangeNotification;
import com.warden.eventmodel.SessionInvalidatedNotification;
import com.warden.eventmodel.ValidationResult;
import com.warden.observability.MetricFactory;
import com.warden.scope.ChangeNotifier;
import com.warden.scope.ScopeKey;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Pushes scope changes to connected clients over Server-Sent Events.
 *
 * <p>Connections are keyed by user and remember the tenant they were opened for. A notification for
 * tenant T reaches the user's connections opened for T; a global notification reaches all of them.
 * Each user may hold a bounded number of connections; opening one more closes the oldest.
 *
 * <p>Payloads are written with {@link EventSerializer} so the wire shape does not depend on the
 * web layer's naming strategy. A scope change that fails {@link EventValidator} is not sent.
 */
@Component
public class SseChangeNotifier implements ChangeNotifier {

    private static final Logger log = LoggerFactory.getLogger(SseChangeNotifier.class);

    private final Map<String, List<Connection>> connections = new ConcurrentHashMap<>();
    private final ScopeProperties.Notifications settings;
    private final MetricFactory metrics;
    private final AtomicLong openConnections;

    public SseChangeNotifier(ScopeProperties properties, MetricFactory metrics) {
        this.settings = properties.notifications();
        this.metrics = metrics;
        this.openConnections = metrics.gauge(MetricFactory.Names.NOTIFICATION_CONNECTIONS,
                "Open push connections");
    }

    /** Opens a stream for {@code userId}; the caller returns the emitter from its handler. */
    public SseEmitter connect(String userId, String tenantId) {
        SseEmitter emitter = new SseEmitter(settings.connectionTimeout().toMillis());
        Connection connection = new Connection(UUID.randomUUID().toString(), ScopeKey.normalizeTenant(tenantId), emitter);
        List<Connection> evicted = new ArrayList<>();

        // eviction and registration are one atomic step per user
        connections.compute(userId, (id, existing) -> {
            List<Connection> userConnections = existing == null ? new CopyOnWriteArrayList<>() : existing;
            while (!userConnections.isEmpty() && userConnections.size() >= settings.maxConnectionsPerUser()) {
                Connection oldest = userConnections.remove(0);
                openConnections.decrementAndGet();
                evicted.add(oldest);
            }
            userConnections.add(connection);
            openConnections.incrementAndGet();
            return userConnections;
        });

        for (Connection oldest : evicted) {
            log.debug("Closing oldest push connection {} of {}: limit {}", oldest.id(), userId,
                    settings.maxConnectionsPerUser());
            oldest.emitter().complete();
        }

        emitter.onCompletion(() -> remove(userId, connection));
        emitter.onTimeout(() -> remove(userId, connection));
        emitter.onError(e -> remove(userId, connection));
        log.info("Push connection {} opened for {}@{}", connection.id(), userId, connection.tenantId());
        return emitter;
    }

    @Override
    public int notifyScopeChange(ScopeChangeNotification notification) {
        ValidationResult validation = EventValidator.validate(notification);
        if (!validation.valid()) {
            log.warn("Dropping malformed scope change for {}@{}: {}", notification.userId(),
                    notification.tenantId(), validation.errors());
            return 0;
        }
        return deliver(notification.userId(), notification.tenantId(), notification.type(), notification);
    }

    @Override
    public int notifySessionInvalidated(SessionInvalidatedNotification notification) {
        return deliver(notification.userId(), notification.tenantId(), notification.type(), notification);
    }

    public int connectionCount(String userId) {
        return connections.getOrDefault(userId, List.of()).size();
    }

    private int deliver(String userId, String tenantId, String eventName, Object payload) {
        String json = EventSerializer.serializePayload(payload);
        int delivered = 0;
        boolean global = ScopeKey.GLOBAL.equals(ScopeKey.normalizeTenant(tenantId));
        for (Connection connection : connections.getOrDefault(userId, List.of())) {
            if (!global && !connection.tenantId().equals(tenantId)) {
                continue;
            }
            try {
                connection.emitter().send(SseEmitter.event()
                        .name(eventName)
                        .data(json, MediaType.APPLICATION_JSON));
                delivered++;
            } catch (IOException | IllegalStateException e) {
                log.warn("Push to connection {} of {} failed: {}", connection.id(), userId, e.getMessage());
                remove(userId, connection);
                connection.emitter().completeWithError(e);
            }
        }
        if (delivered > 0) {
            metrics.counter(MetricFactory.Names.NOTIFICATIONS_DELIVERED, "Push notifications delivered",
                    "type", eventName).increment(delivered);
        }
        return delivered;
    }

    private void remove(String userId, Connection connection) {
        connections.computeIfPresent(userId, (id, list) -> {
            if (list.remove(connection)) {
                openConnections.decrementAndGet();
            }
            return list.isEmpty() ? null : list;
        });
    }

    private record Connection(String id, String tenantId, SseEmitter emitter) {}
}
