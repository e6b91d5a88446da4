package com.warden.authzservice.api;

import com.warden.authzservice.infrastructure.notify.SseChangeNotifier;
import com.warden.authzservice.infrastructure.web.AuthenticatedSession;
import com.warden.security.WardenSecurityContext;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Push stream of {@code scope_change} and {@code session_invalidated} events for the calling
 * session's user and tenant.
 */
@RestController
@RequestMapping("/api/v1/notifications")
public class NotificationController {

    private final SseChangeNotifier notifier;

    public NotificationController(SseChangeNotifier notifier) {
        this.notifier = notifier;
    }

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(HttpServletRequest request) {
        WardenSecurityContext context = AuthenticatedSession.require(request);
        return notifier.connect(context.userId(), context.tenantId());
    }
}
