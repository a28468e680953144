package com.storefront.infrastructure.notification;

import com.storefront.domain.model.PushMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open server-sent-event streams per user.
 *
 * Pushes are best effort: a user with no open stream simply misses the message, and a
 * stream that fails on send is dropped.
 */
@Slf4j
@Component
public class SseSessionRegistry {

    private final Map<UUID, Set<SseEmitter>> sessions = new ConcurrentHashMap<>();

    @Value("${app.notifications.sse-timeout-ms:1800000}")
    private long timeoutMs;

    public SseEmitter register(UUID userId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        sessions.computeIfAbsent(userId, id -> ConcurrentHashMap.newKeySet()).add(emitter);

        emitter.onCompletion(() -> remove(userId, emitter));
        emitter.onTimeout(() -> remove(userId, emitter));
        emitter.onError(e -> remove(userId, emitter));

        log.debug("Opened notification stream for user {}", userId);
        return emitter;
    }

    /**
     * @return number of streams the message was written to
     */
    public int push(UUID userId, PushMessage message) {
        Set<SseEmitter> emitters = sessions.get(userId);
        if (emitters == null || emitters.isEmpty()) {
            return 0;
        }

        int delivered = 0;
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event()
                        .name(message.type())
                        .data(message, MediaType.APPLICATION_JSON));
                delivered++;
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping notification stream for user {}: {}", userId, e.getMessage());
                remove(userId, emitter);
            }
        }
        return delivered;
    }

    public int sessionCount(UUID userId) {
        Set<SseEmitter> emitters = sessions.get(userId);
        return emitters == null ? 0 : emitters.size();
    }

    private void remove(UUID userId, SseEmitter emitter) {
        sessions.computeIfPresent(userId, (id, emitters) -> {
            emitters.remove(emitter);
            return emitters.isEmpty() ? null : emitters;
        });
    }
}
