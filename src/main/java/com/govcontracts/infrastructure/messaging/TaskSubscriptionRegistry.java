package com.govcontracts.infrastructure.messaging;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Server-Sent-Event subscribers of this node, keyed by task channel.
 */
@Slf4j
@Component
public class TaskSubscriptionRegistry {

    static final String EVENT_NAME = "task";

    private final Map<String, List<SseEmitter>> subscribers = new ConcurrentHashMap<>();

    @Value("${app.tasks.sse-timeout-ms:1800000}")
    private long timeoutMs;

    public SseEmitter subscribe(String channel) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        List<SseEmitter> emitters = subscribers.computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>());
        emitters.add(emitter);

        emitter.onCompletion(() -> remove(channel, emitter));
        emitter.onTimeout(() -> remove(channel, emitter));
        emitter.onError(e -> remove(channel, emitter));

        log.debug("SSE subscriber added on {} ({} total)", channel, emitters.size());
        return emitter;
    }

    /**
     * Send a JSON payload to every subscriber of the channel. Subscribers
     * whose connection has gone away are dropped.
     */
    public void broadcast(String channel, String payload) {
        List<SseEmitter> emitters = subscribers.get(channel);
        if (emitters == null || emitters.isEmpty()) {
            return;
        }
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(EVENT_NAME).data(payload, MediaType.APPLICATION_JSON));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping SSE subscriber on {}: {}", channel, e.getMessage());
                remove(channel, emitter);
            }
        }
    }

    public int subscriberCount(String channel) {
        List<SseEmitter> emitters = subscribers.get(channel);
        return emitters == null ? 0 : emitters.size();
    }

    private void remove(String channel, SseEmitter emitter) {
        subscribers.computeIfPresent(channel, (c, emitters) -> {
            emitters.remove(emitter);
            return emitters.isEmpty() ? null : emitters;
        });
    }
}
