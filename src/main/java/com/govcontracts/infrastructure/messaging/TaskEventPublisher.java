package com.govcontracts.infrastructure.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govcontracts.domain.model.TaskEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Broadcasts task state changes over Redis pub/sub.
 *
 * Every event goes to {@code tasks:<taskId>} and {@code tasks:all}. A failed
 * broadcast is logged and dropped; the task itself carries on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskEventPublisher {

    public static final String CHANNEL_PREFIX = "tasks:";
    public static final String ALL_CHANNEL = CHANNEL_PREFIX + "all";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    public static String taskChannel(UUID taskId) {
        return CHANNEL_PREFIX + taskId;
    }

    public void publish(TaskEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize event for task {}: {}", event.getTaskId(), e.getMessage(), e);
            return;
        }

        try {
            redisTemplate.convertAndSend(taskChannel(event.getTaskId()), payload);
            redisTemplate.convertAndSend(ALL_CHANNEL, payload);
            log.debug("Published {} for task {}", event.getState(), event.getTaskId());
        } catch (Exception e) {
            log.warn("Could not publish {} for task {}: {}", event.getState(), event.getTaskId(), e.getMessage());
        }
    }
}
