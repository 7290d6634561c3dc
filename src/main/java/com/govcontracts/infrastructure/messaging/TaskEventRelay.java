package com.govcontracts.infrastructure.messaging;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Forwards task events received from Redis to the local SSE subscribers of
 * the same channel.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskEventRelay implements MessageListener {

    private final TaskSubscriptionRegistry subscriptionRegistry;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String channel = new String(message.getChannel(), StandardCharsets.UTF_8);
        String payload = new String(message.getBody(), StandardCharsets.UTF_8);
        log.trace("Relaying event on {}", channel);
        subscriptionRegistry.broadcast(channel, payload);
    }
}
