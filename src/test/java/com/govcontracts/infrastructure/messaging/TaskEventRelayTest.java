package com.govcontracts.infrastructure.messaging;

import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.DefaultMessage;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TaskEventRelayTest {

    @Test
    void testOnMessage_ForwardsChannelAndBody() {
        // Given
        TaskSubscriptionRegistry registry = mock(TaskSubscriptionRegistry.class);
        TaskEventRelay relay = new TaskEventRelay(registry);
        DefaultMessage message = new DefaultMessage("tasks:all".getBytes(StandardCharsets.UTF_8),
                "{\"state\":\"SUCCESS\"}".getBytes(StandardCharsets.UTF_8));

        // When
        relay.onMessage(message, "tasks:*".getBytes(StandardCharsets.UTF_8));

        // Then
        verify(registry).broadcast("tasks:all", "{\"state\":\"SUCCESS\"}");
    }

    @Test
    void testRegistry_CountsSubscribersPerChannel() {
        // Given
        TaskSubscriptionRegistry registry = new TaskSubscriptionRegistry();

        // When
        registry.subscribe("tasks:all");
        registry.subscribe("tasks:all");

        // Then
        assertEquals(2, registry.subscriberCount("tasks:all"));
        assertEquals(0, registry.subscriberCount("tasks:other"));
    }
}
