package com.govcontracts.config;

import com.govcontracts.infrastructure.messaging.TaskEventPublisher;
import com.govcontracts.infrastructure.messaging.TaskEventRelay;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

@Configuration
public class RedisMessagingConfig {

    @Bean
    public RedisMessageListenerContainer taskEventListenerContainer(RedisConnectionFactory connectionFactory,
                                                                    TaskEventRelay relay) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(relay, new PatternTopic(TaskEventPublisher.CHANNEL_PREFIX + "*"));
        return container;
    }
}
