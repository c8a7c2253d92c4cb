package com.forge.forge_orchestrator.config;

import com.forge.forge_orchestrator.hub.BroadcastHub;
import com.forge.forge_orchestrator.hub.RedisHubRelay;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/** Multi-instance mode: broadcasts go through Redis and come back to every local hub. */
@Configuration
@ConditionalOnProperty(prefix = "forge.hub.redis-relay", name = "enabled", havingValue = "true")
public class RedisHubRelayConfig {

    @Bean
    @Primary
    public RedisHubRelay redisHubRelay(StringRedisTemplate redisTemplate,
                                       BroadcastHub broadcastHub,
                                       ForgeProperties properties) {
        return new RedisHubRelay(redisTemplate, broadcastHub, properties.getHub().getRedisRelay().getChannel());
    }

    @Bean
    public RedisMessageListenerContainer redisHubListenerContainer(RedisConnectionFactory connectionFactory,
                                                                   RedisHubRelay relay) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(relay, new ChannelTopic(relay.getChannel()));
        return container;
    }
}
