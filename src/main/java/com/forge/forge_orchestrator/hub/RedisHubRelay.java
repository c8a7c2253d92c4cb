package com.forge.forge_orchestrator.hub;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;

/**
 * Relays broadcasts through Redis Pub/Sub so observers on every instance receive them.
 * When a flow runs on instance A but the client is connected to instance B,
 * publishing to Redis lets instance B's hub deliver it.
 */
@Slf4j
public class RedisHubRelay implements Broadcaster, MessageListener {

    private final StringRedisTemplate redisTemplate;
    private final BroadcastHub localHub;
    private final String channel;

    public RedisHubRelay(StringRedisTemplate redisTemplate, BroadcastHub localHub, String channel) {
        this.redisTemplate = redisTemplate;
        this.localHub = localHub;
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }

    @Override
    public void broadcast(byte[] payload) {
        try {
            redisTemplate.convertAndSend(channel, new String(payload, StandardCharsets.UTF_8));
        } catch (RuntimeException e) {
            log.warn("Redis publish on {} failed, delivering locally only: {}", channel, e.getMessage());
            localHub.broadcast(payload);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        localHub.broadcast(message.getBody());
    }
}
