package com.forge.forge_orchestrator.config;

import com.forge.forge_orchestrator.hub.BroadcastHub;
import com.forge.forge_orchestrator.hub.FlowEventsWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final BroadcastHub broadcastHub;
    private final ForgeProperties properties;

    @Value("${app.cors.allowed-origins:http://localhost:3000}")
    private String allowedOrigins;

    public WebSocketConfig(BroadcastHub broadcastHub, ForgeProperties properties) {
        this.broadcastHub = broadcastHub;
        this.properties = properties;
    }

    @Bean
    public FlowEventsWebSocketHandler flowEventsWebSocketHandler() {
        return new FlowEventsWebSocketHandler(broadcastHub);
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(flowEventsWebSocketHandler(), properties.getHub().getEndpoint())
                .setAllowedOriginPatterns(allowedOrigins.split("\\s*,\\s*"));
    }
}
