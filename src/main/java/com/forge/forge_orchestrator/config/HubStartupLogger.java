package com.forge.forge_orchestrator.config;

import com.forge.forge_orchestrator.hub.Broadcaster;
import com.forge.forge_orchestrator.hub.RedisHubRelay;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Logs at startup how lifecycle events will reach observers and where the
 * durable status files live.
 */
@Slf4j
@Component
public class HubStartupLogger implements ApplicationRunner {

    private final Broadcaster broadcaster;
    private final ForgeProperties properties;

    public HubStartupLogger(Broadcaster broadcaster, ForgeProperties properties) {
        this.broadcaster = broadcaster;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        ForgeProperties.Hub hub = properties.getHub();
        if (broadcaster instanceof RedisHubRelay relay) {
            log.info("Hub: relaying broadcasts through Redis channel {} (endpoint {})", relay.getChannel(), hub.getEndpoint());
        } else {
            log.info("Hub: direct in-process fan-out only (endpoint {}, queue capacity {})",
                    hub.getEndpoint(), hub.getQueueCapacity());
        }
        log.info("Durable status files under {}", Path.of(properties.getStatus().getDirectory()).toAbsolutePath());
    }
}
