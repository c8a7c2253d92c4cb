package com.forge.forge_orchestrator.config;

import com.forge.forge_orchestrator.hub.BroadcastHub;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class HubConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService hubDeliveryExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread t = new Thread(runnable, "hub-delivery-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newCachedThreadPool(factory);
    }

    @Bean
    public BroadcastHub broadcastHub(ForgeProperties properties, ExecutorService hubDeliveryExecutor) {
        return new BroadcastHub(properties.getHub().getQueueCapacity(), hubDeliveryExecutor);
    }
}
