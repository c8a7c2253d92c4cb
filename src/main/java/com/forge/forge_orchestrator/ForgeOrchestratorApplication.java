package com.forge.forge_orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ForgeOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForgeOrchestratorApplication.class, args);
    }
}
