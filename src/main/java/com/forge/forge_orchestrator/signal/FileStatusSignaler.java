package com.forge.forge_orchestrator.signal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forge.forge_orchestrator.config.ForgeProperties;
import com.forge.forge_orchestrator.exception.SignalDeliveryException;
import com.forge.forge_orchestrator.exception.StatusNotFoundException;
import com.forge.forge_orchestrator.model.status.FlowStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Durable channel: one pretty-printed JSON file per flow under the status
 * directory. Each write replaces the whole file; the directory is created on
 * first use.
 */
@Slf4j
@Component
public class FileStatusSignaler implements StatusSignaler {

    private final Path directory;
    private final ObjectMapper objectMapper;

    @Autowired
    public FileStatusSignaler(ForgeProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getStatus().getDirectory()), objectMapper);
    }

    public FileStatusSignaler(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public void notifyStatus(long flowId, FlowStatus status) {
        Path file = fileFor(flowId);
        try {
            Files.createDirectories(directory);
            byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(status);
            Files.write(file, json);
            log.debug("Wrote status {} for flow {} to {}", status.status(), flowId, file);
        } catch (IOException e) {
            throw new SignalDeliveryException("failed to write status file " + file, e);
        }
    }

    @Override
    public FlowStatus getStatus(long flowId) {
        Path file = fileFor(flowId);
        try {
            return objectMapper.readValue(Files.readAllBytes(file), FlowStatus.class);
        } catch (NoSuchFileException e) {
            throw new StatusNotFoundException(flowId);
        } catch (IOException e) {
            throw new SignalDeliveryException("failed to read status file " + file, e);
        }
    }

    Path fileFor(long flowId) {
        return directory.resolve(flowId + ".json");
    }
}
