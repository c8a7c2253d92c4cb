package com.forge.forge_orchestrator.signal;

import com.forge.forge_orchestrator.engine.FlowMessageCodec;
import com.forge.forge_orchestrator.exception.StatusNotFoundException;
import com.forge.forge_orchestrator.hub.Broadcaster;
import com.forge.forge_orchestrator.model.message.FlowMessage;
import com.forge.forge_orchestrator.model.status.FlowStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Keeps the latest status per flow in memory and pushes each change to live
 * observers as a FLOW_STATUS message. Lost on restart.
 */
@Slf4j
@Component
public class LiveStatusSignaler implements StatusSignaler {

    private final Map<Long, FlowStatus> statuses = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Broadcaster broadcaster;
    private final FlowMessageCodec codec;

    public LiveStatusSignaler(Broadcaster broadcaster, FlowMessageCodec codec) {
        this.broadcaster = broadcaster;
        this.codec = codec;
    }

    @Override
    public void notifyStatus(long flowId, FlowStatus status) {
        lock.writeLock().lock();
        try {
            statuses.put(flowId, status);
        } finally {
            lock.writeLock().unlock();
        }

        try {
            broadcaster.broadcast(codec.encode(FlowMessage.flowStatus(status)));
        } catch (RuntimeException e) {
            log.warn("Live status push for flow {} failed: {}", flowId, e.getMessage());
        }
    }

    @Override
    public FlowStatus getStatus(long flowId) {
        lock.readLock().lock();
        try {
            FlowStatus status = statuses.get(flowId);
            if (status == null) {
                throw new StatusNotFoundException(flowId);
            }
            return status;
        } finally {
            lock.readLock().unlock();
        }
    }
}
