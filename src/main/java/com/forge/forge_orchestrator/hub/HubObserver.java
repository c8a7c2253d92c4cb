package com.forge.forge_orchestrator.hub;

import java.io.IOException;

/** A live consumer attached to the hub (a WebSocket session, a probe, a test sink). */
public interface HubObserver {

    String id();

    /**
     * Called from the hub's delivery thread, never concurrently for the same observer.
     * Throwing detaches the observer.
     */
    void deliver(byte[] payload) throws IOException;
}
