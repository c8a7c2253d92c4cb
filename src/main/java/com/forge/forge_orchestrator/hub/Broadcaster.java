package com.forge.forge_orchestrator.hub;

/**
 * Best-effort fan-out of a serialized message to whoever is listening.
 * Implementations must not block the caller on slow or dead observers.
 */
public interface Broadcaster {

    void broadcast(byte[] payload);
}
