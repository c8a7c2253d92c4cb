package com.forge.forge_orchestrator.hub;

import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

class WebSocketSessionObserver implements HubObserver {

    private final WebSocketSession session;

    WebSocketSessionObserver(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String id() {
        return "ws-" + session.getId();
    }

    @Override
    public void deliver(byte[] payload) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("session " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(payload));
    }
}
