package com.forge.forge_orchestrator.hub;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Attaches every connected WebSocket client to the hub. Clients only listen;
 * anything they send is ignored.
 */
@Slf4j
public class FlowEventsWebSocketHandler extends TextWebSocketHandler {

    private final BroadcastHub hub;
    private final Map<String, HubSubscription> subscriptions = new ConcurrentHashMap<>();

    public FlowEventsWebSocketHandler(BroadcastHub hub) {
        this.hub = hub;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        subscriptions.put(session.getId(), hub.attach(new WebSocketSessionObserver(session)));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Ignoring inbound message on session {}", session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket transport error on session {}: {}", session.getId(), exception.getMessage());
        release(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        release(session);
    }

    int sessionCount() {
        return subscriptions.size();
    }

    private void release(WebSocketSession session) {
        HubSubscription subscription = subscriptions.remove(session.getId());
        if (subscription != null) {
            hub.detach(subscription);
        }
    }
}
