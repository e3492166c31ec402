package com.mealscout.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes events as {@code {"event": ..., "data": ...}} text frames.
 */
class WebSocketConnectionSink implements ConnectionSink {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    WebSocketConnectionSink(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public void send(String event, Object payload) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("Session " + session.getId() + " is closed");
        }
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("event", event);
        frame.put("data", payload);
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
    }
}
