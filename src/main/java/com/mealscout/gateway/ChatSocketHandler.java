package com.mealscout.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mealscout.config.ChatProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket transport for {@link ChatEventService}. Frames are parsed on the socket thread
 * and handled on a worker pool so a long turn never blocks the connection.
 */
@Component
@Slf4j
public class ChatSocketHandler extends TextWebSocketHandler {

    private final ChatEventService eventService;
    private final ObjectMapper objectMapper;
    private final ChatProperties.Socket socket;

    private final ExecutorService eventExecutor = Executors.newCachedThreadPool(new CustomizableThreadFactory("chat-event-"));

    public ChatSocketHandler(ChatEventService eventService, ObjectMapper objectMapper, ChatProperties properties) {
        this.eventService = eventService;
        this.objectMapper = objectMapper;
        this.socket = properties.getSocket();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        WebSocketSession outbound = new ConcurrentWebSocketSessionDecorator(
                session, socket.getSendTimeLimitMs(), socket.getSendBufferSizeLimit());
        String token = (String) session.getAttributes().get(TokenHandshakeInterceptor.TOKEN_ATTRIBUTE);
        if (!eventService.connect(session.getId(), token, new WebSocketConnectionSink(outbound, objectMapper))) {
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Invalid token"));
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connectionId = session.getId();
        JsonNode frame;
        try {
            frame = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("Unparseable frame connectionId={}: {}", connectionId, e.getOriginalMessage());
            eventService.rejectFrame(connectionId, "Invalid message format: " + e.getOriginalMessage());
            return;
        }
        String event = frame == null ? null : frame.path("event").asText(null);
        if (event == null || event.isBlank()) {
            eventService.rejectFrame(connectionId, "Invalid message format: missing event");
            return;
        }
        JsonNode data = frame.get("data");
        try {
            eventExecutor.submit(() -> eventService.handle(connectionId, event, data));
        } catch (RejectedExecutionException e) {
            log.warn("Event '{}' rejected during shutdown connectionId={}", event, connectionId);
            eventService.rejectFrame(connectionId, "Server is shutting down");
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("WebSocket transport error connectionId={}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("WebSocket connection closed connectionId={} status={}", session.getId(), status);
        eventService.disconnect(session.getId());
    }

    @PreDestroy
    public void shutdownExecutor() {
        log.info("Shutting down chat event executor...");
        eventExecutor.shutdown();
        try {
            if (!eventExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Executor did not terminate in time, forcing shutdown...");
                eventExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for executor shutdown, forcing now.");
            eventExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
