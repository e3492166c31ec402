package com.mealscout.gateway;

import com.mealscout.session.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sends server events to the members of a chat or to a single connection.
 *
 * <p>A failed send is logged and skipped; it never stops delivery to the other members
 * and never reaches the caller.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BroadcastGateway {

    public static final String MESSAGE = "message";
    public static final String TOOL_CALL = "tool_call";
    public static final String ERROR = "error";

    private final ConnectionRegistry registry;
    private final Map<String, ConnectionSink> sinks = new ConcurrentHashMap<>();

    public void attach(String connectionId, ConnectionSink sink) {
        sinks.put(connectionId, sink);
    }

    public void detach(String connectionId) {
        sinks.remove(connectionId);
    }

    public void emitToChat(String chatId, String event, Object payload) {
        Set<String> members = registry.membersOf(chatId);
        if (members.isEmpty()) {
            log.debug("No members to receive '{}' chatId={}", event, chatId);
            return;
        }
        log.debug("Emitting '{}' to {} member(s) chatId={}", event, members.size(), chatId);
        for (String connectionId : members) {
            deliver(connectionId, event, payload);
        }
    }

    public boolean emitToConnection(String connectionId, String event, Object payload) {
        return deliver(connectionId, event, payload);
    }

    public void emitMessage(String chatId, String content) {
        emitToChat(chatId, MESSAGE, Map.of("chat_id", chatId, "content", content));
    }

    public void emitToolCall(String chatId, String toolName) {
        emitToChat(chatId, TOOL_CALL, Map.of("chat_id", chatId, "tool_data", ToolLabels.labelFor(toolName)));
    }

    /**
     * Error scoped to one connection, tagged with its current chat (null when it has none).
     */
    public void emitError(String connectionId, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", registry.chatOf(connectionId).orElse(null));
        payload.put("error", message);
        log.warn("Emitting error connectionId={}: {}", connectionId, message);
        deliver(connectionId, ERROR, payload);
    }

    private boolean deliver(String connectionId, String event, Object payload) {
        ConnectionSink sink = sinks.get(connectionId);
        if (sink == null) {
            log.debug("No sink attached connectionId={} event={}", connectionId, event);
            return false;
        }
        try {
            sink.send(event, payload);
            return true;
        } catch (Exception e) {
            log.warn("Failed to send '{}' connectionId={}: {}", event, connectionId, e.getMessage());
            return false;
        }
    }
}
