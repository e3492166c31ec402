package com.mealscout.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.mealscout.model.ChatRecord;
import com.mealscout.model.GeoLocation;
import com.mealscout.service.ChatNotFoundException;
import com.mealscout.service.ChatStore;
import com.mealscout.service.ConversationService;
import com.mealscout.session.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Client events, independent of the transport that carried them.
 *
 * <p>Every failure while handling an event is reported to the originating connection as an
 * {@code error} event; nothing propagates back to the transport.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatEventService {

    public static final String SEND_MESSAGE = "send_message";
    public static final String GET_CHATS = "get_chats";
    public static final String GET_MESSAGES = "get_messages";
    public static final String GET_CHAT_DATA = "get_chat_data";

    private final ConnectionRegistry registry;
    private final BroadcastGateway gateway;
    private final ConversationService conversationService;
    private final ChatStore chatStore;
    private final SocketAuthenticator authenticator;

    /**
     * @return false when the token is rejected; the connection is then not registered
     */
    public boolean connect(String connectionId, String token, ConnectionSink sink) {
        if (!authenticator.isValid(token)) {
            log.warn("Invalid token attempt connectionId={}", connectionId);
            return false;
        }
        registry.register(connectionId);
        gateway.attach(connectionId, sink);
        log.info("Client connected connectionId={}", connectionId);
        return true;
    }

    public void disconnect(String connectionId) {
        gateway.detach(connectionId);
        registry.unregister(connectionId);
        log.info("Client disconnected connectionId={}", connectionId);
    }

    public void handle(String connectionId, String event, JsonNode data) {
        log.info("Received '{}' connectionId={}", event, connectionId);
        try {
            switch (event) {
                case SEND_MESSAGE -> sendMessage(connectionId, data);
                case GET_CHATS -> getChats(connectionId);
                case GET_MESSAGES -> getMessages(connectionId, data);
                case GET_CHAT_DATA -> getChatData(connectionId, data);
                default -> throw new IllegalArgumentException("Unknown event: " + event);
            }
        } catch (Exception e) {
            log.error("Error handling '{}' connectionId={}: {}", event, connectionId, e.getMessage());
            gateway.emitError(connectionId, e.getMessage());
        }
    }

    public void rejectFrame(String connectionId, String reason) {
        gateway.emitError(connectionId, reason);
    }

    private void sendMessage(String connectionId, JsonNode data) {
        String content = text(data, "content");
        if (content == null) {
            throw new IllegalArgumentException("Message content is required");
        }

        if (!registry.isRegistered(connectionId)) {
            log.info("Dropping message from closed connectionId={}", connectionId);
            return;
        }
        String chatId = text(data, "chat_id");
        if (chatId == null) {
            ChatRecord chat = chatStore.createChat(location(data));
            chatId = chat.getChatId();
            log.info("Created new chat chatId={} connectionId={}", chatId, connectionId);
        } else if (chatStore.findChat(chatId).isEmpty()) {
            throw new ChatNotFoundException(chatId);
        }

        if (!registry.joinChat(connectionId, chatId)) {
            log.info("Connection closed before joining chatId={} connectionId={}", chatId, connectionId);
            return;
        }
        String reply = conversationService.runTurn(chatId, content,
                (turnChatId, toolName, arguments) -> gateway.emitToolCall(turnChatId, toolName));
        gateway.emitMessage(chatId, reply);
    }

    private void getChats(String connectionId) {
        gateway.emitToConnection(connectionId, "chats", Map.of("chats", chatStore.listChats()));
    }

    private void getMessages(String connectionId, JsonNode data) {
        ChatRecord chat = requireChat(data);
        log.debug("Sending {} message(s) chatId={}", chat.getMessages().size(), chat.getChatId());
        gateway.emitToConnection(connectionId, "messages",
                Map.of("chat_id", chat.getChatId(), "messages", chat.getMessages()));
    }

    private void getChatData(String connectionId, JsonNode data) {
        ChatRecord chat = requireChat(data);
        gateway.emitToConnection(connectionId, "chat_data",
                Map.of("chat_id", chat.getChatId(), "chat_data", chat));
    }

    private ChatRecord requireChat(JsonNode data) {
        if (!registry.isRegistered(connectionId)) {
            log.info("Dropping message from closed connectionId={}", connectionId);
            return;
        }
        String chatId = text(data, "chat_id");
        if (chatId == null) {
            throw new IllegalArgumentException("chat_id is required");
        }
        return chatStore.findChat(chatId).orElseThrow(() -> new ChatNotFoundException(chatId));
    }

    private static String text(JsonNode data, String field) {
        if (data == null || !data.hasNonNull(field)) {
            return null;
        }
        String value = data.get(field).asText();
        return value.isBlank() ? null : value;
    }

    private static GeoLocation location(JsonNode data) {
        JsonNode location = data == null ? null : data.get("location");
        if (location == null || !location.isObject()) {
            return null;
        }
        Double latitude = location.hasNonNull("latitude") ? location.get("latitude").asDouble() : null;
        Double longitude = location.hasNonNull("longitude") ? location.get("longitude").asDouble() : null;
        return new GeoLocation(latitude, longitude);
    }
}
