package com.mealscout.controller;

import com.mealscout.gateway.BroadcastGateway;
import com.mealscout.model.ChatMessage;
import com.mealscout.model.ChatRecord;
import com.mealscout.service.ChatStore;
import com.mealscout.service.ConversationService;
import com.mealscout.tools.ToolRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@Tag(name = "Chats")
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ChatController {
    private final ChatStore chatStore;
    private final ToolRegistry toolRegistry;
    private final ConversationService conversationService;
    private final BroadcastGateway gateway;

    @Operation(summary = "List chats", description = "All chats, newest first.")
    @GetMapping("/chats")
    public List<ChatRecord> chats() {
        List<ChatRecord> chats = chatStore.listChats();
        log.debug("Handling /api/chats returned {} chat(s)", chats.size());
        return chats;
    }

    @Operation(summary = "Get chat", description = "Full chat record including place ids, thread id and location.")
    @GetMapping("/chats/{chatId}")
    public ChatRecord chat(@PathVariable("chatId") String chatId) {
        log.debug("Handling /api/chats/{} request", chatId);
        return requireChat(chatId);
    }

    @Operation(summary = "Get chat messages")
    @GetMapping("/chats/{chatId}/messages")
    public List<ChatMessage> messages(@PathVariable("chatId") String chatId) {
        log.debug("Handling /api/chats/{}/messages request", chatId);
        return requireChat(chatId).getMessages();
    }

    @Operation(summary = "Run a turn",
            description = "Sends a user message to an existing chat, waits for the assistant reply and "
                    + "broadcasts it to the chat's connected members.")
    @PostMapping("/chats/{chatId}/turns")
    public Mono<Map<String, String>> turn(@PathVariable("chatId") String chatId,
                                          @RequestBody Map<String, String> payload) {
        String content = payload == null ? null : payload.get("content");
        if (content == null || content.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Message content is required");
        }
        requireChat(chatId);
        log.debug("Handling /api/chats/{}/turns request contentLength={}", chatId, content.length());
        return conversationService.runTurnAsync(chatId, content,
                        (turnChatId, toolName, arguments) -> gateway.emitToolCall(turnChatId, toolName))
                .doOnSuccess(reply -> gateway.emitMessage(chatId, reply))
                .map(reply -> Map.of("chat_id", chatId, "content", reply))
                .doOnError(error -> log.error("Turn failed chatId={}", chatId, error));
    }

    @Operation(summary = "Tool schema", description = "Function definitions the assistant is created with.")
    @GetMapping("/tools")
    public List<Map<String, Object>> tools() {
        return toolRegistry.openAiToolsSchema();
    }

    private ChatRecord requireChat(String chatId) {
        return chatStore.findChat(chatId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Chat not found: " + chatId));
    }
}
