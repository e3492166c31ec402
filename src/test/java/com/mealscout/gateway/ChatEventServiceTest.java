package com.mealscout.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mealscout.model.ChatMessage;
import com.mealscout.model.ChatRecord;
import com.mealscout.model.GeoLocation;
import com.mealscout.service.ConversationService;
import com.mealscout.service.TurnListener;
import com.mealscout.service.impl.InMemoryChatStore;
import com.mealscout.session.ConnectionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ChatEventServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ConnectionRegistry registry;
    private InMemoryChatStore chatStore;
    private ScriptedConversation conversation;
    private ChatEventService service;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        chatStore = new InMemoryChatStore(objectMapper);
        conversation = new ScriptedConversation(chatStore);
        service = new ChatEventService(registry, new BroadcastGateway(registry), conversation, chatStore,
                new SocketAuthenticator(SocketAuthenticatorTest.properties("abc")));
    }

    @Test
    void wrongTokenIsRejectedBeforeRegistration() {
        RecordingSink sink = new RecordingSink();

        boolean accepted = service.connect("c1", "xyz", sink);

        assertThat(accepted).isFalse();
        assertThat(registry.isRegistered("c1")).isFalse();
        assertThat(sink.events).isEmpty();
    }

    @Test
    void firstMessageCreatesChatWithLocationAndRepliesToSender() throws Exception {
        RecordingSink sender = connect("c1");
        RecordingSink bystander = connect("c2");

        service.handle("c1", ChatEventService.SEND_MESSAGE,
                json("{\"content\":\"hi\",\"location\":{\"latitude\":40.7,\"longitude\":-74.0}}"));

        List<ChatRecord> chats = chatStore.listChats();
        assertThat(chats).hasSize(1);
        ChatRecord chat = chats.get(0);
        assertThat(chat.getLocation()).isEqualTo(new GeoLocation(40.7, -74.0));
        assertThat(chat.getMessages()).containsExactly(ChatMessage.user("hi"), ChatMessage.assistant("reply to hi"));
        assertThat(registry.chatOf("c1")).contains(chat.getChatId());

        List<RecordingSink.Sent> messages = sender.eventsNamed("message");
        assertThat(messages).hasSize(1);
        assertThat(sender.payloadOf(sender.events.indexOf(messages.get(0))))
                .containsEntry("chat_id", chat.getChatId())
                .containsEntry("content", "reply to hi");
        assertThat(bystander.events).isEmpty();
    }

    @Test
    void membersOfSharedChatReceiveToolCallsAndReply() throws Exception {
        RecordingSink a = connect("a");
        RecordingSink b = connect("b");
        service.handle("a", ChatEventService.SEND_MESSAGE, json("{\"content\":\"start\"}"));
        String chatId = registry.chatOf("a").orElseThrow();
        a.events.clear();

        conversation.toolToAnnounce = "search_google_maps";
        service.handle("b", ChatEventService.SEND_MESSAGE,
                json("{\"chat_id\":\"" + chatId + "\",\"content\":\"sushi nearby?\"}"));

        for (RecordingSink sink : List.of(a, b)) {
            assertThat(sink.events).extracting(RecordingSink.Sent::event).containsExactly("tool_call", "message");
            assertThat(sink.payloadOf(0)).containsEntry("tool_data", "Searching Google Maps");
            assertThat(sink.payloadOf(1)).containsEntry("content", "reply to sushi nearby?");
        }
    }

    @Test
    void missingContentIsReportedToSender() throws Exception {
        RecordingSink sink = connect("c1");

        service.handle("c1", ChatEventService.SEND_MESSAGE, json("{\"chat_id\":\"x\"}"));

        assertThat(sink.events).extracting(RecordingSink.Sent::event).containsExactly("error");
        assertThat(sink.payloadOf(0)).containsEntry("error", "Message content is required");
        assertThat(conversation.turns).isZero();
    }

    @Test
    void unknownChatIsReported() throws Exception {
        RecordingSink sink = connect("c1");

        service.handle("c1", ChatEventService.SEND_MESSAGE, json("{\"chat_id\":\"nope\",\"content\":\"hi\"}"));

        assertThat(sink.payloadOf(0)).containsEntry("error", "Chat not found: nope");
        assertThat(registry.chatOf("c1")).isEmpty();
    }

    @Test
    void messageQueuedBehindDisconnectDoesNotRejoin() throws Exception {
        RecordingSink sink = connect("c1");
        service.disconnect("c1");

        service.handle("c1", ChatEventService.SEND_MESSAGE, json("{\"content\":\"hi\"}"));

        assertThat(registry.isRegistered("c1")).isFalse();
        assertThat(registry.chatOf("c1")).isEmpty();
        assertThat(chatStore.listChats()).isEmpty();
        assertThat(conversation.turns).isZero();
        assertThat(sink.events).isEmpty();
    }

    @Test
    void messageToExistingChatAfterDisconnectLeavesNoMember() throws Exception {
        ChatRecord chat = chatStore.createChat(null);
        connect("c1");
        service.disconnect("c1");

        service.handle("c1", ChatEventService.SEND_MESSAGE,
                json("{\"chat_id\":\"" + chat.getChatId() + "\",\"content\":\"hi\"}"));

        assertThat(registry.membersOf(chat.getChatId())).isEmpty();
        assertThat(conversation.turns).isZero();
    }

    @Test
    void getMessagesRequiresChatId() throws Exception {
        RecordingSink sink = connect("c1");

        service.handle("c1", ChatEventService.GET_MESSAGES, json("{}"));

        assertThat(sink.payloadOf(0)).containsEntry("error", "chat_id is required");
    }

    @Test
    void readEventsReplyOnlyToRequester() throws Exception {
        RecordingSink a = connect("a");
        RecordingSink b = connect("b");
        ChatRecord chat = chatStore.createChat(null);
        chatStore.appendMessage(chat.getChatId(), ChatMessage.user("hello"));
        registry.joinChat("b", chat.getChatId());

        service.handle("a", ChatEventService.GET_MESSAGES, json("{\"chat_id\":\"" + chat.getChatId() + "\"}"));
        service.handle("a", ChatEventService.GET_CHAT_DATA, json("{\"chat_id\":\"" + chat.getChatId() + "\"}"));
        service.handle("a", ChatEventService.GET_CHATS, null);

        assertThat(a.events).extracting(RecordingSink.Sent::event).containsExactly("messages", "chat_data", "chats");
        assertThat(a.payloadOf(0)).containsEntry("messages", List.of(ChatMessage.user("hello")));
        assertThat(a.payloadOf(1)).containsKey("chat_data");
        assertThat((List<?>) a.payloadOf(2).get("chats")).hasSize(1);
        assertThat(b.events).isEmpty();
    }

    @Test
    void unknownEventIsReported() {
        RecordingSink sink = connect("c1");

        service.handle("c1", "dance", null);

        assertThat(sink.payloadOf(0)).containsEntry("error", "Unknown event: dance");
    }

    @Test
    void disconnectCleansMembership() throws Exception {
        connect("c1");
        service.handle("c1", ChatEventService.SEND_MESSAGE, json("{\"content\":\"hi\"}"));
        String chatId = registry.chatOf("c1").orElseThrow();

        service.disconnect("c1");

        assertThat(registry.isRegistered("c1")).isFalse();
        assertThat(registry.membersOf(chatId)).isEmpty();
    }

    private RecordingSink connect(String connectionId) {
        RecordingSink sink = new RecordingSink();
        assertThat(service.connect(connectionId, "abc", sink)).isTrue();
        return sink;
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    private static final class ScriptedConversation implements ConversationService {

        private final InMemoryChatStore chatStore;
        private String toolToAnnounce;
        private int turns;

        private ScriptedConversation(InMemoryChatStore chatStore) {
            this.chatStore = chatStore;
        }

        @Override
        public String runTurn(String chatId, String userText, TurnListener listener) {
            turns++;
            chatStore.appendMessage(chatId, ChatMessage.user(userText));
            if (toolToAnnounce != null) {
                listener.onToolCall(chatId, toolToAnnounce, Map.of());
            }
            String reply = "reply to " + userText;
            chatStore.appendMessage(chatId, ChatMessage.assistant(reply));
            return reply;
        }

        @Override
        public Mono<String> runTurnAsync(String chatId, String userText, TurnListener listener) {
            return Mono.fromCallable(() -> runTurn(chatId, userText, listener));
        }
    }
}
