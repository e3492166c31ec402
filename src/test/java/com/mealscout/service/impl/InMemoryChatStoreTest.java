package com.mealscout.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mealscout.model.ChatMessage;
import com.mealscout.model.ChatRecord;
import com.mealscout.model.GeoLocation;
import com.mealscout.service.ChatNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryChatStoreTest {

    private final InMemoryChatStore store = new InMemoryChatStore(new ObjectMapper());

    @Test
    void createdChatIsEmptyAndFindable() {
        ChatRecord chat = store.createChat(new GeoLocation(1.0, 2.0));

        ChatRecord found = store.findChat(chat.getChatId()).orElseThrow();
        assertThat(found.getMessages()).isEmpty();
        assertThat(found.getPlaces()).isEmpty();
        assertThat(found.getThreadId()).isNull();
        assertThat(found.getLocation()).isEqualTo(new GeoLocation(1.0, 2.0));
        assertThat(found.getCreatedAt()).isPositive();
    }

    @Test
    void returnedRecordsAreCopies() {
        ChatRecord chat = store.createChat(null);
        store.findChat(chat.getChatId()).orElseThrow().getMessages().add(ChatMessage.user("sneaky"));

        assertThat(store.findChat(chat.getChatId()).orElseThrow().getMessages()).isEmpty();
    }

    @Test
    void writesToUnknownChatFail() {
        assertThatThrownBy(() -> store.appendMessage("ghost", ChatMessage.user("hi")))
                .isInstanceOf(ChatNotFoundException.class)
                .hasMessage("Chat not found: ghost");
        assertThat(store.findChat("ghost")).isEmpty();
    }

    @Test
    void listIsNewestFirst() {
        ChatRecord first = store.createChat(null);
        ChatRecord second = store.createChat(null);
        store.appendPlaceIds(second.getChatId(), List.of("p1", "p2"));

        List<ChatRecord> chats = store.listChats();

        assertThat(chats).hasSize(2);
        assertThat(chats.get(0).getCreatedAt()).isGreaterThanOrEqualTo(chats.get(1).getCreatedAt());
        assertThat(chats).extracting(ChatRecord::getChatId)
                .containsExactlyInAnyOrder(first.getChatId(), second.getChatId());
    }

    @Test
    void savePlacesKeepsExistingDocuments() {
        store.savePlaces(List.of(Map.of("id", "p1", "displayName", Map.of("text", "Original"))));
        store.updatePlaceField("p1", "photos", List.of(Map.of("name", "photo-1", "description", "tacos")));

        store.savePlaces(List.of(
                Map.of("id", "p1", "displayName", Map.of("text", "Replacement")),
                Map.of("displayName", Map.of("text", "No id"))));

        Map<String, Object> place = store.findPlace("p1").orElseThrow();
        assertThat(place).containsEntry("place_id", "p1");
        assertThat(place.get("displayName")).isEqualTo(Map.of("text", "Original"));
        assertThat(place).containsKey("photos");
    }

    @Test
    void summaryHasOnlyIdentifyingFields() {
        store.savePlaces(List.of(Map.of(
                "id", "p1",
                "displayName", Map.of("text", "Joe's"),
                "editorialSummary", Map.of("text", "Pizza"),
                "rating", 4.5)));

        assertThat(store.findPlaceSummary("p1").orElseThrow())
                .containsOnlyKeys("place_id", "displayName", "editorialSummary");
        assertThat(store.findPlaceSummary("p2")).isEmpty();
    }
}
