package com.mealscout.tools.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mealscout.integrations.PlaceSearch;
import com.mealscout.integrations.PlacesClient;
import com.mealscout.model.ChatRecord;
import com.mealscout.model.GeoLocation;
import com.mealscout.service.impl.InMemoryChatStore;
import com.mealscout.tools.ToolResult;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SearchGoogleMapsToolTest {

    private final InMemoryChatStore chatStore = new InMemoryChatStore(new ObjectMapper());
    private final PlacesClient placesClient = mock(PlacesClient.class);
    private final SearchGoogleMapsTool tool = new SearchGoogleMapsTool(placesClient, chatStore);

    @Test
    void storesPlacesAndReturnsThemWithoutPhotos() {
        ChatRecord chat = chatStore.createChat(new GeoLocation(40.7, -74.0));
        when(placesClient.searchText(any())).thenReturn(List.of(
                Map.of("id", "p1", "displayName", Map.of("text", "Joe's"), "photos", List.of(Map.of("name", "ph1"))),
                Map.of("id", "p2", "displayName", Map.of("text", "Ray's"))));

        ToolResult result = tool.execute(Map.of("query", "pizza", "radius", 90000, "limit", "3"), chat.getChatId());

        ArgumentCaptor<PlaceSearch> search = ArgumentCaptor.forClass(PlaceSearch.class);
        verify(placesClient).searchText(search.capture());
        assertThat(search.getValue().location()).isEqualTo(new GeoLocation(40.7, -74.0));
        assertThat(search.getValue().clampedRadius()).isEqualTo(50_000);
        assertThat(search.getValue().clampedLimit()).isEqualTo(3);

        assertThat(result.error()).isFalse();
        List<?> returned = (List<?>) result.payload();
        assertThat(returned).hasSize(2);
        assertThat(((Map<?, ?>) returned.get(0)).containsKey("photos")).isFalse();

        assertThat(chatStore.findChat(chat.getChatId()).orElseThrow().getPlaces()).containsExactly("p1", "p2");
        assertThat(chatStore.findPlace("p1").orElseThrow()).containsKey("photos");
    }

    @Test
    void queryIsRequired() {
        ToolResult result = tool.execute(Map.of(), "chat-1");

        assertThat(result.errorMessage()).isEqualTo("query is required");
    }
}
