package com.mealscout.service;

import com.mealscout.model.ChatMessage;
import com.mealscout.model.ChatRecord;
import com.mealscout.model.GeoLocation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Document store for chats and cached places.
 *
 * <p>Reads never throw for unknown ids. Chat writes against an unknown id throw
 * {@link ChatNotFoundException}; place writes create the document when it is missing.</p>
 */
public interface ChatStore {

    String PLACE_ID = "place_id";

    ChatRecord createChat(GeoLocation location);

    Optional<ChatRecord> findChat(String chatId);

    /**
     * All chats, newest first.
     */
    List<ChatRecord> listChats();

    void updateThreadId(String chatId, String threadId);

    void appendMessage(String chatId, ChatMessage message);

    void appendPlaceIds(String chatId, List<String> placeIds);

    /**
     * Stores provider place documents keyed by their {@code id}. Existing documents are kept as they are.
     */
    void savePlaces(List<Map<String, Object>> places);

    Optional<Map<String, Object>> findPlace(String placeId);

    void updatePlaceField(String placeId, String field, Object value);

    /**
     * {@code place_id}, {@code displayName} and {@code editorialSummary} of a cached place.
     */
    Optional<Map<String, Object>> findPlaceSummary(String placeId);
}
