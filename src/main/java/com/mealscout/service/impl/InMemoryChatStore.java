package com.mealscout.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mealscout.model.ChatMessage;
import com.mealscout.model.ChatRecord;
import com.mealscout.model.GeoLocation;
import com.mealscout.service.ChatNotFoundException;
import com.mealscout.service.ChatStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

@Service
@ConditionalOnProperty(name = "chat.store.storage", havingValue = "in-memory", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class InMemoryChatStore implements ChatStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Map<String, ChatRecord> chats = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> places = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;

    @Override
    public ChatRecord createChat(GeoLocation location) {
        ChatRecord chat = ChatRecord.builder()
                .chatId(UUID.randomUUID().toString())
                .location(location)
                .createdAt(Instant.now().getEpochSecond())
                .build();
        chats.put(chat.getChatId(), chat);
        log.info("Created chat chatId={}", chat.getChatId());
        return chat.copy();
    }

    @Override
    public Optional<ChatRecord> findChat(String chatId) {
        if (chatId == null) {
            return Optional.empty();
        }
        ChatRecord chat = chats.get(chatId);
        if (chat == null) {
            log.debug("No chat found chatId={}", chatId);
            return Optional.empty();
        }
        synchronized (chat) {
            return Optional.of(chat.copy());
        }
    }

    @Override
    public List<ChatRecord> listChats() {
        return chats.values().stream()
                .map(chat -> {
                    synchronized (chat) {
                        return chat.copy();
                    }
                })
                .sorted(Comparator.comparingLong(ChatRecord::getCreatedAt).reversed())
                .toList();
    }

    @Override
    public void updateThreadId(String chatId, String threadId) {
        mutateChat(chatId, chat -> chat.setThreadId(threadId));
        log.debug("Stored threadId={} chatId={}", threadId, chatId);
    }

    @Override
    public void appendMessage(String chatId, ChatMessage message) {
        mutateChat(chatId, chat -> chat.getMessages().add(message));
        log.debug("Appended {} message chatId={}", message.role(), chatId);
    }

    @Override
    public void appendPlaceIds(String chatId, List<String> placeIds) {
        mutateChat(chatId, chat -> chat.getPlaces().addAll(placeIds));
        log.debug("Appended {} place id(s) chatId={}", placeIds.size(), chatId);
    }

    @Override
    public void savePlaces(List<Map<String, Object>> documents) {
        int inserted = 0;
        for (Map<String, Object> document : documents) {
            Object id = document.get("id");
            if (id == null) {
                continue;
            }
            Map<String, Object> stored = deepCopy(document);
            stored.put(PLACE_ID, id.toString());
            if (places.putIfAbsent(id.toString(), stored) == null) {
                inserted++;
            }
        }
        log.debug("Saved places received={} inserted={}", documents.size(), inserted);
    }

    @Override
    public Optional<Map<String, Object>> findPlace(String placeId) {
        if (placeId == null) {
            return Optional.empty();
        }
        Map<String, Object> place = places.get(placeId);
        if (place == null) {
            return Optional.empty();
        }
        synchronized (place) {
            return Optional.of(deepCopy(place));
        }
    }

    @Override
    public void updatePlaceField(String placeId, String field, Object value) {
        Map<String, Object> place = places.computeIfAbsent(placeId, id -> {
            Map<String, Object> created = new LinkedHashMap<>();
            created.put(PLACE_ID, id);
            return created;
        });
        synchronized (place) {
            place.put(field, value);
        }
        log.debug("Updated place field '{}' placeId={}", field, placeId);
    }

    @Override
    public Optional<Map<String, Object>> findPlaceSummary(String placeId) {
        return findPlace(placeId).map(PlaceSummaries::of);
    }

    private void mutateChat(String chatId, Consumer<ChatRecord> mutation) {
        ChatRecord chat = chatId == null ? null : chats.get(chatId);
        if (chat == null) {
            throw new ChatNotFoundException(chatId);
        }
        synchronized (chat) {
            mutation.accept(chat);
        }
    }

    private Map<String, Object> deepCopy(Map<String, Object> document) {
        return new LinkedHashMap<>(objectMapper.convertValue(document, MAP_TYPE));
    }
}
