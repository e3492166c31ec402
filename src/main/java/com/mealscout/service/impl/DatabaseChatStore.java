package com.mealscout.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mealscout.model.ChatMessage;
import com.mealscout.model.ChatRecord;
import com.mealscout.model.GeoLocation;
import com.mealscout.service.ChatNotFoundException;
import com.mealscout.service.ChatStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Stores chats and places as JSON documents in two tables. Every row carries a version
 * column; read-modify-write updates only succeed against the version they read.
 */
@Service
@ConditionalOnProperty(name = "chat.store.storage", havingValue = "database")
@ConditionalOnBean(NamedParameterJdbcTemplate.class)
@RequiredArgsConstructor
@Slf4j
public class DatabaseChatStore implements ChatStore {

    static final int MAX_WRITE_ATTEMPTS = 5;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final RowMapper<VersionedPayload> VERSIONED_ROW =
            (rs, rowNum) -> new VersionedPayload(rs.getString("payload"), rs.getLong("version"));

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    record VersionedPayload(String payload, long version) {}

    @Override
    public ChatRecord createChat(GeoLocation location) {
        ChatRecord chat = ChatRecord.builder()
                .chatId(UUID.randomUUID().toString())
                .location(location)
                .createdAt(Instant.now().getEpochSecond())
                .build();

        SqlParameterSource params = new MapSqlParameterSource()
                .addValue("chatId", chat.getChatId())
                .addValue("createdAt", chat.getCreatedAt())
                .addValue("payload", write(chat));
        jdbcTemplate.update("""
                INSERT INTO chat_documents (chat_id, created_at, version, payload)
                VALUES (:chatId, :createdAt, 0, :payload)
                """, params);
        log.info("Created chat chatId={}", chat.getChatId());
        return chat;
    }

    @Override
    public Optional<ChatRecord> findChat(String chatId) {
        if (chatId == null) {
            return Optional.empty();
        }
        return loadChat(chatId).map(row -> readChat(row.payload()));
    }

    @Override
    public List<ChatRecord> listChats() {
        List<String> payloads = jdbcTemplate.query(
                "SELECT payload FROM chat_documents ORDER BY created_at DESC",
                new MapSqlParameterSource(),
                (rs, rowNum) -> rs.getString("payload"));
        log.debug("Database chat listing -> {} chat(s)", payloads.size());
        return payloads.stream().map(this::readChat).toList();
    }

    @Override
    public void updateThreadId(String chatId, String threadId) {
        mutateChat(chatId, chat -> chat.setThreadId(threadId));
    }

    @Override
    public void appendMessage(String chatId, ChatMessage message) {
        mutateChat(chatId, chat -> chat.getMessages().add(message));
    }

    @Override
    public void appendPlaceIds(String chatId, List<String> placeIds) {
        mutateChat(chatId, chat -> chat.getPlaces().addAll(placeIds));
    }

    @Override
    public void savePlaces(List<Map<String, Object>> documents) {
        int inserted = 0;
        for (Map<String, Object> document : documents) {
            Object id = document.get("id");
            if (id == null) {
                continue;
            }
            Map<String, Object> stored = new LinkedHashMap<>(document);
            stored.put(PLACE_ID, id.toString());
            inserted += insertPlaceIfAbsent(id.toString(), stored);
        }
        log.debug("Saved places received={} inserted={}", documents.size(), inserted);
    }

    @Override
    public Optional<Map<String, Object>> findPlace(String placeId) {
        if (placeId == null) {
            return Optional.empty();
        }
        return loadPlace(placeId).map(row -> readPlace(row.payload()));
    }

    @Override
    public void updatePlaceField(String placeId, String field, Object value) {
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            Optional<VersionedPayload> current = loadPlace(placeId);
            if (current.isEmpty()) {
                Map<String, Object> created = new LinkedHashMap<>();
                created.put(PLACE_ID, placeId);
                created.put(field, value);
                if (insertPlaceIfAbsent(placeId, created) == 1) {
                    return;
                }
                continue;
            }
            Map<String, Object> place = readPlace(current.get().payload());
            place.put(field, value);
            SqlParameterSource params = new MapSqlParameterSource()
                    .addValue("placeId", placeId)
                    .addValue("version", current.get().version())
                    .addValue("payload", write(place));
            int updated = jdbcTemplate.update("""
                    UPDATE place_documents SET payload = :payload, version = version + 1
                    WHERE place_id = :placeId AND version = :version
                    """, params);
            if (updated == 1) {
                log.debug("Updated place field '{}' placeId={}", field, placeId);
                return;
            }
            log.debug("Place placeId={} changed concurrently, attempt {}", placeId, attempt);
        }
        throw new IllegalStateException("Could not update place " + placeId + " after " + MAX_WRITE_ATTEMPTS + " attempts");
    }

    @Override
    public Optional<Map<String, Object>> findPlaceSummary(String placeId) {
        return findPlace(placeId).map(PlaceSummaries::of);
    }

    private void mutateChat(String chatId, Consumer<ChatRecord> mutation) {
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            VersionedPayload current = loadChat(chatId).orElseThrow(() -> new ChatNotFoundException(chatId));
            ChatRecord chat = readChat(current.payload());
            mutation.accept(chat);
            SqlParameterSource params = new MapSqlParameterSource()
                    .addValue("chatId", chatId)
                    .addValue("version", current.version())
                    .addValue("payload", write(chat));
            int updated = jdbcTemplate.update("""
                    UPDATE chat_documents SET payload = :payload, version = version + 1
                    WHERE chat_id = :chatId AND version = :version
                    """, params);
            if (updated == 1) {
                log.debug("Updated chat chatId={} version={}", chatId, current.version() + 1);
                return;
            }
            log.debug("Chat chatId={} changed concurrently, attempt {}", chatId, attempt);
        }
        throw new IllegalStateException("Could not update chat " + chatId + " after " + MAX_WRITE_ATTEMPTS + " attempts");
    }

    private Optional<VersionedPayload> loadChat(String chatId) {
        List<VersionedPayload> rows = jdbcTemplate.query(
                "SELECT payload, version FROM chat_documents WHERE chat_id = :chatId",
                new MapSqlParameterSource("chatId", chatId),
                VERSIONED_ROW);
        return rows.stream().findFirst();
    }

    private Optional<VersionedPayload> loadPlace(String placeId) {
        List<VersionedPayload> rows = jdbcTemplate.query(
                "SELECT payload, version FROM place_documents WHERE place_id = :placeId",
                new MapSqlParameterSource("placeId", placeId),
                VERSIONED_ROW);
        return rows.stream().findFirst();
    }

    private int insertPlaceIfAbsent(String placeId, Map<String, Object> document) {
        SqlParameterSource params = new MapSqlParameterSource()
                .addValue("placeId", placeId)
                .addValue("payload", write(document));
        return jdbcTemplate.update("""
                INSERT IGNORE INTO place_documents (place_id, version, payload)
                VALUES (:placeId, 0, :payload)
                """, params);
    }

    private ChatRecord readChat(String payload) {
        try {
            return objectMapper.readValue(payload, ChatRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt chat document: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> readPlace(String payload) {
        try {
            return new LinkedHashMap<>(objectMapper.readValue(payload, MAP_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt place document: " + e.getOriginalMessage(), e);
        }
    }

    private String write(Object document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize document: " + e.getOriginalMessage(), e);
        }
    }
}
