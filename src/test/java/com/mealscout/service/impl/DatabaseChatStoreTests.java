package com.mealscout.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mealscout.model.ChatMessage;
import com.mealscout.model.ChatRecord;
import com.mealscout.service.ChatNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DatabaseChatStoreTests {

    private static final String CHAT_JSON = """
            {"chat_id":"c1","messages":[{"role":"user","content":"hi"}],"places":[],"thread_id":"thread_1","location":null,"created_at":1700000000}
            """;

    private NamedParameterJdbcTemplate jdbcTemplate;
    private DatabaseChatStore store;

    @BeforeEach
    void setUp() {
        jdbcTemplate = Mockito.mock(NamedParameterJdbcTemplate.class);
        store = new DatabaseChatStore(jdbcTemplate, new ObjectMapper());
    }

    @Test
    void findChatReadsSnakeCasePayload() {
        doReturn(List.of(new DatabaseChatStore.VersionedPayload(CHAT_JSON, 3)))
                .when(jdbcTemplate).query(contains("FROM chat_documents WHERE"), any(SqlParameterSource.class), any(RowMapper.class));

        ChatRecord chat = store.findChat("c1").orElseThrow();

        assertThat(chat.getChatId()).isEqualTo("c1");
        assertThat(chat.getThreadId()).isEqualTo("thread_1");
        assertThat(chat.getMessages()).containsExactly(ChatMessage.user("hi"));
        assertThat(chat.getCreatedAt()).isEqualTo(1700000000L);
    }

    @Test
    void appendMessageRetriesAfterConcurrentUpdate() {
        doReturn(List.of(new DatabaseChatStore.VersionedPayload(CHAT_JSON, 3)),
                List.of(new DatabaseChatStore.VersionedPayload(CHAT_JSON, 4)))
                .when(jdbcTemplate).query(anyString(), any(SqlParameterSource.class), any(RowMapper.class));
        when(jdbcTemplate.update(startsWith("UPDATE chat_documents"), any(SqlParameterSource.class))).thenReturn(0, 1);

        store.appendMessage("c1", ChatMessage.assistant("Try Joe's"));

        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbcTemplate, times(2)).update(startsWith("UPDATE chat_documents"), params.capture());
        SqlParameterSource last = params.getAllValues().get(1);
        assertThat(last.getValue("version")).isEqualTo(4L);
        assertThat((String) last.getValue("payload")).contains("\"content\":\"Try Joe's\"");
    }

    @Test
    void appendMessageToUnknownChatFails() {
        doReturn(List.of()).when(jdbcTemplate).query(anyString(), any(SqlParameterSource.class), any(RowMapper.class));

        assertThatThrownBy(() -> store.appendMessage("ghost", ChatMessage.user("hi")))
                .isInstanceOf(ChatNotFoundException.class);
        verify(jdbcTemplate, never()).update(anyString(), any(SqlParameterSource.class));
    }

    @Test
    void listChatsKeepsDatabaseOrder() {
        String older = CHAT_JSON.replace("\"c1\"", "\"c0\"");
        doReturn(List.of(CHAT_JSON, older))
                .when(jdbcTemplate).query(startsWith("SELECT payload FROM chat_documents ORDER BY"),
                        any(SqlParameterSource.class), any(RowMapper.class));

        List<ChatRecord> chats = store.listChats();

        assertThat(chats).extracting(ChatRecord::getChatId).containsExactly("c1", "c0");
    }

    @Test
    void savePlacesInsertsOnlyDocumentsWithId() {
        store.savePlaces(List.of(
                Map.of("id", "p1", "displayName", Map.of("text", "Joe's")),
                Map.of("displayName", Map.of("text", "anonymous"))));

        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbcTemplate).update(contains("INSERT IGNORE INTO place_documents"), params.capture());
        assertThat(params.getValue().getValue("placeId")).isEqualTo("p1");
        assertThat((String) params.getValue().getValue("payload")).contains("\"place_id\":\"p1\"");
    }

    @Test
    void updatePlaceFieldCreatesMissingDocument() {
        doReturn(List.of()).when(jdbcTemplate).query(anyString(), any(SqlParameterSource.class), any(RowMapper.class));
        when(jdbcTemplate.update(contains("INSERT IGNORE"), any(SqlParameterSource.class))).thenReturn(1);

        store.updatePlaceField("p9", "yelpData", Map.of("rating", 4.0));

        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbcTemplate).update(contains("INSERT IGNORE"), params.capture());
        assertThat((String) params.getValue().getValue("payload")).contains("\"yelpData\":{\"rating\":4.0}");
    }
}
