package com.mealscout.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A chat document: message log, assistant thread handle, optional user location and the
 * ids of places mentioned so far. Serialized with snake_case keys.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChatRecord {

    private String chatId;

    @Builder.Default
    private List<ChatMessage> messages = new ArrayList<>();

    @Builder.Default
    private List<String> places = new ArrayList<>();

    private String threadId;

    private GeoLocation location;

    /**
     * Epoch seconds.
     */
    private long createdAt;

    public ChatRecord copy() {
        return ChatRecord.builder()
                .chatId(chatId)
                .messages(new ArrayList<>(messages))
                .places(new ArrayList<>(places))
                .threadId(threadId)
                .location(location)
                .createdAt(createdAt)
                .build();
    }
}
