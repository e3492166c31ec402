package com.mealscout.assistant.dto;

import java.util.List;

/**
 * State of a run as last seen. {@code rawStatus} keeps the service's own value for messages and logs.
 */
public record RunSnapshot(String id, String threadId, RunStatus status, String rawStatus, List<PendingToolCall> toolCalls) {

    public RunSnapshot {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static RunSnapshot of(String id, String threadId, RunStatus status) {
        return new RunSnapshot(id, threadId, status, status.value(), List.of());
    }
}
