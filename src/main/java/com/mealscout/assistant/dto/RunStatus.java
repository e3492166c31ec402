package com.mealscout.assistant.dto;

import java.util.Locale;

public enum RunStatus {
    QUEUED("queued"),
    IN_PROGRESS("in_progress"),
    REQUIRES_ACTION("requires_action"),
    CANCELLING("cancelling"),
    COMPLETED("completed"),
    FAILED("failed"),
    EXPIRED("expired"),
    CANCELLED("cancelled"),
    INCOMPLETE("incomplete"),
    UNKNOWN("unknown");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static RunStatus fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RunStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
