package com.taskbot.domain.enums;

import java.util.Locale;

public enum TaskStatus {
    PENDING("pending"),
    IN_PROGRESS("in-progress"),
    BLOCKED("blocked"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isClosed() {
        return this == COMPLETED || this == CANCELLED;
    }

    public static TaskStatus fromWireName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TaskStatus status : values()) {
            if (status.wireName.equals(normalized)) {
                return status;
            }
        }
        return null;
    }
}
