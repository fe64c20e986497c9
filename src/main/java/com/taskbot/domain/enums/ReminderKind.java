package com.taskbot.domain.enums;

public enum ReminderKind {
    REMINDER("REM-"),
    MEETING("MTG-");

    private final String referencePrefix;

    ReminderKind(String referencePrefix) {
        this.referencePrefix = referencePrefix;
    }

    public String referencePrefix() {
        return referencePrefix;
    }
}
