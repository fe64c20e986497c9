package com.taskbot.domain.enums;

public enum ReminderStatus {
    PENDING,
    SENT,
    CANCELLED
}
