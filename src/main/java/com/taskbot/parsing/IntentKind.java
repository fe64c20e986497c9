package com.taskbot.parsing;

import java.util.Locale;
import java.util.Set;

public enum IntentKind {
    CREATE_TASK("createTask"),
    ASSIGN_TASK("assignTask"),
    UPDATE_STATUS("updateTaskStatus", "updateStatus"),
    UPDATE_PROGRESS("updateTaskProgress", "updateProgress"),
    UPDATE_STATUS_AND_PROGRESS("updateTaskStatusAndProgress", "updateStatusAndProgress"),
    ADD_UPDATE("addTaskUpdate", "addUpdate"),
    REPORT_BLOCKER("reportBlocker"),
    CANCEL_TASK("cancelTask", "deleteTask"),
    VIEW_TASK("viewTask"),
    LIST_TASKS("listTasks"),
    LIST_DEADLINES("listDeadlines"),
    SET_REMINDER("setReminder"),
    SCHEDULE_MEETING("scheduleMeeting"),
    LIST_REMINDERS("listReminders", "viewReminders"),
    LIST_MEETINGS("listMeetings", "viewMeetings"),
    CANCEL_REMINDER("cancelReminder", "deleteReminder", "cancelMeeting", "deleteMeeting"),
    STATUS("status"),
    HELP("help"),
    WELCOME("welcome"),
    UNKNOWN("unknown");

    private final String wireName;
    private final Set<String> aliases;

    IntentKind(String wireName, String... aliases) {
        this.wireName = wireName;
        this.aliases = Set.of(aliases);
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves the camel-case action name used in interpreter JSON. Unrecognized names map to {@link #UNKNOWN}.
     */
    public static IntentKind fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String trimmed = value.trim();
        for (IntentKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(trimmed) || kind.name().equalsIgnoreCase(trimmed)) {
                return kind;
            }
            for (String alias : kind.aliases) {
                if (alias.toLowerCase(Locale.ROOT).equals(trimmed.toLowerCase(Locale.ROOT))) {
                    return kind;
                }
            }
        }
        return UNKNOWN;
    }
}
