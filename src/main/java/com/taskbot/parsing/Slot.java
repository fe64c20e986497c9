package com.taskbot.parsing;

import java.util.List;

/**
 * Slot names shared by the rule matcher, the interpreter JSON and stored conversations.
 */
public final class Slot {

    public static final String TASK_ID = "taskId";
    public static final String REMINDER_ID = "reminderId";
    public static final String STATUS = "status";
    public static final String PROGRESS = "progress";
    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String PRIORITY = "priority";
    public static final String DEADLINE = "deadline";
    public static final String ASSIGNEE_NAME = "assigneeName";
    public static final String REMINDER_TIME = "reminderTime";
    public static final String REMINDER_TITLE = "reminderTitle";
    public static final String REMINDER_MESSAGE = "reminderMessage";
    public static final String MEETING_SUBJECT = "meetingSubject";
    public static final String MEETING_WITH = "meetingWith";
    public static final String MEETING_LOCATION = "meetingLocation";
    public static final String BLOCKER = "blocker";
    public static final String MESSAGE = "message";
    public static final String STATUS_FILTER = "statusFilter";
    public static final String PRIORITY_FILTER = "priorityFilter";
    public static final String OVERDUE_FILTER = "overdueFilter";
    public static final String PERIOD = "period";

    public static final List<String> ALL = List.of(
            TASK_ID, REMINDER_ID, STATUS, PROGRESS, TITLE, DESCRIPTION, PRIORITY, DEADLINE,
            ASSIGNEE_NAME, REMINDER_TIME, REMINDER_TITLE, REMINDER_MESSAGE, MEETING_SUBJECT,
            MEETING_WITH, MEETING_LOCATION, BLOCKER, MESSAGE, STATUS_FILTER, PRIORITY_FILTER,
            OVERDUE_FILTER, PERIOD);

    private Slot() {
    }
}
