package com.taskbot.conversation;

import com.taskbot.parsing.IntentKind;
import com.taskbot.parsing.Slot;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Slots an intent needs before it can be dispatched, and the question asked for each.
 */
public final class SlotRequirements {

    private static final Map<IntentKind, List<String>> REQUIRED = new EnumMap<>(IntentKind.class);

    private static final Map<String, String> PROMPTS = Map.ofEntries(
            Map.entry(Slot.TITLE, "What is the task title?\n\nExample: \"Review budget report\""),
            Map.entry(Slot.ASSIGNEE_NAME, "Who should this task be assigned to?\n\nReply with a name or email."),
            Map.entry(Slot.TASK_ID, "Which task? Reply with the task reference.\n\nExample: \"TASK-2026-0001\""),
            Map.entry(Slot.STATUS, "What is the new status?\n\nOptions: pending, in-progress, blocked, completed, cancelled"),
            Map.entry(Slot.PROGRESS, "What is the progress percentage (0-100)?\n\nExample: \"75%\""),
            Map.entry(Slot.REMINDER_ID, "Which reminder? Reply with the reference.\n\nExample: \"REM-2026-0001\""),
            Map.entry(Slot.MESSAGE, "What update should be added to the task?"),
            Map.entry(Slot.BLOCKER, "What is blocking this task?")
    );

    private static final String REMINDER_TIME_PROMPT =
            "When should I remind you?\n\nExamples: \"at 3pm tomorrow\", \"in 30 minutes\", \"on 15 March at 10am\"";
    private static final String MEETING_TIME_PROMPT =
            "When is the meeting?\n\nExamples: \"tomorrow at 11am\", \"friday 2:30pm\", \"on 15 March at 10am\"";

    private static final Map<String, String> VALUE_LABELS = Map.of(
            Slot.STATUS, "status",
            Slot.PROGRESS, "progress percentage",
            Slot.REMINDER_TIME, "time",
            Slot.DEADLINE, "date",
            Slot.PRIORITY, "priority",
            Slot.TASK_ID, "task reference",
            Slot.REMINDER_ID, "reminder reference");

    static {
        REQUIRED.put(IntentKind.CREATE_TASK, List.of(Slot.TITLE));
        REQUIRED.put(IntentKind.ASSIGN_TASK, List.of(Slot.TITLE, Slot.ASSIGNEE_NAME));
        REQUIRED.put(IntentKind.UPDATE_STATUS, List.of(Slot.TASK_ID, Slot.STATUS));
        REQUIRED.put(IntentKind.UPDATE_PROGRESS, List.of(Slot.TASK_ID, Slot.PROGRESS));
        REQUIRED.put(IntentKind.UPDATE_STATUS_AND_PROGRESS, List.of(Slot.TASK_ID, Slot.STATUS));
        REQUIRED.put(IntentKind.VIEW_TASK, List.of(Slot.TASK_ID));
        REQUIRED.put(IntentKind.CANCEL_TASK, List.of(Slot.TASK_ID));
        REQUIRED.put(IntentKind.ADD_UPDATE, List.of(Slot.TASK_ID, Slot.MESSAGE));
        REQUIRED.put(IntentKind.REPORT_BLOCKER, List.of(Slot.TASK_ID, Slot.BLOCKER));
        REQUIRED.put(IntentKind.SET_REMINDER, List.of(Slot.REMINDER_TIME));
        REQUIRED.put(IntentKind.SCHEDULE_MEETING, List.of(Slot.REMINDER_TIME));
        REQUIRED.put(IntentKind.CANCEL_REMINDER, List.of(Slot.REMINDER_ID));
    }

    private SlotRequirements() {
    }

    public static List<String> required(IntentKind kind) {
        return REQUIRED.getOrDefault(kind, List.of());
    }

    public static String prompt(IntentKind kind, String slot) {
        if (Slot.REMINDER_TIME.equals(slot)) {
            return kind == IntentKind.SCHEDULE_MEETING ? MEETING_TIME_PROMPT : REMINDER_TIME_PROMPT;
        }
        return PROMPTS.getOrDefault(slot, "Please provide the " + slot + ".");
    }

    /**
     * Line put in front of a prompt when the previous answer for the slot could not be used.
     */
    public static String correction(String slot, String rejectedValue) {
        String label = VALUE_LABELS.getOrDefault(slot, slot);
        return "\"" + rejectedValue + "\" is not a valid " + label + ".";
    }
}
