package com.taskbot.messaging;

import com.taskbot.config.AssistantProperties;
import com.taskbot.domain.enums.ReminderKind;
import com.taskbot.domain.enums.TaskStatus;
import com.taskbot.domain.model.ReminderRecord;
import com.taskbot.domain.model.Task;
import com.taskbot.domain.model.User;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Outbound WhatsApp texts. Every message starts with the configured brand header.
 */
@Component
public class MessageTemplates {

    private static final DateTimeFormatter DATE_FMT = DateTimeFormatter.ofPattern("dd MMM yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter LONG_DATE_FMT = DateTimeFormatter.ofPattern("EEEE, d MMMM yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter SHORT_DATE_FMT = DateTimeFormatter.ofPattern("EEE, d MMM", Locale.ENGLISH);
    private static final DateTimeFormatter TIME_FMT = DateTimeFormatter.ofPattern("hh:mm a", Locale.ENGLISH);

    private static final int TASK_LIST_LIMIT = 10;

    private final String brand;
    private final ZoneId zoneId;

    public MessageTemplates(AssistantProperties properties) {
        this.brand = properties.resolveBrand();
        this.zoneId = properties.resolveZone();
    }

    public ZoneId zoneId() {
        return zoneId;
    }

    public record TaskStats(long open, long inProgress, long dueToday, long overdue, long completed) {

        public static TaskStats of(List<Task> tasks, OffsetDateTime now, ZoneId zoneId) {
            LocalDate today = now.atZoneSameInstant(zoneId).toLocalDate();
            long open = 0;
            long inProgress = 0;
            long dueToday = 0;
            long overdue = 0;
            long completed = 0;
            for (Task task : tasks) {
                if (task.getStatus() == TaskStatus.COMPLETED) {
                    completed++;
                }
                if (task.getStatus().isClosed()) {
                    continue;
                }
                open++;
                if (task.getStatus() == TaskStatus.IN_PROGRESS) {
                    inProgress++;
                }
                if (task.isOverdue(now)) {
                    overdue++;
                } else if (task.getDeadline() != null
                        && task.getDeadline().atZoneSameInstant(zoneId).toLocalDate().equals(today)) {
                    dueToday++;
                }
            }
            return new TaskStats(open, inProgress, dueToday, overdue, completed);
        }
    }

    public String welcome(User user) {
        return header("WhatsApp Integration")
                + "Hello " + user.getFirstName() + ", your account is connected. You can manage tasks using simple commands:\n\n"
                + "CREATE TASK:\n"
                + "\"Create task: Review budget report by Friday\"\n"
                + "\"New task: Prepare presentation, high priority, due tomorrow\"\n\n"
                + "UPDATE TASK:\n"
                + "\"TASK-2026-0001 progress 50%\"\n"
                + "\"TASK-2026-0001 is completed\"\n\n"
                + "VIEW TASKS:\n"
                + "\"Show my tasks\"\n"
                + "\"List pending tasks\"\n\n"
                + "VOICE NOTES:\n"
                + "Send a voice note describing your task update.\n\n"
                + "Type \"help\" for the complete command list.";
    }

    public String help() {
        return header("Command Reference")
                + "TASK MANAGEMENT:\n"
                + "- \"Create task: [title]\"\n"
                + "- \"Create task: [title], priority [low/medium/high/critical], due [date]\"\n"
                + "- \"Show my tasks\" / \"Show task [ID]\"\n"
                + "- \"Deadlines\"\n\n"
                + "FOR MANAGERS:\n"
                + "- \"Assign task: [title] to [name/email]\"\n"
                + "- \"Create task for [name]: [title]\"\n\n"
                + "STATUS UPDATES:\n"
                + "- \"[ID] progress 50%\"\n"
                + "- \"[ID] is completed\"\n"
                + "- \"[ID] blocked: [reason]\"\n"
                + "- \"Update [ID]: [comment]\"\n\n"
                + "REMINDERS AND MEETINGS:\n"
                + "- \"Remind me to [something] at 3pm tomorrow\"\n"
                + "- \"Schedule meeting with [person] about [subject] at [time]\"\n"
                + "- \"My reminders\" / \"My meetings this week\"\n"
                + "- \"Cancel reminder [ID]\"\n\n"
                + "OTHER:\n"
                + "- \"status\" - your task summary\n"
                + "- \"cancel\" - abandon a command in progress";
    }

    public String notRegistered() {
        return header("Registration Required")
                + "Your WhatsApp number is not linked to an account.\n\n"
                + "Please update your profile with your WhatsApp number to use this service.";
    }

    public String notificationsDisabled() {
        return header("Notifications Disabled")
                + "WhatsApp notifications are turned off for your account. Enable them in your profile to use this service.";
    }

    public String error(String message) {
        return header("Error") + message + "\n\nType \"help\" for available commands.";
    }

    public String genericError() {
        return error("Something went wrong while processing your request. Please try again.");
    }

    public String voiceFailure() {
        return error("Could not transcribe your voice note. Please try again or type your message.");
    }

    public String accountInactive() {
        return header("Account Inactive")
                + "Your account is not active. Please contact your administrator.";
    }

    public String voiceReceived(String transcript) {
        return header("Voice Note Received")
                + "Transcription: \"" + transcript + "\"\n\nProcessing your request...";
    }

    public String notUnderstood() {
        return header("Not Understood")
                + "I could not understand that message.\n\nType \"help\" for available commands.";
    }

    public String prompt(String question) {
        return header("More Details Needed") + question + "\n\nReply \"cancel\" to cancel this action.";
    }

    public String actionCancelled() {
        return header("Cancelled") + "The pending action has been cancelled.";
    }

    public String nothingToCancel() {
        return header("Nothing to Cancel") + "There is no action in progress.";
    }

    public String taskCreated(Task task) {
        return header("Task Created")
                + "Title: " + task.getTitle() + "\n"
                + "Reference: " + task.getReference() + "\n"
                + "Priority: " + task.getPriority().name() + "\n"
                + "Deadline: " + formatDate(task.getDeadline(), "Not specified") + "\n"
                + "Assigned to: " + (task.getAssignedTo() == null ? "You" : task.getAssignedTo().displayName()) + "\n\n"
                + "You will receive reminders before the deadline.";
    }

    public String taskAssigned(Task task) {
        StringBuilder sb = new StringBuilder(header("New Task Assignment"))
                .append("Title: ").append(task.getTitle()).append("\n")
                .append("Reference: ").append(task.getReference()).append("\n")
                .append("Priority: ").append(task.getPriority().name()).append("\n")
                .append("Deadline: ").append(formatDate(task.getDeadline(), "Not specified")).append("\n")
                .append("Assigned by: ").append(task.getAssignedBy() == null ? "Management" : task.getAssignedBy().displayName());
        if (task.getDescription() != null) {
            sb.append("\n\nDescription:\n").append(task.getDescription());
        }
        sb.append("\n\nPlease acknowledge receipt and provide updates as you progress.");
        return sb.toString();
    }

    public String taskAssignedConfirmation(Task task) {
        return header("Task Assigned")
                + "Title: " + task.getTitle() + "\n"
                + "Reference: " + task.getReference() + "\n"
                + "Assigned to: " + task.getAssignedTo().displayName() + "\n"
                + "Deadline: " + formatDate(task.getDeadline(), "Not specified");
    }

    public String taskUpdated(Task task, String change) {
        return header("Task Updated")
                + "Title: " + task.getTitle() + "\n"
                + "Reference: " + task.getReference() + "\n"
                + "Status: " + task.getStatus().wireName().toUpperCase(Locale.ROOT) + "\n"
                + "Progress: " + task.getProgress() + "%\n\n"
                + change;
    }

    public String updateAdded(Task task, String message) {
        return header("Update Added")
                + "Reference: " + task.getReference() + "\n"
                + "Title: " + task.getTitle() + "\n\n"
                + "Update: " + message;
    }

    public String blockerReported(Task task) {
        return header("Blocker Reported")
                + "Reference: " + task.getReference() + "\n"
                + "Title: " + task.getTitle() + "\n"
                + "Blocker: " + task.getBlocker() + "\n\n"
                + "The task has been marked as blocked.";
    }

    public String blockerAlert(Task task, User reporter) {
        return header("Task Blocked")
                + reporter.displayName() + " reported a blocker.\n\n"
                + "Reference: " + task.getReference() + "\n"
                + "Title: " + task.getTitle() + "\n"
                + "Blocker: " + task.getBlocker();
    }

    public String taskCancelled(Task task) {
        return header("Task Cancelled")
                + "Reference: " + task.getReference() + "\n"
                + "Title: " + task.getTitle() + "\n\n"
                + "This task has been cancelled.";
    }

    public String taskDetails(Task task, OffsetDateTime now) {
        StringBuilder sb = new StringBuilder(header("Task Details"))
                .append("Title: ").append(task.getTitle()).append("\n")
                .append("Reference: ").append(task.getReference()).append("\n")
                .append("Status: ").append(task.getStatus().wireName().toUpperCase(Locale.ROOT)).append("\n")
                .append("Priority: ").append(task.getPriority().name()).append("\n")
                .append("Progress: ").append(task.getProgress()).append("%\n")
                .append("Deadline: ").append(formatDateTime(task.getDeadline(), "Not set"));
        if (task.isOverdue(now)) {
            sb.append(" (OVERDUE)");
        }
        if (task.getAssignedTo() != null) {
            sb.append("\nAssigned to: ").append(task.getAssignedTo().displayName());
        }
        if (task.getDescription() != null) {
            sb.append("\n\nDescription:\n").append(task.getDescription());
        }
        if (task.getBlocker() != null && task.getStatus() == TaskStatus.BLOCKED) {
            sb.append("\n\nBlocker: ").append(task.getBlocker());
        }
        if (!task.getUpdates().isEmpty()) {
            sb.append("\n\nLatest update: ").append(task.getUpdates().get(task.getUpdates().size() - 1).getMessage());
        }
        return sb.toString();
    }

    public String taskList(List<Task> tasks) {
        if (tasks.isEmpty()) {
            return header("Your Tasks") + "No open tasks at this time.";
        }
        StringBuilder sb = new StringBuilder(header("Your Tasks (" + tasks.size() + ")"));
        int index = 1;
        for (Task task : tasks.subList(0, Math.min(TASK_LIST_LIMIT, tasks.size()))) {
            sb.append(index++).append(". ").append(task.getTitle()).append("\n")
                    .append("   Ref: ").append(task.getReference())
                    .append(" | Priority: ").append(task.getPriority().name()).append("\n")
                    .append("   Status: ").append(task.getStatus().wireName().toUpperCase(Locale.ROOT))
                    .append(" | Progress: ").append(task.getProgress()).append("%\n")
                    .append("   Deadline: ").append(formatDate(task.getDeadline(), "Not set")).append("\n\n");
        }
        if (tasks.size() > TASK_LIST_LIMIT) {
            sb.append("...and ").append(tasks.size() - TASK_LIST_LIMIT).append(" additional tasks.");
        }
        return sb.toString().trim();
    }

    public String deadlineList(List<Task> tasks, OffsetDateTime now) {
        if (tasks.isEmpty()) {
            return header("Upcoming Deadlines") + "You have no open tasks with deadlines.";
        }
        StringBuilder sb = new StringBuilder(header("Upcoming Deadlines"));
        int index = 1;
        for (Task task : tasks.subList(0, Math.min(TASK_LIST_LIMIT, tasks.size()))) {
            sb.append(index++).append(". ").append(task.getTitle()).append("\n")
                    .append("   Ref: ").append(task.getReference()).append("\n")
                    .append("   Due: ").append(formatDateTime(task.getDeadline(), "Not set"))
                    .append(task.isOverdue(now) ? " (OVERDUE)" : "").append("\n\n");
        }
        return sb.toString().trim();
    }

    public String statusSummary(User user, TaskStats stats) {
        return header("Task Summary")
                + "Hello " + user.getFirstName() + ".\n\n"
                + "- Open Tasks: " + stats.open() + "\n"
                + "- In Progress: " + stats.inProgress() + "\n"
                + "- Due Today: " + stats.dueToday() + "\n"
                + "- Overdue: " + stats.overdue() + "\n"
                + "- Completed: " + stats.completed();
    }

    public String taskReminder(Task task, String timeLeft) {
        return header("Deadline Reminder")
                + "Title: " + task.getTitle() + "\n"
                + "Reference: " + task.getReference() + "\n"
                + "Deadline: " + formatDateTime(task.getDeadline(), "Not set") + "\n"
                + "Time Remaining: " + timeLeft + "\n\n"
                + "Current Status: " + task.getStatus().wireName() + "\n"
                + "Progress: " + task.getProgress() + "%\n\n"
                + "Please update your progress or contact your supervisor if assistance is required.";
    }

    public String reminderSet(ReminderRecord reminder) {
        return header("Reminder Set")
                + "Reference: " + reminder.getReference() + "\n"
                + "Title: " + reminder.getTitle() + "\n"
                + "When: " + formatLong(reminder.getDueAt()) + "\n\n"
                + "You will receive a WhatsApp notification at the scheduled time.";
    }

    public String meetingScheduled(ReminderRecord meeting, String subject) {
        StringBuilder sb = new StringBuilder(header("Meeting Scheduled"))
                .append("Reference: ").append(meeting.getReference()).append("\n")
                .append("Subject: ").append(subject);
        if (meeting.getMeetingWith() != null) {
            sb.append("\nWith: ").append(meeting.getMeetingWith());
        }
        if (meeting.getMeetingLocation() != null) {
            sb.append("\nLocation: ").append(meeting.getMeetingLocation());
        }
        sb.append("\nWhen: ").append(formatLong(meeting.getDueAt()))
                .append("\n\nYou will receive a WhatsApp reminder at the scheduled time.");
        return sb.toString();
    }

    public String reminderList(List<ReminderRecord> reminders) {
        if (reminders.isEmpty()) {
            return header("No Upcoming Reminders")
                    + "You have no upcoming reminders.\n\n"
                    + "To set a reminder, say: \"Remind me about [something] at [time] on [date]\"";
        }
        StringBuilder sb = new StringBuilder(header("Your Upcoming Reminders"));
        int index = 1;
        for (ReminderRecord reminder : reminders) {
            sb.append(index++).append(". ").append(reminder.getTitle()).append("\n")
                    .append("   ID: ").append(reminder.getReference()).append("\n")
                    .append("   When: ").append(formatDateTime(reminder.getDueAt(), "")).append("\n\n");
        }
        sb.append("To cancel a reminder, say: \"Cancel reminder [ID]\"");
        return sb.toString();
    }

    public String meetingList(List<ReminderRecord> meetings, String periodLabel) {
        if (meetings.isEmpty()) {
            return header("No Meetings " + periodLabel)
                    + "You have no scheduled meetings for " + periodLabel.toLowerCase(Locale.ROOT) + ".\n\n"
                    + "To schedule a meeting, say: \"Schedule meeting with [person] about [subject] at [time]\"";
        }
        StringBuilder sb = new StringBuilder(header("Your Meetings (" + periodLabel + ")"));
        int index = 1;
        for (ReminderRecord meeting : meetings) {
            OffsetDateTime local = meeting.getDueAt().atZoneSameInstant(zoneId).toOffsetDateTime();
            sb.append(index++).append(". ").append(meeting.getTitle()).append("\n")
                    .append("   ID: ").append(meeting.getReference()).append("\n")
                    .append("   When: ").append(local.format(SHORT_DATE_FMT)).append(" at ").append(local.format(TIME_FMT)).append("\n");
            if (meeting.getMeetingWith() != null) {
                sb.append("   With: ").append(meeting.getMeetingWith()).append("\n");
            }
            if (meeting.getMeetingLocation() != null) {
                sb.append("   Location: ").append(meeting.getMeetingLocation()).append("\n");
            }
            sb.append("\n");
        }
        sb.append("To cancel a meeting, say: \"Cancel meeting [ID]\"");
        return sb.toString();
    }

    public String reminderCancelled(ReminderRecord reminder) {
        String kind = reminder.getKind() == ReminderKind.MEETING ? "Meeting" : "Reminder";
        return header(kind + " Cancelled")
                + "Reference: " + reminder.getReference() + "\n"
                + "Title: " + reminder.getTitle() + "\n\n"
                + "This " + kind.toLowerCase(Locale.ROOT) + " has been cancelled.";
    }

    public String reminderDue(ReminderRecord reminder) {
        if (reminder.getKind() == ReminderKind.MEETING) {
            return header("Meeting Reminder")
                    + reminder.getTitle() + "\n\n"
                    + (reminder.getBody() == null ? "" : reminder.getBody() + "\n")
                    + "When: " + formatDateTime(reminder.getDueAt(), "") + "\n"
                    + "Reference: " + reminder.getReference();
        }
        return header("Reminder")
                + reminder.getTitle() + "\n\n"
                + (reminder.getBody() == null || reminder.getBody().equals(reminder.getTitle()) ? "" : reminder.getBody() + "\n\n")
                + "Reference: " + reminder.getReference();
    }

    public String dailyDigest(User user, List<Task> priorityTasks, TaskStats stats, OffsetDateTime now) {
        StringBuilder sb = new StringBuilder(header("Daily Task Summary"))
                .append(now.atZoneSameInstant(zoneId).format(LONG_DATE_FMT)).append("\n\n")
                .append("Good morning, ").append(user.getFirstName()).append(".\n\n")
                .append("TASK OVERVIEW:\n")
                .append("- Open Tasks: ").append(stats.open()).append("\n")
                .append("- In Progress: ").append(stats.inProgress()).append("\n")
                .append("- Due Today: ").append(stats.dueToday()).append("\n")
                .append("- Overdue: ").append(stats.overdue()).append("\n\n");
        if (!priorityTasks.isEmpty()) {
            sb.append("PRIORITY ITEMS:\n");
            int index = 1;
            for (Task task : priorityTasks) {
                sb.append(index++).append(". ").append(task.getTitle()).append("\n")
                        .append("   Ref: ").append(task.getReference()).append(" | ")
                        .append(task.isOverdue(now) ? "OVERDUE" : "Due Today").append("\n");
            }
            sb.append("\n");
        }
        if (stats.open() == 0 && stats.overdue() == 0) {
            sb.append("All tasks are up to date. Have a productive day.");
        } else {
            sb.append("Reply \"show my tasks\" for the full list.");
        }
        return sb.toString();
    }

    public String testMessage(String text) {
        return header("Test Message") + (text == null || text.isBlank() ? "WhatsApp delivery is working." : text);
    }

    public String formatDateTime(OffsetDateTime value, String fallback) {
        if (value == null) {
            return fallback;
        }
        OffsetDateTime local = value.atZoneSameInstant(zoneId).toOffsetDateTime();
        return local.format(DATE_FMT) + " at " + local.format(TIME_FMT);
    }

    private String formatDate(OffsetDateTime value, String fallback) {
        return value == null ? fallback : value.atZoneSameInstant(zoneId).format(DATE_FMT);
    }

    private String formatLong(OffsetDateTime value) {
        OffsetDateTime local = value.atZoneSameInstant(zoneId).toOffsetDateTime();
        return local.format(LONG_DATE_FMT) + " at " + local.format(TIME_FMT);
    }

    private String header(String title) {
        return brand + " - " + title + "\n\n";
    }
}
