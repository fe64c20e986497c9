package com.taskbot.action;

import com.taskbot.domain.model.User;
import com.taskbot.messaging.MessageTemplates;
import com.taskbot.parsing.Intent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a complete intent to the action that executes it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActionDispatcher {

    private final TaskActionService taskActionService;
    private final ReminderActionService reminderActionService;
    private final MessageTemplates templates;

    public ActionResult dispatch(User user, Intent intent) {
        log.info("Dispatch action. kind={}, userId={}", intent.kind(), user.getId());
        return switch (intent.kind()) {
            case WELCOME -> ActionResult.reply(templates.welcome(user));
            case HELP -> ActionResult.reply(templates.help());
            case STATUS -> taskActionService.statusSummary(user);
            case LIST_TASKS -> taskActionService.listTasks(user, intent);
            case LIST_DEADLINES -> taskActionService.listDeadlines(user);
            case VIEW_TASK -> taskActionService.viewTask(user, intent);
            case CREATE_TASK -> taskActionService.createTask(user, intent);
            case ASSIGN_TASK -> taskActionService.assignTask(user, intent);
            case UPDATE_STATUS -> taskActionService.updateStatus(user, intent);
            case UPDATE_PROGRESS -> taskActionService.updateProgress(user, intent);
            case UPDATE_STATUS_AND_PROGRESS -> taskActionService.updateStatusAndProgress(user, intent);
            case ADD_UPDATE -> taskActionService.addUpdate(user, intent);
            case REPORT_BLOCKER -> taskActionService.reportBlocker(user, intent);
            case CANCEL_TASK -> taskActionService.cancelTask(user, intent);
            case SET_REMINDER -> reminderActionService.setReminder(user, intent);
            case SCHEDULE_MEETING -> reminderActionService.scheduleMeeting(user, intent);
            case LIST_REMINDERS -> reminderActionService.listReminders(user);
            case LIST_MEETINGS -> reminderActionService.listMeetings(user, intent);
            case CANCEL_REMINDER -> reminderActionService.cancelReminder(user, intent);
            case UNKNOWN -> ActionResult.reply(templates.notUnderstood());
        };
    }
}
