package com.taskbot.action;

import com.taskbot.config.AssistantProperties;
import com.taskbot.domain.enums.TaskPriority;
import com.taskbot.domain.enums.TaskStatus;
import com.taskbot.domain.model.Task;
import com.taskbot.domain.model.TaskUpdateEntry;
import com.taskbot.domain.model.User;
import com.taskbot.exception.NotFoundException;
import com.taskbot.exception.PermissionDeniedException;
import com.taskbot.exception.PersistenceFailureException;
import com.taskbot.exception.ValidationFailureException;
import com.taskbot.messaging.MessageTemplates;
import com.taskbot.parsing.Intent;
import com.taskbot.parsing.Slot;
import com.taskbot.repository.TaskRepository;
import com.taskbot.repository.UserRepository;
import com.taskbot.util.CommandNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class TaskActionService {

    private static final Duration DEFAULT_DEADLINE = Duration.ofDays(7);
    private static final Duration DEADLINE_HORIZON = Duration.ofDays(7);
    private static final int MIN_TITLE_LENGTH = 3;

    private final TaskRepository taskRepository;
    private final UserRepository userRepository;
    private final AssistantProperties assistantProperties;
    private final MessageTemplates templates;
    private final Clock clock;

    @Transactional
    public ActionResult createTask(User user, Intent intent) {
        Task task = newTask(user, intent, user);
        log.info("Task created via WhatsApp. reference={}, userId={}", task.getReference(), user.getId());
        return ActionResult.reply(templates.taskCreated(task));
    }

    @Transactional
    public ActionResult assignTask(User user, Intent intent) {
        if (!assistantProperties.isManager(user.getRole())) {
            throw new PermissionDeniedException("assign tasks to others", assistantProperties.resolveManagerRoles());
        }
        String assigneeName = intent.slot(Slot.ASSIGNEE_NAME);
        if (assigneeName == null) {
            throw new ValidationFailureException("Please specify who the task should be assigned to.");
        }
        List<User> candidates = userRepository.findAssigneeCandidates(
                user.getOrganizationId(), assigneeName.trim().toLowerCase(Locale.ROOT));
        if (candidates.isEmpty()) {
            throw new NotFoundException(assigneeName,
                    "Could not find employee \"" + assigneeName + "\". Please check the name or email and try again.");
        }
        User assignee = candidates.get(0);
        Task task = newTask(user, intent, assignee);
        log.info("Task assigned via WhatsApp. reference={}, assigneeId={}, assignedById={}",
                task.getReference(), assignee.getId(), user.getId());

        ActionResult result = ActionResult.reply(templates.taskAssignedConfirmation(task));
        if (assignee.isNotificationsEnabled() && assignee.isTaskAssignedEnabled()
                && !assignee.getId().equals(user.getId())) {
            result = result.withNotice(assignee.deliveryAddress(), templates.taskAssigned(task));
        }
        return result;
    }

    @Transactional
    public ActionResult updateStatus(User user, Intent intent) {
        Task task = loadForUpdate(user, intent.slot(Slot.TASK_ID));
        TaskStatus status = requireStatus(intent);
        TaskStatus oldStatus = task.getStatus();
        int progress = status == TaskStatus.COMPLETED ? 100 : task.getProgress();

        Task updated = applyAndVerify(task, user, status, progress,
                "Status changed from " + oldStatus.wireName() + " to " + status.wireName() + " via WhatsApp");
        log.info("Task status updated via WhatsApp. reference={}, oldStatus={}, newStatus={}, userId={}",
                updated.getReference(), oldStatus, status, user.getId());
        return ActionResult.reply(templates.taskUpdated(updated,
                "Status changed from " + oldStatus.wireName().toUpperCase(Locale.ROOT)
                        + " to " + status.wireName().toUpperCase(Locale.ROOT) + "."));
    }

    @Transactional
    public ActionResult updateProgress(User user, Intent intent) {
        Task task = loadForUpdate(user, intent.slot(Slot.TASK_ID));
        Integer progress = intent.progress();
        if (progress == null) {
            String raw = intent.rejected().get(Slot.PROGRESS);
            throw new ValidationFailureException(raw == null
                    ? "Please specify the progress percentage (0-100)."
                    : "\"" + raw + "\" is not valid. Please use a number between 0-100.");
        }
        int oldProgress = task.getProgress();
        TaskStatus status = progress == 100 ? TaskStatus.COMPLETED : task.getStatus();

        Task updated = applyAndVerify(task, user, status, progress,
                "Progress updated from " + oldProgress + "% to " + progress + "% via WhatsApp");
        log.info("Task progress updated via WhatsApp. reference={}, oldProgress={}, newProgress={}, userId={}",
                updated.getReference(), oldProgress, progress, user.getId());
        return ActionResult.reply(templates.taskUpdated(updated,
                "Progress changed from " + oldProgress + "% to " + progress + "%."));
    }

    @Transactional
    public ActionResult updateStatusAndProgress(User user, Intent intent) {
        Task task = loadForUpdate(user, intent.slot(Slot.TASK_ID));
        TaskStatus status = requireStatus(intent);
        TaskStatus oldStatus = task.getStatus();
        int oldProgress = task.getProgress();
        Integer requested = intent.progress();
        int progress = requested != null ? requested : (status == TaskStatus.COMPLETED ? 100 : oldProgress);

        Task updated = applyAndVerify(task, user, status, progress,
                "Status/progress updated via WhatsApp (status: " + oldStatus.wireName() + " -> " + status.wireName()
                        + ", progress: " + oldProgress + "% -> " + progress + "%)");
        log.info("Task status and progress updated via WhatsApp. reference={}, status={}, progress={}, userId={}",
                updated.getReference(), status, progress, user.getId());
        return ActionResult.reply(templates.taskUpdated(updated,
                "Status: " + oldStatus.wireName().toUpperCase(Locale.ROOT) + " -> " + status.wireName().toUpperCase(Locale.ROOT)
                        + "\nProgress: " + oldProgress + "% -> " + progress + "%"));
    }

    @Transactional
    public ActionResult addUpdate(User user, Intent intent) {
        Task task = loadForUpdate(user, intent.slot(Slot.TASK_ID));
        String message = intent.slot(Slot.MESSAGE);
        if (message == null) {
            throw new ValidationFailureException("Please provide the update text.");
        }
        task.getUpdates().add(new TaskUpdateEntry(message, user.getId(), OffsetDateTime.now(clock), null, null));
        taskRepository.save(task);
        log.info("Task update added via WhatsApp. reference={}, userId={}", task.getReference(), user.getId());
        return ActionResult.reply(templates.updateAdded(task, message));
    }

    @Transactional
    public ActionResult reportBlocker(User user, Intent intent) {
        Task task = loadForUpdate(user, intent.slot(Slot.TASK_ID));
        String blocker = intent.slot(Slot.BLOCKER);
        if (blocker == null) {
            throw new ValidationFailureException("Please describe what is blocking the task.");
        }
        task.setBlocker(blocker);
        Task updated = applyAndVerify(task, user, TaskStatus.BLOCKED, task.getProgress(),
                "Blocker reported via WhatsApp: " + blocker);
        log.info("Blocker reported via WhatsApp. reference={}, userId={}", updated.getReference(), user.getId());

        ActionResult result = ActionResult.reply(templates.blockerReported(updated));
        User assigner = updated.getAssignedBy();
        if (assigner != null && !assigner.getId().equals(user.getId()) && assigner.isNotificationsEnabled()) {
            result = result.withNotice(assigner.deliveryAddress(), templates.blockerAlert(updated, user));
        }
        return result;
    }

    @Transactional
    public ActionResult cancelTask(User user, Intent intent) {
        Task task = loadForUpdate(user, intent.slot(Slot.TASK_ID));
        Task updated = applyAndVerify(task, user, TaskStatus.CANCELLED, task.getProgress(), "Task cancelled via WhatsApp");
        log.info("Task cancelled via WhatsApp. reference={}, userId={}", updated.getReference(), user.getId());
        return ActionResult.reply(templates.taskCancelled(updated));
    }

    @Transactional(readOnly = true)
    public ActionResult viewTask(User user, Intent intent) {
        Task task = loadForUpdate(user, intent.slot(Slot.TASK_ID));
        return ActionResult.reply(templates.taskDetails(task, OffsetDateTime.now(clock)));
    }

    @Transactional(readOnly = true)
    public ActionResult listTasks(User user, Intent intent) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        TaskStatus statusFilter = TaskStatus.fromWireName(intent.slot(Slot.STATUS_FILTER));
        TaskPriority priorityFilter = TaskPriority.fromWireName(intent.slot(Slot.PRIORITY_FILTER));
        boolean overdueOnly = intent.has(Slot.OVERDUE_FILTER);

        List<Task> tasks = taskRepository.findAssignedTo(user.getOrganizationId(), user).stream()
                .filter(t -> statusFilter != null ? t.getStatus() == statusFilter : !t.getStatus().isClosed())
                .filter(t -> priorityFilter == null || t.getPriority() == priorityFilter)
                .filter(t -> !overdueOnly || t.isOverdue(now))
                .toList();
        return ActionResult.reply(templates.taskList(tasks));
    }

    @Transactional(readOnly = true)
    public ActionResult listDeadlines(User user) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime horizon = now.plus(DEADLINE_HORIZON);
        List<Task> tasks = taskRepository.findAssignedTo(user.getOrganizationId(), user).stream()
                .filter(t -> !t.getStatus().isClosed())
                .filter(t -> t.getDeadline() != null && !t.getDeadline().isAfter(horizon))
                .sorted(Comparator.comparing(Task::getDeadline))
                .toList();
        return ActionResult.reply(templates.deadlineList(tasks, now));
    }

    @Transactional(readOnly = true)
    public ActionResult statusSummary(User user) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Task> tasks = taskRepository.findAssignedTo(user.getOrganizationId(), user);
        return ActionResult.reply(templates.statusSummary(user,
                MessageTemplates.TaskStats.of(tasks, now, templates.zoneId())));
    }

    private Task newTask(User creator, Intent intent, User assignee) {
        String title = intent.slot(Slot.TITLE);
        if (title == null || title.length() < MIN_TITLE_LENGTH) {
            throw new ValidationFailureException("Please provide a task title (at least " + MIN_TITLE_LENGTH + " characters).");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        TaskPriority priority = TaskPriority.fromWireName(intent.slot(Slot.PRIORITY));
        OffsetDateTime deadline = parseTime(intent.slot(Slot.DEADLINE));

        Task task = new Task();
        task.setReference(nextReference(creator.getOrganizationId(), now));
        task.setOrganizationId(creator.getOrganizationId());
        task.setTitle(title);
        task.setDescription(intent.slot(Slot.DESCRIPTION));
        task.setPriority(priority == null ? TaskPriority.MEDIUM : priority);
        task.setStatus(TaskStatus.PENDING);
        task.setProgress(0);
        task.setDeadline(deadline == null ? now.plus(DEFAULT_DEADLINE) : deadline);
        task.setAssignedTo(assignee);
        task.setAssignedBy(creator);
        try {
            return taskRepository.saveAndFlush(task);
        } catch (DataIntegrityViolationException e) {
            log.warn("Task reference collision. reference={}, error={}", task.getReference(), e.getMessage());
            throw new PersistenceFailureException("Failed to save the task. Please try again.");
        }
    }

    private String nextReference(String organizationId, OffsetDateTime now) {
        String prefix = CommandNormalizer.TASK_PREFIX + now.atZoneSameInstant(templates.zoneId()).getYear() + "-";
        long count = taskRepository.countByOrganizationIdAndReferenceStartingWith(organizationId, prefix);
        return prefix + String.format("%04d", count + 1);
    }

    private Task loadForUpdate(User user, String reference) {
        if (reference == null) {
            throw new ValidationFailureException("Please specify a task ID.\n\nExample: \"Show task TASK-2026-0001\"");
        }
        Task task = taskRepository.findByOrganizationIdAndReference(user.getOrganizationId(), reference)
                .orElseThrow(() -> new NotFoundException(reference, "Task " + reference + " not found."));
        if (!task.involves(user) && !assistantProperties.isManager(user.getRole())) {
            throw new PermissionDeniedException("access tasks assigned to others", assistantProperties.resolveManagerRoles());
        }
        return task;
    }

    private TaskStatus requireStatus(Intent intent) {
        TaskStatus status = TaskStatus.fromWireName(intent.slot(Slot.STATUS));
        if (status == null) {
            String raw = intent.rejected().get(Slot.STATUS);
            throw new ValidationFailureException((raw == null ? "Please specify the new status." : "\"" + raw + "\" is not a valid status.")
                    + "\n\nValid statuses: pending, in-progress, completed, blocked, cancelled");
        }
        return status;
    }

    /**
     * Records the history entry, writes status and progress in one statement and re-reads the row.
     * A re-read that does not show the intended values fails the action.
     */
    private Task applyAndVerify(Task task, User actor, TaskStatus status, int progress, String note) {
        task.getUpdates().add(new TaskUpdateEntry(note, actor.getId(), OffsetDateTime.now(clock), status, progress));
        taskRepository.save(task);
        int updated = taskRepository.updateStatusAndProgress(task.getId(), status, progress, OffsetDateTime.now(clock));
        Task reloaded = taskRepository.findById(task.getId()).orElse(null);
        if (updated != 1 || reloaded == null || reloaded.getStatus() != status || reloaded.getProgress() != progress) {
            log.error("Task update not persisted. reference={}, expectedStatus={}, expectedProgress={}, actualStatus={}, actualProgress={}",
                    task.getReference(), status, progress,
                    reloaded == null ? null : reloaded.getStatus(), reloaded == null ? null : reloaded.getProgress());
            throw new PersistenceFailureException("Failed to update task " + task.getReference() + ". Please try again.");
        }
        return reloaded;
    }

    private OffsetDateTime parseTime(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationFailureException("Could not understand the date \"" + value + "\".");
        }
    }
}
