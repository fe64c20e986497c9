package com.taskbot.reminder;

import com.taskbot.config.ReminderProperties;
import com.taskbot.domain.enums.TaskStatus;
import com.taskbot.domain.model.Task;
import com.taskbot.domain.model.User;
import com.taskbot.exception.MessageDeliveryException;
import com.taskbot.messaging.MessageTemplates;
import com.taskbot.messaging.NotificationChannel;
import com.taskbot.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Sends one reminder per task and lead time. The lead-time mark is claimed before anything is sent,
 * so a failed send is not retried and two scans never notify twice.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskDeadlineNotifier {

    private static final Set<TaskStatus> CLOSED = EnumSet.of(TaskStatus.COMPLETED, TaskStatus.CANCELLED);

    private final TaskRepository taskRepository;
    private final ReminderProperties properties;
    private final NotificationChannel notificationChannel;
    private final MessageTemplates templates;
    private final TransactionTemplate transactionTemplate;

    public int scan(OffsetDateTime now) {
        Duration window = properties.resolveLeadTimeWindow();
        int sent = 0;
        for (ReminderProperties.LeadTime leadTime : properties.resolveLeadTimes()) {
            OffsetDateTime target = now.plusMinutes(leadTime.minutes());
            List<UUID> candidates = taskRepository.findDeadlineCandidates(
                    target.minus(window), target.plus(window), CLOSED, leadTime.minutes());
            for (UUID taskId : candidates) {
                List<OutboundMessage> messages = claim(taskId, leadTime, now);
                for (OutboundMessage message : messages) {
                    if (deliver(message, leadTime)) {
                        sent++;
                    }
                }
            }
        }
        return sent;
    }

    private List<OutboundMessage> claim(UUID taskId, ReminderProperties.LeadTime leadTime, OffsetDateTime now) {
        try {
            List<OutboundMessage> messages = transactionTemplate.execute(status -> {
                if (taskRepository.claimLeadTime(taskId, leadTime.minutes(), now) != 1) {
                    return List.<OutboundMessage>of();
                }
                Task task = taskRepository.findById(taskId).orElse(null);
                if (task == null || task.getStatus().isClosed()) {
                    return List.<OutboundMessage>of();
                }
                String text = templates.taskReminder(task, leadTime.label());
                List<OutboundMessage> prepared = new ArrayList<>();
                for (User recipient : recipients(task, leadTime.minutes())) {
                    prepared.add(new OutboundMessage(task.getReference(), recipient.deliveryAddress(), text));
                }
                return prepared;
            });
            return messages == null ? List.of() : messages;
        } catch (DataIntegrityViolationException e) {
            log.info("Lead time already claimed. taskId={}, leadMinutes={}", taskId, leadTime.minutes());
            return List.of();
        }
    }

    static List<User> recipients(Task task, int leadMinutes) {
        Map<UUID, User> distinct = new LinkedHashMap<>();
        if (task.getAssignedTo() != null) {
            distinct.put(task.getAssignedTo().getId(), task.getAssignedTo());
        }
        for (User secondary : task.getSecondaryAssignees()) {
            distinct.putIfAbsent(secondary.getId(), secondary);
        }
        return distinct.values().stream()
                .filter(u -> u.deliveryAddress() != null && !u.deliveryAddress().isBlank())
                .filter(User::isNotificationsEnabled)
                .filter(User::isRemindersEnabled)
                .filter(u -> u.acceptsLeadTime(leadMinutes))
                .toList();
    }

    private boolean deliver(OutboundMessage message, ReminderProperties.LeadTime leadTime) {
        try {
            notificationChannel.send(message.address(), message.text());
            log.info("Deadline reminder sent. reference={}, lead={}, to={}", message.reference(), leadTime.label(), message.address());
            return true;
        } catch (MessageDeliveryException e) {
            log.error("Deadline reminder failed. reference={}, lead={}, to={}, error={}",
                    message.reference(), leadTime.label(), message.address(), e.getMessage(), e);
            return false;
        }
    }
}
