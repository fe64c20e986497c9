package com.taskbot.reminder;

import com.taskbot.config.ReminderProperties;
import com.taskbot.domain.model.Task;
import com.taskbot.domain.model.User;
import com.taskbot.exception.MessageDeliveryException;
import com.taskbot.messaging.MessageTemplates;
import com.taskbot.messaging.NotificationChannel;
import com.taskbot.repository.TaskRepository;
import com.taskbot.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Morning task summary, sent once per local day after the configured digest time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DailyDigestNotifier {

    private static final int PRIORITY_ITEMS = 5;

    private final UserRepository userRepository;
    private final TaskRepository taskRepository;
    private final ReminderProperties properties;
    private final NotificationChannel notificationChannel;
    private final MessageTemplates templates;
    private final TransactionTemplate transactionTemplate;

    private final AtomicReference<LocalDate> lastSentDate = new AtomicReference<>();

    public int runIfDue(OffsetDateTime now) {
        if (!properties.digestEnabled()) {
            return 0;
        }
        ZonedDateTime local = now.atZoneSameInstant(templates.zoneId());
        if (local.toLocalTime().isBefore(properties.resolveDigestTime())) {
            return 0;
        }
        LocalDate today = local.toLocalDate();
        LocalDate previous = lastSentDate.get();
        if (today.equals(previous) || !lastSentDate.compareAndSet(previous, today)) {
            return 0;
        }
        return sendDigest(now);
    }

    public int sendDigest(OffsetDateTime now) {
        List<User> users = userRepository.findByActiveTrueAndDailyDigestEnabledTrue();
        int sent = 0;
        for (User user : users) {
            String address = user.deliveryAddress();
            if (address == null || address.isBlank() || !user.isNotificationsEnabled()) {
                continue;
            }
            String text = transactionTemplate.execute(status -> buildDigest(user, now));
            if (text == null) {
                continue;
            }
            try {
                notificationChannel.send(address, text);
                sent++;
            } catch (MessageDeliveryException e) {
                log.error("Daily digest failed. userId={}, error={}", user.getId(), e.getMessage(), e);
            }
        }
        log.info("Daily digest finished. users={}, sent={}", users.size(), sent);
        return sent;
    }

    private String buildDigest(User user, OffsetDateTime now) {
        List<Task> tasks = taskRepository.findAssignedTo(user.getOrganizationId(), user);
        MessageTemplates.TaskStats stats = MessageTemplates.TaskStats.of(tasks, now, templates.zoneId());
        if (stats.open() == 0) {
            return null;
        }
        LocalDate today = now.atZoneSameInstant(templates.zoneId()).toLocalDate();
        List<Task> priority = tasks.stream()
                .filter(t -> !t.getStatus().isClosed() && t.getDeadline() != null)
                .filter(t -> t.isOverdue(now)
                        || t.getDeadline().atZoneSameInstant(templates.zoneId()).toLocalDate().equals(today))
                .sorted(Comparator.comparing(Task::getDeadline))
                .limit(PRIORITY_ITEMS)
                .toList();
        return templates.dailyDigest(user, priority, stats, now);
    }
}
