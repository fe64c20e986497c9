package com.taskbot.reminder;

import com.taskbot.config.ReminderProperties;
import com.taskbot.domain.model.ReminderRecord;
import com.taskbot.domain.model.User;
import com.taskbot.exception.MessageDeliveryException;
import com.taskbot.messaging.MessageTemplates;
import com.taskbot.messaging.NotificationChannel;
import com.taskbot.repository.ReminderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Delivers due personal reminders and meetings. A record is sent only by the scan that moved it
 * from pending to sent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PersonalReminderNotifier {

    private final ReminderRepository reminderRepository;
    private final ReminderProperties properties;
    private final NotificationChannel notificationChannel;
    private final MessageTemplates templates;
    private final TransactionTemplate transactionTemplate;

    public int scan(OffsetDateTime now) {
        List<UUID> due = reminderRepository.findDueIds(now.minus(properties.resolveDueLookback()), now);
        int sent = 0;
        for (UUID id : due) {
            OutboundMessage message = transactionTemplate.execute(status -> claim(id, now));
            if (message == null) {
                continue;
            }
            try {
                notificationChannel.send(message.address(), message.text());
                sent++;
                log.info("Reminder sent. reference={}, to={}", message.reference(), message.address());
            } catch (MessageDeliveryException e) {
                log.error("Reminder delivery failed. reference={}, to={}, error={}",
                        message.reference(), message.address(), e.getMessage(), e);
            }
        }
        return sent;
    }

    private OutboundMessage claim(UUID id, OffsetDateTime now) {
        if (reminderRepository.markSent(id, now) != 1) {
            return null;
        }
        ReminderRecord reminder = reminderRepository.findById(id).orElse(null);
        if (reminder == null) {
            return null;
        }
        User owner = reminder.getOwner();
        String address = owner == null ? null : owner.deliveryAddress();
        if (address == null || address.isBlank() || !owner.isNotificationsEnabled()) {
            log.info("Reminder owner unreachable, marked sent. reference={}", reminder.getReference());
            return null;
        }
        return new OutboundMessage(reminder.getReference(), address, templates.reminderDue(reminder));
    }
}
