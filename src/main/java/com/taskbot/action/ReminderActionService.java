package com.taskbot.action;

import com.taskbot.domain.enums.ReminderKind;
import com.taskbot.domain.enums.ReminderStatus;
import com.taskbot.domain.model.ReminderRecord;
import com.taskbot.domain.model.User;
import com.taskbot.exception.NotFoundException;
import com.taskbot.exception.PersistenceFailureException;
import com.taskbot.exception.ValidationFailureException;
import com.taskbot.messaging.MessageTemplates;
import com.taskbot.parsing.Intent;
import com.taskbot.parsing.Slot;
import com.taskbot.repository.ReminderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReminderActionService {

    private final ReminderRepository reminderRepository;
    private final MessageTemplates templates;
    private final Clock clock;

    @Transactional
    public ActionResult setReminder(User user, Intent intent) {
        OffsetDateTime dueAt = requireFutureTime(intent, "The reminder time must be in the future. Please try again.");
        String title = firstNonNull(intent.slot(Slot.REMINDER_TITLE), intent.slot(Slot.REMINDER_MESSAGE), "Reminder");
        String body = firstNonNull(intent.slot(Slot.REMINDER_MESSAGE), intent.slot(Slot.REMINDER_TITLE), "You have a reminder");

        ReminderRecord reminder = newRecord(user, ReminderKind.REMINDER, dueAt);
        reminder.setTitle(title);
        reminder.setBody(body);
        ReminderRecord saved = persist(reminder);
        log.info("Reminder created via WhatsApp. reference={}, userId={}, dueAt={}", saved.getReference(), user.getId(), dueAt);
        return ActionResult.reply(templates.reminderSet(saved));
    }

    @Transactional
    public ActionResult scheduleMeeting(User user, Intent intent) {
        OffsetDateTime dueAt = requireFutureTime(intent, "The meeting time must be in the future. Please try again.");
        String subject = firstNonNull(intent.slot(Slot.MEETING_SUBJECT), intent.slot(Slot.REMINDER_TITLE), "Meeting");
        String with = intent.slot(Slot.MEETING_WITH);
        String location = intent.slot(Slot.MEETING_LOCATION);

        StringBuilder body = new StringBuilder("Meeting: ").append(subject);
        if (with != null) {
            body.append("\nWith: ").append(with);
        }
        if (location != null) {
            body.append("\nLocation: ").append(location);
        }

        ReminderRecord meeting = newRecord(user, ReminderKind.MEETING, dueAt);
        meeting.setTitle(with == null ? subject : "Meeting with " + with + ": " + subject);
        meeting.setBody(body.toString());
        meeting.setMeetingWith(with);
        meeting.setMeetingLocation(location);
        ReminderRecord saved = persist(meeting);
        log.info("Meeting scheduled via WhatsApp. reference={}, userId={}, dueAt={}", saved.getReference(), user.getId(), dueAt);
        return ActionResult.reply(templates.meetingScheduled(saved, subject));
    }

    @Transactional(readOnly = true)
    public ActionResult listReminders(User user) {
        List<ReminderRecord> reminders = reminderRepository.findTop10ByOwnerAndStatusAndDueAtGreaterThanEqualOrderByDueAtAsc(
                user, ReminderStatus.PENDING, OffsetDateTime.now(clock));
        return ActionResult.reply(templates.reminderList(reminders));
    }

    @Transactional(readOnly = true)
    public ActionResult listMeetings(User user, Intent intent) {
        ZonedDateTime startOfToday = ZonedDateTime.now(clock).withZoneSameInstant(templates.zoneId()).truncatedTo(ChronoUnit.DAYS);
        String period = intent.slot(Slot.PERIOD) == null ? "today" : intent.slot(Slot.PERIOD);

        ZonedDateTime from = startOfToday;
        ZonedDateTime to = startOfToday.plusDays(1);
        String label = "Today";
        switch (period) {
            case "tomorrow" -> {
                from = startOfToday.plusDays(1);
                to = startOfToday.plusDays(2);
                label = "Tomorrow";
            }
            case "week", "this week" -> {
                to = startOfToday.plusDays(7);
                label = "This Week";
            }
            case "all" -> {
                to = null;
                label = "All Upcoming";
            }
            default -> {
            }
        }

        List<ReminderRecord> meetings = to == null
                ? reminderRepository.findTop15ByOwnerAndKindAndStatusAndDueAtGreaterThanEqualOrderByDueAtAsc(
                        user, ReminderKind.MEETING, ReminderStatus.PENDING, from.toOffsetDateTime())
                : reminderRepository.findTop15ByOwnerAndKindAndStatusAndDueAtGreaterThanEqualAndDueAtLessThanOrderByDueAtAsc(
                        user, ReminderKind.MEETING, ReminderStatus.PENDING, from.toOffsetDateTime(), to.toOffsetDateTime());
        return ActionResult.reply(templates.meetingList(meetings, label));
    }

    @Transactional
    public ActionResult cancelReminder(User user, Intent intent) {
        String reference = intent.slot(Slot.REMINDER_ID);
        if (reference == null) {
            throw new ValidationFailureException("Please specify the reminder ID to cancel.\n\nSay \"my reminders\" to see your reminder IDs.");
        }
        ReminderRecord reminder = reminderRepository.findByReferenceAndOwner(reference, user)
                .orElseThrow(() -> new NotFoundException(reference,
                        "Reminder " + reference + " was not found or does not belong to you."));
        if (reminder.getStatus() != ReminderStatus.PENDING) {
            throw new ValidationFailureException("Reminder " + reference + " is already " + reminder.getStatus().name().toLowerCase(Locale.ROOT) + ".");
        }
        int updated = reminderRepository.markCancelled(reminder.getId(), OffsetDateTime.now(clock));
        if (updated != 1) {
            throw new PersistenceFailureException("Failed to cancel reminder " + reference + ". Please try again.");
        }
        log.info("Reminder cancelled via WhatsApp. reference={}, userId={}", reference, user.getId());
        return ActionResult.reply(templates.reminderCancelled(reminder));
    }

    private ReminderRecord newRecord(User user, ReminderKind kind, OffsetDateTime dueAt) {
        ReminderRecord record = new ReminderRecord();
        record.setReference(nextReference(kind));
        record.setOwner(user);
        record.setOrganizationId(user.getOrganizationId());
        record.setKind(kind);
        record.setDueAt(dueAt);
        record.setStatus(ReminderStatus.PENDING);
        return record;
    }

    private ReminderRecord persist(ReminderRecord record) {
        try {
            return reminderRepository.saveAndFlush(record);
        } catch (DataIntegrityViolationException e) {
            log.warn("Reminder reference collision. reference={}, error={}", record.getReference(), e.getMessage());
            throw new PersistenceFailureException("Failed to save the reminder. Please try again.");
        }
    }

    private String nextReference(ReminderKind kind) {
        int year = ZonedDateTime.now(clock).withZoneSameInstant(templates.zoneId()).getYear();
        String prefix = kind.referencePrefix() + year + "-";
        long count = reminderRepository.countByReferenceStartingWith(prefix);
        return prefix + String.format("%04d", count + 1);
    }

    private OffsetDateTime requireFutureTime(Intent intent, String pastMessage) {
        String value = intent.slot(Slot.REMINDER_TIME);
        if (value == null) {
            throw new ValidationFailureException("Please specify when.\n\nExample: \"Remind me about the meeting at 2:30 PM tomorrow\"");
        }
        OffsetDateTime dueAt;
        try {
            dueAt = OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationFailureException("Could not understand the date/time. Please try again.");
        }
        if (!dueAt.isAfter(OffsetDateTime.now(clock))) {
            throw new ValidationFailureException(pastMessage);
        }
        return dueAt;
    }

    private static String firstNonNull(String first, String second, String fallback) {
        if (first != null) {
            return first;
        }
        return second != null ? second : fallback;
    }
}
