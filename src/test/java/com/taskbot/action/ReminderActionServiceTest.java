package com.taskbot.action;

import com.taskbot.config.AssistantProperties;
import com.taskbot.domain.enums.ReminderKind;
import com.taskbot.domain.enums.ReminderStatus;
import com.taskbot.domain.model.ReminderRecord;
import com.taskbot.domain.model.User;
import com.taskbot.exception.NotFoundException;
import com.taskbot.exception.PersistenceFailureException;
import com.taskbot.exception.ValidationFailureException;
import com.taskbot.messaging.MessageTemplates;
import com.taskbot.parsing.Intent;
import com.taskbot.parsing.IntentKind;
import com.taskbot.parsing.Slot;
import com.taskbot.repository.ReminderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReminderActionServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Karachi");
    private static final ZonedDateTime NOW = ZonedDateTime.of(2026, 3, 10, 10, 0, 0, 0, ZONE);

    @Mock
    private ReminderRepository reminderRepository;

    private ReminderActionService service;
    private User user;

    @BeforeEach
    void setUp() {
        AssistantProperties properties = new AssistantProperties("TaskBot", "Asia/Karachi", null, null, null, null);
        service = new ReminderActionService(reminderRepository, new MessageTemplates(properties),
                Clock.fixed(NOW.toInstant(), ZONE));
        user = new User();
        user.setId(UUID.randomUUID());
        user.setFirstName("Ali");
        user.setOrganizationId("acme");
    }

    @Test
    void setReminderStoresPendingRecordWithNextReference() {
        OffsetDateTime dueAt = NOW.plusHours(5).toOffsetDateTime();
        when(reminderRepository.countByReferenceStartingWith("REM-2026-")).thenReturn(6L);
        when(reminderRepository.saveAndFlush(any(ReminderRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        ActionResult result = service.setReminder(user, Intent.of(IntentKind.SET_REMINDER,
                Map.of(Slot.REMINDER_TIME, dueAt.toString(), Slot.REMINDER_TITLE, "call the bank"), "text"));

        ArgumentCaptor<ReminderRecord> saved = ArgumentCaptor.forClass(ReminderRecord.class);
        verify(reminderRepository).saveAndFlush(saved.capture());
        ReminderRecord reminder = saved.getValue();
        assertThat(reminder.getReference()).isEqualTo("REM-2026-0007");
        assertThat(reminder.getKind()).isEqualTo(ReminderKind.REMINDER);
        assertThat(reminder.getStatus()).isEqualTo(ReminderStatus.PENDING);
        assertThat(reminder.getTitle()).isEqualTo("call the bank");
        assertThat(reminder.getBody()).isEqualTo("call the bank");
        assertThat(reminder.getDueAt()).isEqualTo(dueAt);
        assertThat(result.reply()).contains("Reminder Set").contains("REM-2026-0007")
                .contains("Tuesday, 10 March 2026 at 03:00 PM");
    }

    @Test
    void setReminderWithoutTitleUsesDefaults() {
        when(reminderRepository.countByReferenceStartingWith("REM-2026-")).thenReturn(0L);
        when(reminderRepository.saveAndFlush(any(ReminderRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        service.setReminder(user, Intent.of(IntentKind.SET_REMINDER,
                Map.of(Slot.REMINDER_TIME, NOW.plusMinutes(30).toOffsetDateTime().toString()), "text"));

        ArgumentCaptor<ReminderRecord> saved = ArgumentCaptor.forClass(ReminderRecord.class);
        verify(reminderRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getTitle()).isEqualTo("Reminder");
        assertThat(saved.getValue().getBody()).isEqualTo("You have a reminder");
    }

    @Test
    void reminderInThePastIsRejected() {
        Intent intent = Intent.of(IntentKind.SET_REMINDER,
                Map.of(Slot.REMINDER_TIME, NOW.minusMinutes(1).toOffsetDateTime().toString()), "text");

        assertThatThrownBy(() -> service.setReminder(user, intent))
                .isInstanceOf(ValidationFailureException.class)
                .hasMessage("The reminder time must be in the future. Please try again.");
        verifyNoInteractions(reminderRepository);
    }

    @Test
    void scheduleMeetingBuildsTitleAndBody() {
        when(reminderRepository.countByReferenceStartingWith("MTG-2026-")).thenReturn(1L);
        when(reminderRepository.saveAndFlush(any(ReminderRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        ActionResult result = service.scheduleMeeting(user, Intent.of(IntentKind.SCHEDULE_MEETING, Map.of(
                Slot.REMINDER_TIME, NOW.plusDays(1).toOffsetDateTime().toString(),
                Slot.MEETING_WITH, "Ahmed",
                Slot.MEETING_SUBJECT, "budget review",
                Slot.MEETING_LOCATION, "conference room"), "text"));

        ArgumentCaptor<ReminderRecord> saved = ArgumentCaptor.forClass(ReminderRecord.class);
        verify(reminderRepository).saveAndFlush(saved.capture());
        ReminderRecord meeting = saved.getValue();
        assertThat(meeting.getReference()).isEqualTo("MTG-2026-0002");
        assertThat(meeting.getKind()).isEqualTo(ReminderKind.MEETING);
        assertThat(meeting.getTitle()).isEqualTo("Meeting with Ahmed: budget review");
        assertThat(meeting.getBody()).isEqualTo("Meeting: budget review\nWith: Ahmed\nLocation: conference room");
        assertThat(result.reply()).contains("Meeting Scheduled").contains("Subject: budget review");
    }

    @Test
    void listMeetingsForTomorrowQueriesNextDay() {
        when(reminderRepository.findTop15ByOwnerAndKindAndStatusAndDueAtGreaterThanEqualAndDueAtLessThanOrderByDueAtAsc(
                any(User.class), any(ReminderKind.class), any(ReminderStatus.class), any(OffsetDateTime.class), any(OffsetDateTime.class)))
                .thenReturn(List.of());

        ActionResult result = service.listMeetings(user, Intent.of(IntentKind.LIST_MEETINGS, Map.of(Slot.PERIOD, "tomorrow"), "text"));

        OffsetDateTime startOfTomorrow = ZonedDateTime.of(2026, 3, 11, 0, 0, 0, 0, ZONE).toOffsetDateTime();
        verify(reminderRepository).findTop15ByOwnerAndKindAndStatusAndDueAtGreaterThanEqualAndDueAtLessThanOrderByDueAtAsc(
                user, ReminderKind.MEETING, ReminderStatus.PENDING, startOfTomorrow, startOfTomorrow.plusDays(1));
        assertThat(result.reply()).contains("No Meetings Tomorrow");
    }

    @Test
    void cancelReminderMovesPendingToCancelled() {
        ReminderRecord reminder = reminder("REM-2026-0003", ReminderStatus.PENDING);
        when(reminderRepository.findByReferenceAndOwner("REM-2026-0003", user)).thenReturn(Optional.of(reminder));
        when(reminderRepository.markCancelled(reminder.getId(), NOW.toOffsetDateTime())).thenReturn(1);

        ActionResult result = service.cancelReminder(user, Intent.of(IntentKind.CANCEL_REMINDER,
                Map.of(Slot.REMINDER_ID, "REM-2026-0003"), "text"));

        assertThat(result.reply()).contains("Reminder Cancelled").contains("REM-2026-0003");
    }

    @Test
    void cancelOfSomeoneElsesReminderIsNotFound() {
        when(reminderRepository.findByReferenceAndOwner("REM-2026-0003", user)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.cancelReminder(user, Intent.of(IntentKind.CANCEL_REMINDER,
                Map.of(Slot.REMINDER_ID, "REM-2026-0003"), "text")))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("does not belong to you");
    }

    @Test
    void cancelOfSentReminderIsRejected() {
        when(reminderRepository.findByReferenceAndOwner("REM-2026-0003", user))
                .thenReturn(Optional.of(reminder("REM-2026-0003", ReminderStatus.SENT)));

        assertThatThrownBy(() -> service.cancelReminder(user, Intent.of(IntentKind.CANCEL_REMINDER,
                Map.of(Slot.REMINDER_ID, "REM-2026-0003"), "text")))
                .isInstanceOf(ValidationFailureException.class)
                .hasMessage("Reminder REM-2026-0003 is already sent.");
        verify(reminderRepository, never()).markCancelled(any(), any());
    }

    @Test
    void cancelLosingRaceWithDispatcherFails() {
        ReminderRecord reminder = reminder("REM-2026-0003", ReminderStatus.PENDING);
        when(reminderRepository.findByReferenceAndOwner("REM-2026-0003", user)).thenReturn(Optional.of(reminder));
        when(reminderRepository.markCancelled(reminder.getId(), NOW.toOffsetDateTime())).thenReturn(0);

        assertThatThrownBy(() -> service.cancelReminder(user, Intent.of(IntentKind.CANCEL_REMINDER,
                Map.of(Slot.REMINDER_ID, "REM-2026-0003"), "text")))
                .isInstanceOf(PersistenceFailureException.class);
    }

    private ReminderRecord reminder(String reference, ReminderStatus status) {
        ReminderRecord reminder = new ReminderRecord();
        reminder.setId(UUID.randomUUID());
        reminder.setReference(reference);
        reminder.setOwner(user);
        reminder.setTitle("call the bank");
        reminder.setDueAt(NOW.plusHours(1).toOffsetDateTime());
        reminder.setStatus(status);
        return reminder;
    }
}
