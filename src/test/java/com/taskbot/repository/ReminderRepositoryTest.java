package com.taskbot.repository;

import com.taskbot.domain.enums.ReminderKind;
import com.taskbot.domain.enums.ReminderStatus;
import com.taskbot.domain.model.ReminderRecord;
import com.taskbot.domain.model.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class ReminderRepositoryTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 10, 15, 0, 0, 0, ZoneOffset.ofHours(5));

    @Autowired
    private ReminderRepository reminderRepository;

    @Autowired
    private TestEntityManager entityManager;

    private User owner;

    @BeforeEach
    void setUp() {
        owner = new User();
        owner.setFirstName("Ali");
        owner.setOrganizationId("acme");
        owner.setWhatsappNumber("923001111111");
        owner = entityManager.persist(owner);
    }

    @Test
    void markSentTransitionsOnlyOnce() {
        ReminderRecord reminder = entityManager.persistAndFlush(reminder("REM-2026-0001", ReminderKind.REMINDER, NOW));

        int first = reminderRepository.markSent(reminder.getId(), NOW);
        int second = reminderRepository.markSent(reminder.getId(), NOW.plusMinutes(1));

        ReminderRecord reread = reminderRepository.findById(reminder.getId()).orElseThrow();
        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        assertThat(reread.getStatus()).isEqualTo(ReminderStatus.SENT);
        assertThat(reread.getSentAt()).isAtSameInstantAs(NOW);
    }

    @Test
    void cancelledReminderCannotBeSent() {
        ReminderRecord reminder = entityManager.persistAndFlush(reminder("REM-2026-0001", ReminderKind.REMINDER, NOW));

        int cancelled = reminderRepository.markCancelled(reminder.getId(), NOW.minusMinutes(10));
        int sent = reminderRepository.markSent(reminder.getId(), NOW);

        assertThat(cancelled).isEqualTo(1);
        assertThat(sent).isZero();
        assertThat(reminderRepository.findById(reminder.getId()).orElseThrow().getStatus())
                .isEqualTo(ReminderStatus.CANCELLED);
    }

    @Test
    void dueIdsAreLimitedToPendingWithinLookback() {
        ReminderRecord due = entityManager.persist(reminder("REM-2026-0001", ReminderKind.REMINDER, NOW.minusMinutes(2)));
        ReminderRecord dueMeeting = entityManager.persist(reminder("MTG-2026-0001", ReminderKind.MEETING, NOW.minusMinutes(4)));
        entityManager.persist(reminder("REM-2026-0002", ReminderKind.REMINDER, NOW.minusMinutes(30)));
        entityManager.persist(reminder("REM-2026-0003", ReminderKind.REMINDER, NOW.plusMinutes(1)));
        ReminderRecord sent = reminder("REM-2026-0004", ReminderKind.REMINDER, NOW.minusMinutes(1));
        sent.setStatus(ReminderStatus.SENT);
        entityManager.persist(sent);
        entityManager.flush();

        List<UUID> ids = reminderRepository.findDueIds(NOW.minusMinutes(5), NOW);

        assertThat(ids).containsExactly(dueMeeting.getId(), due.getId());
    }

    @Test
    void referencesAreCountedGloballyPerPrefix() {
        entityManager.persist(reminder("REM-2026-0001", ReminderKind.REMINDER, NOW));
        entityManager.persist(reminder("REM-2026-0002", ReminderKind.REMINDER, NOW));
        entityManager.persist(reminder("MTG-2026-0001", ReminderKind.MEETING, NOW));
        entityManager.flush();

        assertThat(reminderRepository.countByReferenceStartingWith("REM-2026-")).isEqualTo(2);
        assertThat(reminderRepository.countByReferenceStartingWith("MTG-2026-")).isEqualTo(1);
        assertThat(reminderRepository.findByReferenceAndOwner("MTG-2026-0001", owner)).isPresent();
    }

    @Test
    void meetingsAreListedForOneDayInOrder() {
        OffsetDateTime tomorrow = NOW.plusDays(1).withHour(0);
        entityManager.persist(reminder("MTG-2026-0002", ReminderKind.MEETING, tomorrow.plusHours(15)));
        entityManager.persist(reminder("MTG-2026-0001", ReminderKind.MEETING, tomorrow.plusHours(11)));
        entityManager.persist(reminder("MTG-2026-0003", ReminderKind.MEETING, tomorrow.plusDays(1).plusHours(9)));
        entityManager.persist(reminder("REM-2026-0001", ReminderKind.REMINDER, tomorrow.plusHours(12)));
        entityManager.flush();

        List<ReminderRecord> meetings = reminderRepository
                .findTop15ByOwnerAndKindAndStatusAndDueAtGreaterThanEqualAndDueAtLessThanOrderByDueAtAsc(
                        owner, ReminderKind.MEETING, ReminderStatus.PENDING, tomorrow, tomorrow.plusDays(1));

        assertThat(meetings).extracting(ReminderRecord::getReference).containsExactly("MTG-2026-0001", "MTG-2026-0002");
    }

    private ReminderRecord reminder(String reference, ReminderKind kind, OffsetDateTime dueAt) {
        ReminderRecord reminder = new ReminderRecord();
        reminder.setReference(reference);
        reminder.setOwner(owner);
        reminder.setOrganizationId("acme");
        reminder.setKind(kind);
        reminder.setTitle("Reminder " + reference);
        reminder.setDueAt(dueAt);
        return reminder;
    }
}
