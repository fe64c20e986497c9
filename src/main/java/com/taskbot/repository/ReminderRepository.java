package com.taskbot.repository;

import com.taskbot.domain.enums.ReminderKind;
import com.taskbot.domain.enums.ReminderStatus;
import com.taskbot.domain.model.ReminderRecord;
import com.taskbot.domain.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ReminderRepository extends JpaRepository<ReminderRecord, UUID> {

    Optional<ReminderRecord> findByReferenceAndOwner(String reference, User owner);

    long countByReferenceStartingWith(String referencePrefix);

    List<ReminderRecord> findTop10ByOwnerAndStatusAndDueAtGreaterThanEqualOrderByDueAtAsc(
            User owner, ReminderStatus status, OffsetDateTime from);

    List<ReminderRecord> findTop15ByOwnerAndKindAndStatusAndDueAtGreaterThanEqualAndDueAtLessThanOrderByDueAtAsc(
            User owner, ReminderKind kind, ReminderStatus status, OffsetDateTime from, OffsetDateTime to);

    List<ReminderRecord> findTop15ByOwnerAndKindAndStatusAndDueAtGreaterThanEqualOrderByDueAtAsc(
            User owner, ReminderKind kind, ReminderStatus status, OffsetDateTime from);

    @Query("""
            select r.id from ReminderRecord r
            where r.status = com.taskbot.domain.enums.ReminderStatus.PENDING
              and r.dueAt between :from and :to
            order by r.dueAt asc
            """)
    List<UUID> findDueIds(@Param("from") OffsetDateTime from, @Param("to") OffsetDateTime to);

    /**
     * Moves a reminder from pending to sent. Returns 1 only for the caller that made the transition.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update ReminderRecord r
            set r.status = com.taskbot.domain.enums.ReminderStatus.SENT, r.sentAt = :now, r.updatedAt = :now
            where r.id = :id and r.status = com.taskbot.domain.enums.ReminderStatus.PENDING
            """)
    int markSent(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update ReminderRecord r
            set r.status = com.taskbot.domain.enums.ReminderStatus.CANCELLED, r.updatedAt = :now
            where r.id = :id and r.status = com.taskbot.domain.enums.ReminderStatus.PENDING
            """)
    int markCancelled(@Param("id") UUID id, @Param("now") OffsetDateTime now);
}
