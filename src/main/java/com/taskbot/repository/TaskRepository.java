package com.taskbot.repository;

import com.taskbot.domain.enums.TaskStatus;
import com.taskbot.domain.model.Task;
import com.taskbot.domain.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TaskRepository extends JpaRepository<Task, UUID> {

    Optional<Task> findByOrganizationIdAndReference(String organizationId, String reference);

    long countByOrganizationIdAndReferenceStartingWith(String organizationId, String referencePrefix);

    @Query("""
            select distinct t from Task t
            left join t.secondaryAssignees s
            where t.organizationId = :organizationId
              and (t.assignedTo = :user or s = :user)
            order by t.deadline asc nulls last
            """)
    List<Task> findAssignedTo(@Param("organizationId") String organizationId, @Param("user") User user);

    /**
     * Open tasks whose deadline lies in [from, to] and that have no mark for the given lead time yet.
     */
    @Query("""
            select t.id from Task t
            where t.deadline between :from and :to
              and t.status not in :closed
              and not exists (
                  select 1 from Task marked join marked.leadTimeMarks m
                  where marked = t and key(m) = :leadMinutes)
            """)
    List<UUID> findDeadlineCandidates(@Param("from") OffsetDateTime from,
                                      @Param("to") OffsetDateTime to,
                                      @Param("closed") Collection<TaskStatus> closed,
                                      @Param("leadMinutes") int leadMinutes);

    /**
     * Inserts the lead-time mark unless it exists. Returns 1 for the caller that claimed it, 0 otherwise.
     * A concurrent claimer may also surface as a primary key violation.
     */
    @Modifying
    @Query(value = """
            insert into task_lead_time_marks (task_id, lead_minutes, fired_at)
            select :taskId, :leadMinutes, :firedAt
            where not exists (
                select 1 from task_lead_time_marks
                where task_id = :taskId and lead_minutes = :leadMinutes)
            """, nativeQuery = true)
    int claimLeadTime(@Param("taskId") UUID taskId,
                      @Param("leadMinutes") int leadMinutes,
                      @Param("firedAt") OffsetDateTime firedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Task t set t.status = :status, t.progress = :progress, t.updatedAt = :now where t.id = :id")
    int updateStatusAndProgress(@Param("id") UUID id,
                                @Param("status") TaskStatus status,
                                @Param("progress") int progress,
                                @Param("now") OffsetDateTime now);
}
