package com.taskbot.domain.model;

import com.taskbot.domain.enums.TaskPriority;
import com.taskbot.domain.enums.TaskStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "tasks", uniqueConstraints = {
        @UniqueConstraint(name = "uk_tasks_org_reference", columnNames = {"organization_id", "reference"})
}, indexes = {
        @Index(name = "idx_tasks_deadline_status", columnList = "deadline,status")
})
public class Task extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 20)
    private String reference;

    @Column(name = "organization_id", nullable = false)
    private String organizationId;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "text")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TaskPriority priority = TaskPriority.MEDIUM;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TaskStatus status = TaskStatus.PENDING;

    @Column(nullable = false)
    private int progress = 0;

    @Column
    private OffsetDateTime deadline;

    @Column(columnDefinition = "text")
    private String blocker;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assigned_to_id")
    private User assignedTo;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(name = "task_secondary_assignees",
            joinColumns = @JoinColumn(name = "task_id"),
            inverseJoinColumns = @JoinColumn(name = "user_id"))
    private Set<User> secondaryAssignees = new LinkedHashSet<>();

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assigned_by_id")
    private User assignedBy;

    @ElementCollection
    @CollectionTable(name = "task_updates", joinColumns = @JoinColumn(name = "task_id"))
    @OrderColumn(name = "update_index")
    private List<TaskUpdateEntry> updates = new ArrayList<>();

    /**
     * Lead times (minutes) that already produced a deadline reminder, with the time they fired.
     * Rows are only ever inserted through {@code TaskRepository#claimLeadTime}.
     */
    @ElementCollection
    @CollectionTable(name = "task_lead_time_marks", joinColumns = @JoinColumn(name = "task_id"))
    @MapKeyColumn(name = "lead_minutes")
    @Column(name = "fired_at", nullable = false)
    private Map<Integer, OffsetDateTime> leadTimeMarks = new HashMap<>();

    public boolean isOverdue(OffsetDateTime now) {
        return deadline != null && deadline.isBefore(now) && !status.isClosed();
    }

    public boolean involves(User user) {
        if (user == null || user.getId() == null) {
            return false;
        }
        if (assignedTo != null && user.getId().equals(assignedTo.getId())) {
            return true;
        }
        if (assignedBy != null && user.getId().equals(assignedBy.getId())) {
            return true;
        }
        return secondaryAssignees.stream().anyMatch(u -> user.getId().equals(u.getId()));
    }
}
