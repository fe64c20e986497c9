package com.taskbot.domain.model;

import com.taskbot.domain.enums.ReminderKind;
import com.taskbot.domain.enums.ReminderStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "reminders", indexes = {
        @Index(name = "idx_reminders_due", columnList = "status,due_at"),
        @Index(name = "idx_reminders_reference", columnList = "reference", unique = true)
})
public class ReminderRecord extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 20)
    private String reference;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false)
    private User owner;

    @Column(name = "organization_id", nullable = false)
    private String organizationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReminderKind kind = ReminderKind.REMINDER;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "text")
    private String body;

    @Column(name = "due_at", nullable = false)
    private OffsetDateTime dueAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReminderStatus status = ReminderStatus.PENDING;

    @Column(name = "sent_at")
    private OffsetDateTime sentAt;

    @Column(name = "meeting_with")
    private String meetingWith;

    @Column(name = "meeting_location")
    private String meetingLocation;

    @Column(nullable = false, length = 20)
    private String source = "whatsapp";
}
