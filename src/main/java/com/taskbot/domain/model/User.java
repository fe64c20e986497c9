package com.taskbot.domain.model;

import com.taskbot.domain.enums.UserRole;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "users", indexes = {
        @Index(name = "idx_users_whatsapp_number", columnList = "whatsapp_number"),
        @Index(name = "idx_users_phone", columnList = "phone"),
        @Index(name = "idx_users_organization", columnList = "organization_id")
})
public class User extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "first_name", nullable = false)
    private String firstName;

    @Column(name = "last_name")
    private String lastName;

    @Column
    private String email;

    /**
     * Canonical sender key, see {@code CommandNormalizer#senderKey}.
     */
    @Column
    private String phone;

    @Column(name = "whatsapp_number")
    private String whatsappNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role = UserRole.EMPLOYEE;

    @Column(name = "organization_id", nullable = false)
    private String organizationId;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "notifications_enabled", nullable = false)
    private boolean notificationsEnabled = true;

    @Column(name = "reminders_enabled", nullable = false)
    private boolean remindersEnabled = true;

    @Column(name = "task_assigned_enabled", nullable = false)
    private boolean taskAssignedEnabled = true;

    @Column(name = "daily_digest_enabled", nullable = false)
    private boolean dailyDigestEnabled = true;

    // empty means every configured lead time
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_reminder_lead_minutes", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "lead_minutes", nullable = false)
    private Set<Integer> reminderLeadMinutes = new HashSet<>();

    public String displayName() {
        if (lastName == null || lastName.isBlank()) {
            return firstName;
        }
        return firstName + " " + lastName;
    }

    public String deliveryAddress() {
        if (whatsappNumber != null && !whatsappNumber.isBlank()) {
            return whatsappNumber;
        }
        return phone;
    }

    public boolean acceptsLeadTime(int minutes) {
        return reminderLeadMinutes == null || reminderLeadMinutes.isEmpty() || reminderLeadMinutes.contains(minutes);
    }
}
