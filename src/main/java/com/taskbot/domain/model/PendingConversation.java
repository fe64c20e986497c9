package com.taskbot.domain.model;

import com.taskbot.parsing.IntentKind;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A command waiting for missing slots. One row per sender key.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "pending_conversations", indexes = {
        @Index(name = "idx_pending_conversations_expires", columnList = "expires_at")
})
public class PendingConversation {

    @Id
    @Column(length = 32)
    private String sender;

    @Column(name = "owner_id", nullable = false)
    private UUID ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "intent_kind", nullable = false, length = 40)
    private IntentKind kind;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "collected_slots", nullable = false)
    private Map<String, String> collected = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "missing_slots", nullable = false)
    private List<String> missing = new ArrayList<>();

    @Column(name = "original_text", columnDefinition = "text")
    private String originalText;

    @Column(name = "last_prompt", columnDefinition = "text")
    private String lastPrompt;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public boolean isExpired(OffsetDateTime now) {
        return expiresAt == null || !expiresAt.isAfter(now);
    }

    @PrePersist
    @PreUpdate
    public void touch() {
        this.updatedAt = OffsetDateTime.now();
    }
}
