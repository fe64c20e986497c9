package com.taskbot.domain.model;

import com.taskbot.domain.enums.TaskStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Embeddable
public class TaskUpdateEntry {

    @Column(name = "message", columnDefinition = "text", nullable = false)
    private String message;

    @Column(name = "author_id")
    private UUID authorId;

    @Column(name = "added_at", nullable = false)
    private OffsetDateTime addedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status_after", length = 20)
    private TaskStatus status;

    @Column(name = "progress_after")
    private Integer progress;
}
