package com.taskbot.repository;

import com.taskbot.domain.model.PendingConversation;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Optional;

public interface PendingConversationRepository extends JpaRepository<PendingConversation, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from PendingConversation p where p.sender = :sender")
    Optional<PendingConversation> findForUpdate(@Param("sender") String sender);

    @Modifying
    @Query("delete from PendingConversation p where p.expiresAt <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
