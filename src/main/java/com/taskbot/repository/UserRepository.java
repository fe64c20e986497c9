package com.taskbot.repository;

import com.taskbot.domain.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface UserRepository extends JpaRepository<User, UUID> {

    Optional<User> findFirstByWhatsappNumberInOrPhoneIn(Collection<String> whatsappNumbers, Collection<String> phones);

    List<User> findByActiveTrueAndDailyDigestEnabledTrue();

    /**
     * Active users of an organization whose email, first, last or full name contains the lower-cased needle.
     * An exact email match sorts first.
     */
    @Query("""
            select u from User u
            where u.organizationId = :organizationId
              and u.active = true
              and (lower(u.email) like concat('%', :needle, '%')
                or lower(u.firstName) like concat('%', :needle, '%')
                or lower(u.lastName) like concat('%', :needle, '%')
                or lower(concat(u.firstName, ' ', coalesce(u.lastName, ''))) like concat('%', :needle, '%'))
            order by case when lower(u.email) = :needle then 0 else 1 end, u.firstName asc
            """)
    List<User> findAssigneeCandidates(@Param("organizationId") String organizationId, @Param("needle") String needle);
}
