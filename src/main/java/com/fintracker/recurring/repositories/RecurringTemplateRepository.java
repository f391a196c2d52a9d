package com.fintracker.recurring.repositories;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import com.fintracker.recurring.entities.RecurringTemplate;

public interface RecurringTemplateRepository extends JpaRepository<RecurringTemplate, UUID> {

    @Query("select t from RecurringTemplate t "
            + "where t.active = true "
            + "and (t.nextGenerationDate is null or t.nextGenerationDate <= :windowEnd) "
            + "order by t.createdAt asc")
    List<RecurringTemplate> findActiveDueBefore(@Param("windowEnd") LocalDate windowEnd);

    List<RecurringTemplate> findByUserIdOrderByCreatedAtDesc(UUID userId);

    List<RecurringTemplate> findByActiveTrue();

    /**
     * Moves the bookmark forward. Rows whose bookmark is already at or past {@code last}
     * are left alone, so a slower concurrent run can never pull it back.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update RecurringTemplate t "
            + "set t.lastGeneratedDate = :last, t.nextGenerationDate = :next "
            + "where t.id = :id "
            + "and (t.lastGeneratedDate is null or t.lastGeneratedDate < :last)")
    int advanceBookmark(
            @Param("id") UUID id,
            @Param("last") LocalDate last,
            @Param("next") LocalDate next);
}
