package com.fintracker.recurring.repositories;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import com.fintracker.recurring.entities.TransactionInstance;

/**
 * Queries shared by the expense and income tables. The generator and the template lifecycle
 * only ever talk to instances through this contract.
 */
@NoRepositoryBean
public interface TransactionInstanceRepository<T extends TransactionInstance> extends JpaRepository<T, UUID> {

    boolean existsByRecurringTemplateIdAndTransactionDate(UUID recurringTemplateId, LocalDate transactionDate);

    List<T> findByRecurringTemplateIdOrderByTransactionDateAsc(UUID recurringTemplateId);

    List<T> findByRecurringTemplateIdAndGeneratedTrueAndTransactionDateAfter(UUID recurringTemplateId, LocalDate date);

    List<T> findByUserIdAndTransactionDateBetweenOrderByTransactionDateAsc(UUID userId, LocalDate start, LocalDate end);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from #{#entityName} i "
            + "where i.recurringTemplateId = :templateId "
            + "and i.generated = true "
            + "and i.transactionDate > :today")
    int deleteFutureGenerated(@Param("templateId") UUID templateId, @Param("today") LocalDate today);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from #{#entityName} i "
            + "where i.recurringTemplateId = :templateId "
            + "and i.generated = true "
            + "and i.transactionDate > :today "
            + "and i.id <> :preservedId")
    int deleteFutureGeneratedExcept(
            @Param("templateId") UUID templateId,
            @Param("today") LocalDate today,
            @Param("preservedId") UUID preservedId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from #{#entityName} i "
            + "where i.recurringTemplateId = :templateId "
            + "and i.transactionDate > :today")
    int deleteFuture(@Param("templateId") UUID templateId, @Param("today") LocalDate today);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update #{#entityName} i set i.recurringTemplateId = null "
            + "where i.recurringTemplateId = :templateId "
            + "and i.transactionDate <= :today")
    int unlinkPastAndPresent(@Param("templateId") UUID templateId, @Param("today") LocalDate today);
}
