package com.fintracker.recurring.services.recurring;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fintracker.recurring.entities.RecurringTemplate;
import com.fintracker.recurring.entities.TransactionInstance;
import com.fintracker.recurring.enums.ReconciliationMode;
import com.fintracker.recurring.enums.RecurringFrequency;
import com.fintracker.recurring.enums.TemplateType;
import com.fintracker.recurring.exceptions.ResourceNotFoundException;
import com.fintracker.recurring.mappers.RecurringTemplateMapper;
import com.fintracker.recurring.repositories.ExpenseRepository;
import com.fintracker.recurring.repositories.IncomeRepository;
import com.fintracker.recurring.repositories.RecurringTemplateRepository;
import com.fintracker.recurring.repositories.TransactionInstanceRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies a template change to the instances linked to it.
 *
 * <pre>
 * mode             | date &lt;= today            | date &gt; today
 * -----------------+--------------------------+------------------------------------------------
 * EDIT_ALL_FUTURE  | untouched                | generated ones deleted (except preserved) and
 *                  |                          | restamped with the new values up to the bookmark
 * DELETE_TEMPLATE  | unlinked                 | deleted
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InstanceReconciliationService {

    private final ExpenseRepository expenseRepository;
    private final IncomeRepository incomeRepository;
    private final RecurringTemplateRepository templateRepository;

    /**
     * Same as the five argument form with the template's schedule taken as unchanged.
     */
    @Transactional
    public ReconciliationResult reconcileInstancesOnTemplateChange(
            UUID templateId,
            LocalDate today,
            ReconciliationMode mode,
            UUID preservedInstanceId
    ) {
        return reconcileInstancesOnTemplateChange(templateId, today, mode, preservedInstanceId, null);
    }

    /**
     * @param previousSchedule start date and frequency before the edit; only read by EDIT_ALL_FUTURE,
     *                         null when they did not change
     */
    @Transactional
    public ReconciliationResult reconcileInstancesOnTemplateChange(
            UUID templateId,
            LocalDate today,
            ReconciliationMode mode,
            UUID preservedInstanceId,
            SeriesSchedule previousSchedule
    ) {
        RecurringTemplate template = templateRepository.findById(templateId)
                .orElseThrow(() -> new ResourceNotFoundException("Template recorrente não encontrado"));

        ReconciliationResult result = switch (mode) {
            case EDIT_ALL_FUTURE -> editAllFuture(template, today, preservedInstanceId,
                    previousSchedule != null ? previousSchedule : SeriesSchedule.of(template));
            case DELETE_TEMPLATE -> {
                TransactionInstanceRepository<? extends TransactionInstance> instances =
                        instancesFor(template.resolveType());
                // future rows go first; nothing may keep pointing at the template once it is removed
                int deleted = instances.deleteFuture(templateId, today);
                int unlinked = instances.unlinkPastAndPresent(templateId, today);
                yield new ReconciliationResult(deleted, unlinked, 0);
            }
        };

        log.info("[RecurringTemplate] reconciled template={} mode={} today={} deleted={} unlinked={} restamped={}",
                templateId, mode, today, result.deleted(), result.unlinked(), result.restamped());
        return result;
    }

    public TransactionInstanceRepository<? extends TransactionInstance> instancesFor(TemplateType type) {
        return switch (type) {
            case EXPENSE -> expenseRepository;
            case INCOME -> incomeRepository;
        };
    }

    private ReconciliationResult editAllFuture(
            RecurringTemplate template,
            LocalDate today,
            UUID preservedInstanceId,
            SeriesSchedule previousSchedule
    ) {
        return switch (template.resolveType()) {
            case EXPENSE -> editAllFuture(template, today, preservedInstanceId, previousSchedule,
                    expenseRepository, date -> RecurringTemplateMapper.toExpense(template, date));
            case INCOME -> editAllFuture(template, today, preservedInstanceId, previousSchedule,
                    incomeRepository, date -> RecurringTemplateMapper.toIncome(template, date));
        };
    }

    /**
     * Replaces the future generated instances with ones carrying the new values. Only dates the
     * series had already reached (up to the bookmark) are restamped here; later dates are left to
     * the next generation run. A previous occurrence that is no longer linked to the template
     * (detached, or removed by hand) is never restamped.
     */
    private <T extends TransactionInstance> ReconciliationResult editAllFuture(
            RecurringTemplate template,
            LocalDate today,
            UUID preservedInstanceId,
            SeriesSchedule previousSchedule,
            TransactionInstanceRepository<T> instances,
            Function<LocalDate, T> factory
    ) {
        UUID templateId = template.getId();

        Set<LocalDate> deletedDates = instances
                .findByRecurringTemplateIdAndGeneratedTrueAndTransactionDateAfter(templateId, today).stream()
                .filter(instance -> !instance.getId().equals(preservedInstanceId))
                .map(TransactionInstance::getTransactionDate)
                .collect(Collectors.toSet());

        int deleted = preservedInstanceId == null
                ? instances.deleteFutureGenerated(templateId, today)
                : instances.deleteFutureGeneratedExcept(templateId, today, preservedInstanceId);

        LocalDate bookmark = template.getLastGeneratedDate();
        RecurringFrequency frequency = template.resolveFrequency();
        List<T> restamped = new ArrayList<>();

        if (bookmark != null && bookmark.isAfter(today)) {
            Set<LocalDate> previousDates = new HashSet<>();
            previousSchedule.occurrencesUpTo(bookmark).forEach(previousDates::add);

            for (LocalDate date : RecurrenceCalculator.expandWindow(template.getStartDate(), frequency, bookmark, null)) {
                if (!date.isAfter(today)) {
                    continue;
                }
                if (template.getEndDate() != null && date.isAfter(template.getEndDate())) {
                    break;
                }
                boolean leftSeries = previousDates.contains(date) && !deletedDates.contains(date);
                if (leftSeries || instances.existsByRecurringTemplateIdAndTransactionDate(templateId, date)) {
                    continue;
                }
                restamped.add(factory.apply(date));
            }
            instances.saveAll(restamped);
        }

        alignBookmark(template, bookmark, frequency);
        return new ReconciliationResult(deleted, 0, restamped.size());
    }

    /**
     * Keeps the bookmark where it was, moved onto the last occurrence of the current schedule
     * when the edit changed the start date or frequency.
     */
    private void alignBookmark(RecurringTemplate template, LocalDate bookmark, RecurringFrequency frequency) {
        LocalDate aligned = bookmark == null
                ? null
                : RecurrenceCalculator.lastOccurrenceOnOrBefore(template.getStartDate(), frequency, bookmark)
                        .orElse(null);

        template.setLastGeneratedDate(aligned);
        template.setNextGenerationDate(RecurrenceCalculator.nextGenerationDate(template));
        templateRepository.save(template);
    }
}
