package com.fintracker.recurring.services.recurring;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import org.springframework.stereotype.Component;

import com.fintracker.recurring.entities.RecurringTemplate;
import com.fintracker.recurring.entities.TransactionInstance;
import com.fintracker.recurring.enums.RecurringFrequency;
import com.fintracker.recurring.mappers.RecurringTemplateMapper;
import com.fintracker.recurring.repositories.ExpenseRepository;
import com.fintracker.recurring.repositories.IncomeRepository;
import com.fintracker.recurring.repositories.RecurringTemplateRepository;
import com.fintracker.recurring.repositories.TransactionInstanceRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Brings a single template up to date within the generation window.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecurringTemplateGenerator {

    private final ExpenseRepository expenseRepository;
    private final IncomeRepository incomeRepository;
    private final RecurringTemplateRepository templateRepository;
    private final RecurringInstanceWriter instanceWriter;

    /**
     * @return number of instances inserted for this template
     */
    public int generate(RecurringTemplate template, LocalDate windowEnd) {
        RecurringFrequency frequency = template.resolveFrequency();

        return switch (template.resolveType()) {
            case EXPENSE -> generate(template, frequency, windowEnd, expenseRepository,
                    date -> RecurringTemplateMapper.toExpense(template, date));
            case INCOME -> generate(template, frequency, windowEnd, incomeRepository,
                    date -> RecurringTemplateMapper.toIncome(template, date));
        };
    }

    private <T extends TransactionInstance> int generate(
            RecurringTemplate template,
            RecurringFrequency frequency,
            LocalDate windowEnd,
            TransactionInstanceRepository<T> repository,
            Function<LocalDate, T> factory
    ) {
        List<LocalDate> candidates = candidateDates(template, frequency, windowEnd);
        if (candidates.isEmpty()) {
            return 0;
        }

        List<LocalDate> missing = new ArrayList<>();
        for (LocalDate date : candidates) {
            if (!repository.existsByRecurringTemplateIdAndTransactionDate(template.getId(), date)) {
                missing.add(date);
            }
        }

        int inserted = instanceWriter.insertAll(repository, missing, factory);

        if (inserted > 0) {
            LocalDate last = candidates.get(candidates.size() - 1);
            LocalDate next = RecurrenceCalculator.nextDate(last, frequency);
            templateRepository.advanceBookmark(template.getId(), last, next);
            template.setLastGeneratedDate(last);
            template.setNextGenerationDate(next);
        }

        log.debug("[RecurringGeneration] template={} candidates={} missing={} inserted={}",
                template.getId(), candidates.size(), missing.size(), inserted);
        return inserted;
    }

    /**
     * Window dates after the bookmark, cut off at the template's end date.
     */
    static List<LocalDate> candidateDates(RecurringTemplate template, RecurringFrequency frequency, LocalDate windowEnd) {
        List<LocalDate> dates = new ArrayList<>();
        Iterable<LocalDate> window = RecurrenceCalculator.expandWindow(
                template.getStartDate(), frequency, windowEnd, template.getLastGeneratedDate());

        for (LocalDate date : window) {
            if (template.getEndDate() != null && date.isAfter(template.getEndDate())) {
                break;
            }
            dates.add(date);
        }
        return dates;
    }
}
