package com.fintracker.recurring.services.recurring;

import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import com.fintracker.recurring.entities.Expense;
import com.fintracker.recurring.entities.Income;
import com.fintracker.recurring.entities.TransactionInstance;
import com.fintracker.recurring.repositories.TransactionInstanceRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Inserts generated instances. The unique (template, date) constraint is the real guard against
 * two overlapping runs; a row rejected by it counts as already generated. Any other integrity
 * violation (check, not null, foreign key) is a write failure and is rethrown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecurringInstanceWriter {

    private static final List<String> TEMPLATE_DATE_CONSTRAINTS =
            List.of(Expense.TEMPLATE_DATE_CONSTRAINT, Income.TEMPLATE_DATE_CONSTRAINT);

    private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    private final TransactionTemplate transactionTemplate;

    /**
     * @return number of rows inserted by this call
     */
    public <T extends TransactionInstance> int insertAll(
            TransactionInstanceRepository<T> repository,
            List<LocalDate> dates,
            Function<LocalDate, T> factory
    ) {
        if (dates == null || dates.isEmpty()) {
            return 0;
        }

        try {
            transactionTemplate.executeWithoutResult(status ->
                    repository.saveAllAndFlush(dates.stream().map(factory).toList()));
            return dates.size();
        } catch (DataIntegrityViolationException e) {
            if (!isTemplateDateDuplicate(e)) {
                throw e;
            }
            log.warn("[RecurringInstanceWriter] batch of {} rows rejected by unique constraint, retrying row by row",
                    dates.size());
        }

        // entities are rebuilt for every attempt: the rolled back batch left ids on the old ones
        int inserted = 0;
        for (LocalDate date : dates) {
            try {
                transactionTemplate.executeWithoutResult(status -> repository.saveAndFlush(factory.apply(date)));
                inserted++;
            } catch (DataIntegrityViolationException e) {
                if (!isTemplateDateDuplicate(e)) {
                    throw e;
                }
                log.warn("[RecurringInstanceWriter] instance for {} already generated by a concurrent run", date);
            }
        }
        return inserted;
    }

    /**
     * True only for a violation of the (template, date) unique constraint. The constraint name
     * reported by Hibernate decides when present; otherwise the unique violation SQL state does.
     */
    static boolean isTemplateDateDuplicate(DataIntegrityViolationException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException violation && violation.getConstraintName() != null) {
                String name = violation.getConstraintName().toLowerCase(Locale.ROOT);
                return TEMPLATE_DATE_CONSTRAINTS.stream().anyMatch(name::contains);
            }
            if (cause instanceof SQLException sql) {
                return UNIQUE_VIOLATION_SQL_STATE.equals(sql.getSQLState());
            }
            if (cause instanceof DuplicateKeyException && cause.getCause() == null) {
                return true;
            }
        }
        return false;
    }
}
