package com.fintracker.recurring.services.recurring;

import java.time.LocalDate;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

import com.fintracker.recurring.entities.RecurringTemplate;
import com.fintracker.recurring.enums.RecurringFrequency;

/**
 * Calendar arithmetic for recurring templates. Pure functions, no I/O.
 *
 * <p>Month based steps use {@link LocalDate#plusMonths(long)} and {@link LocalDate#plusYears(long)},
 * which clamp to the last valid day of the target month: Jan 31 + 1 month is Feb 28 (Feb 29 in a
 * leap year) and Feb 29 + 1 year is Feb 28. Each step starts from the previous result, so a series
 * anchored on the 31st settles on the 28th after February and stays there.
 */
public final class RecurrenceCalculator {

    private RecurrenceCalculator() {
    }

    public static LocalDate nextDate(LocalDate date, RecurringFrequency frequency) {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(frequency, "frequency");
        return switch (frequency) {
            case WEEKLY -> date.plusDays(7);
            case BIWEEKLY -> date.plusDays(14);
            case MONTHLY -> date.plusMonths(1);
            case QUARTERLY -> date.plusMonths(3);
            case YEARLY -> date.plusYears(1);
        };
    }

    /**
     * Occurrence dates up to and including {@code windowEnd}.
     *
     * <p>Without {@code resumeAfter} the series starts at {@code startDate}; with it, the first date
     * is {@code nextDate(resumeAfter)}, so the date already generated is never produced again. The
     * result is lazy and can be iterated more than once.
     */
    public static Iterable<LocalDate> expandWindow(
            LocalDate startDate,
            RecurringFrequency frequency,
            LocalDate windowEnd,
            LocalDate resumeAfter
    ) {
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(frequency, "frequency");
        Objects.requireNonNull(windowEnd, "windowEnd");

        final LocalDate first = resumeAfter != null ? nextDate(resumeAfter, frequency) : startDate;
        return () -> new OccurrenceIterator(first, frequency, windowEnd);
    }

    /**
     * Latest occurrence of the series starting at {@code startDate} that is on or before {@code date}.
     */
    public static Optional<LocalDate> lastOccurrenceOnOrBefore(
            LocalDate startDate,
            RecurringFrequency frequency,
            LocalDate date
    ) {
        LocalDate last = null;
        for (LocalDate occurrence : expandWindow(startDate, frequency, date, null)) {
            last = occurrence;
        }
        return Optional.ofNullable(last);
    }

    /**
     * Value of {@code next_generation_date} for a template with its current bookmark.
     */
    public static LocalDate nextGenerationDate(RecurringTemplate template) {
        if (template.getLastGeneratedDate() == null) {
            return template.getStartDate();
        }
        return nextDate(template.getLastGeneratedDate(), template.resolveFrequency());
    }

    private static final class OccurrenceIterator implements Iterator<LocalDate> {

        private final RecurringFrequency frequency;
        private final LocalDate windowEnd;
        private LocalDate current;

        private OccurrenceIterator(LocalDate first, RecurringFrequency frequency, LocalDate windowEnd) {
            this.current = first;
            this.frequency = frequency;
            this.windowEnd = windowEnd;
        }

        @Override
        public boolean hasNext() {
            return !current.isAfter(windowEnd);
        }

        @Override
        public LocalDate next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            LocalDate result = current;
            current = nextDate(current, frequency);
            return result;
        }
    }
}
