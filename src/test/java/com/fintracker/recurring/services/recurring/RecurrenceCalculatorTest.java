package com.fintracker.recurring.services.recurring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.Test;

import com.fintracker.recurring.entities.RecurringTemplate;
import com.fintracker.recurring.enums.RecurringFrequency;

class RecurrenceCalculatorTest {

    @Test
    void nextDate_addsOnePeriodPerFrequency() {
        LocalDate base = LocalDate.of(2025, 1, 15);

        assertEquals(LocalDate.of(2025, 1, 22), RecurrenceCalculator.nextDate(base, RecurringFrequency.WEEKLY));
        assertEquals(LocalDate.of(2025, 1, 29), RecurrenceCalculator.nextDate(base, RecurringFrequency.BIWEEKLY));
        assertEquals(LocalDate.of(2025, 2, 15), RecurrenceCalculator.nextDate(base, RecurringFrequency.MONTHLY));
        assertEquals(LocalDate.of(2025, 4, 15), RecurrenceCalculator.nextDate(base, RecurringFrequency.QUARTERLY));
        assertEquals(LocalDate.of(2026, 1, 15), RecurrenceCalculator.nextDate(base, RecurringFrequency.YEARLY));
    }

    @Test
    void nextDate_monthEndClampsToLastDayOfTargetMonth() {
        assertEquals(LocalDate.of(2025, 2, 28),
                RecurrenceCalculator.nextDate(LocalDate.of(2025, 1, 31), RecurringFrequency.MONTHLY));
        assertEquals(LocalDate.of(2024, 2, 29),
                RecurrenceCalculator.nextDate(LocalDate.of(2024, 1, 31), RecurringFrequency.MONTHLY));
        assertEquals(LocalDate.of(2025, 2, 28),
                RecurrenceCalculator.nextDate(LocalDate.of(2024, 2, 29), RecurringFrequency.YEARLY));
        assertEquals(LocalDate.of(2025, 4, 30),
                RecurrenceCalculator.nextDate(LocalDate.of(2025, 1, 31), RecurringFrequency.QUARTERLY));
    }

    @Test
    void expandWindow_monthEndSeriesSettlesOnClampedDay() {
        List<LocalDate> dates = collect(RecurrenceCalculator.expandWindow(
                LocalDate.of(2025, 1, 31), RecurringFrequency.MONTHLY, LocalDate.of(2025, 4, 30), null));

        assertThat(dates).containsExactly(
                LocalDate.of(2025, 1, 31),
                LocalDate.of(2025, 2, 28),
                LocalDate.of(2025, 3, 28),
                LocalDate.of(2025, 4, 28));
    }

    @Test
    void expandWindow_withoutResume_startsAtStartDateAndStopsAtWindowEnd() {
        List<LocalDate> dates = collect(RecurrenceCalculator.expandWindow(
                LocalDate.of(2025, 1, 1), RecurringFrequency.MONTHLY, LocalDate.of(2025, 4, 15), null));

        assertThat(dates).containsExactly(
                LocalDate.of(2025, 1, 1),
                LocalDate.of(2025, 2, 1),
                LocalDate.of(2025, 3, 1),
                LocalDate.of(2025, 4, 1));
    }

    @Test
    void expandWindow_includesWindowEndItself() {
        List<LocalDate> dates = collect(RecurrenceCalculator.expandWindow(
                LocalDate.of(2025, 1, 1), RecurringFrequency.WEEKLY, LocalDate.of(2025, 1, 15), null));

        assertThat(dates).containsExactly(
                LocalDate.of(2025, 1, 1),
                LocalDate.of(2025, 1, 8),
                LocalDate.of(2025, 1, 15));
    }

    @Test
    void expandWindow_withResume_startsAfterBookmark() {
        List<LocalDate> dates = collect(RecurrenceCalculator.expandWindow(
                LocalDate.of(2025, 1, 1), RecurringFrequency.MONTHLY, LocalDate.of(2025, 5, 1),
                LocalDate.of(2025, 3, 1)));

        assertThat(dates).containsExactly(LocalDate.of(2025, 4, 1), LocalDate.of(2025, 5, 1));
    }

    @Test
    void expandWindow_emptyWhenFirstDateIsPastWindow() {
        Iterable<LocalDate> window = RecurrenceCalculator.expandWindow(
                LocalDate.of(2025, 6, 1), RecurringFrequency.WEEKLY, LocalDate.of(2025, 5, 31), null);

        Iterator<LocalDate> it = window.iterator();
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    void expandWindow_canBeIteratedMoreThanOnce() {
        Iterable<LocalDate> window = RecurrenceCalculator.expandWindow(
                LocalDate.of(2025, 1, 1), RecurringFrequency.BIWEEKLY, LocalDate.of(2025, 2, 28), null);

        assertEquals(collect(window), collect(window));
        assertEquals(5, collect(window).size());
    }

    @Test
    void expandWindow_longLivedTemplateStaysBoundedByWindow() {
        List<LocalDate> dates = collect(RecurrenceCalculator.expandWindow(
                LocalDate.of(2000, 1, 1), RecurringFrequency.YEARLY, LocalDate.of(2025, 1, 1),
                LocalDate.of(2023, 1, 1)));

        assertThat(dates).containsExactly(LocalDate.of(2024, 1, 1), LocalDate.of(2025, 1, 1));
    }

    @Test
    void lastOccurrenceOnOrBefore_findsLatestDateNotAfterGivenDay() {
        assertEquals(LocalDate.of(2025, 1, 1), RecurrenceCalculator.lastOccurrenceOnOrBefore(
                LocalDate.of(2025, 1, 1), RecurringFrequency.MONTHLY, LocalDate.of(2025, 1, 15)).orElseThrow());
        assertEquals(LocalDate.of(2025, 2, 1), RecurrenceCalculator.lastOccurrenceOnOrBefore(
                LocalDate.of(2025, 1, 1), RecurringFrequency.MONTHLY, LocalDate.of(2025, 2, 1)).orElseThrow());
        assertTrue(RecurrenceCalculator.lastOccurrenceOnOrBefore(
                LocalDate.of(2025, 3, 1), RecurringFrequency.MONTHLY, LocalDate.of(2025, 2, 1)).isEmpty());
    }

    @Test
    void nextGenerationDate_usesStartDateUntilFirstGeneration() {
        RecurringTemplate template = RecurringTemplate.builder()
                .frequency("quarterly")
                .startDate(LocalDate.of(2025, 1, 10))
                .build();

        assertEquals(LocalDate.of(2025, 1, 10), RecurrenceCalculator.nextGenerationDate(template));

        template.setLastGeneratedDate(LocalDate.of(2025, 4, 10));
        assertEquals(LocalDate.of(2025, 7, 10), RecurrenceCalculator.nextGenerationDate(template));
    }

    private static List<LocalDate> collect(Iterable<LocalDate> dates) {
        List<LocalDate> result = new ArrayList<>();
        dates.forEach(result::add);
        return result;
    }
}
