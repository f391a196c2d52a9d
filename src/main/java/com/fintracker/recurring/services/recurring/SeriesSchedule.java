package com.fintracker.recurring.services.recurring;

import java.time.LocalDate;

import com.fintracker.recurring.entities.RecurringTemplate;
import com.fintracker.recurring.enums.RecurringFrequency;

/**
 * Start date and frequency of a template, captured before an edit changes them.
 */
public record SeriesSchedule(LocalDate startDate, RecurringFrequency frequency) {

    public static SeriesSchedule of(RecurringTemplate template) {
        return new SeriesSchedule(template.getStartDate(), template.resolveFrequency());
    }

    public Iterable<LocalDate> occurrencesUpTo(LocalDate end) {
        return RecurrenceCalculator.expandWindow(startDate, frequency, end, null);
    }
}
