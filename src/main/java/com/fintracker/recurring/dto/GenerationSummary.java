package com.fintracker.recurring.dto;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Outcome of one generation run, meant for the caller's logs and alerts.
 *
 * @param templatesProcessed templates returned by the pre-filter
 * @param instancesGenerated rows actually inserted by this run
 * @param templatesSkipped   templates that failed and were left for the next run
 */
public record GenerationSummary(
        int templatesProcessed,
        int instancesGenerated,
        int templatesSkipped,
        LocalDate asOf,
        LocalDate windowEnd,
        Instant timestamp
) {
}
