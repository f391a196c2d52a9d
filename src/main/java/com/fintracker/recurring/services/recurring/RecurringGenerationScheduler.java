package com.fintracker.recurring.services.recurring;

import java.time.Clock;
import java.time.LocalDate;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.fintracker.recurring.dto.GenerationSummary;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * In-process daily trigger for deployments without an external scheduler.
 */
@Component
@ConditionalOnProperty(prefix = "recurring.generation.scheduler", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class RecurringGenerationScheduler {

    private final RecurringGenerationService generationService;
    private final Clock clock;

    @Scheduled(cron = "${recurring.generation.scheduler.cron:0 0 3 * * *}")
    public void generateDaily() {
        try {
            GenerationSummary summary = generationService.runGeneration(LocalDate.now(clock));
            if (summary.templatesSkipped() > 0) {
                log.warn("[RecurringGenerationScheduler] {} templates skipped, they will be retried on the next run",
                        summary.templatesSkipped());
            }
        } catch (RuntimeException e) {
            log.error("[RecurringGenerationScheduler] generation run failed", e);
        }
    }
}
