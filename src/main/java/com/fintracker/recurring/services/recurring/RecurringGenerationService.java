package com.fintracker.recurring.services.recurring;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.fintracker.recurring.config.RecurringGenerationProperties;
import com.fintracker.recurring.dto.GenerationSummary;
import com.fintracker.recurring.entities.RecurringTemplate;
import com.fintracker.recurring.exceptions.BadRequestException;
import com.fintracker.recurring.exceptions.RecurringGenerationException;
import com.fintracker.recurring.repositories.RecurringTemplateRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Batch entry point: expands every due template into concrete instances up to
 * {@code asOf + horizonMonths}. Safe to run any number of times for the same {@code asOf}.
 */
@Service
@Slf4j
public class RecurringGenerationService {

    private final RecurringTemplateRepository templateRepository;
    private final RecurringTemplateGenerator templateGenerator;
    private final RecurringGenerationProperties properties;
    private final Executor executor;
    private final Clock clock;

    public RecurringGenerationService(
            RecurringTemplateRepository templateRepository,
            RecurringTemplateGenerator templateGenerator,
            RecurringGenerationProperties properties,
            @Qualifier("recurringGenerationTaskExecutor") Executor executor,
            Clock clock
    ) {
        this.templateRepository = templateRepository;
        this.templateGenerator = templateGenerator;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    public GenerationSummary runGeneration(LocalDate asOf) {
        return runGeneration(asOf, properties.horizonMonths());
    }

    public GenerationSummary runGeneration(LocalDate asOf, int horizonMonths) {
        if (asOf == null) {
            throw new BadRequestException("Data de referência é obrigatória");
        }
        if (horizonMonths < 1) {
            throw new BadRequestException("Horizonte deve ser de pelo menos 1 mês");
        }

        LocalDate windowEnd = asOf.plusMonths(horizonMonths);
        log.info("[RecurringGeneration] generating from {} to {}", asOf, windowEnd);

        List<RecurringTemplate> templates;
        try {
            templates = templateRepository.findActiveDueBefore(windowEnd);
        } catch (RuntimeException e) {
            log.error("[RecurringGeneration] could not load templates due before {}", windowEnd, e);
            throw new RecurringGenerationException("Falha ao carregar templates recorrentes", e);
        }

        List<CompletableFuture<TemplateOutcome>> futures = new ArrayList<>(templates.size());
        for (RecurringTemplate template : templates) {
            futures.add(CompletableFuture.supplyAsync(() -> process(template, windowEnd), executor));
        }

        int generated = 0;
        int skipped = 0;
        for (CompletableFuture<TemplateOutcome> future : futures) {
            TemplateOutcome outcome = future.join();
            if (outcome.failed()) {
                skipped++;
            } else {
                generated += outcome.inserted();
            }
        }

        GenerationSummary summary = new GenerationSummary(
                templates.size(), generated, skipped, asOf, windowEnd, Instant.now(clock));
        log.info("[RecurringGeneration] processed={} generated={} skipped={}",
                summary.templatesProcessed(), summary.instancesGenerated(), summary.templatesSkipped());
        return summary;
    }

    private TemplateOutcome process(RecurringTemplate template, LocalDate windowEnd) {
        try {
            return new TemplateOutcome(templateGenerator.generate(template, windowEnd), false);
        } catch (Exception e) {
            log.error("[RecurringGeneration] error processing template {}", template.getId(), e);
            return new TemplateOutcome(0, true);
        }
    }

    private record TemplateOutcome(int inserted, boolean failed) {
    }
}
