package com.fintracker.recurring.controllers;

import java.time.Clock;
import java.time.LocalDate;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fintracker.recurring.config.RecurringGenerationProperties;
import com.fintracker.recurring.dto.ApiResponse;
import com.fintracker.recurring.dto.GenerationSummary;
import com.fintracker.recurring.services.recurring.RecurringGenerationService;
import com.fintracker.recurring.services.recurring.RecurringTemplateService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Endpoints called by the external scheduler.
 */
@RestController
@RequestMapping("/api/recurring")
@RequiredArgsConstructor
@Slf4j
public class RecurringGenerationController {

    private final RecurringGenerationService generationService;
    private final RecurringTemplateService templateService;
    private final RecurringGenerationProperties properties;
    private final Clock clock;

    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<GenerationSummary>> generate(
            @RequestParam(required = false) Integer horizonMonths,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf
    ) {
        LocalDate effectiveAsOf = asOf != null ? asOf : LocalDate.now(clock);
        int effectiveHorizon = horizonMonths != null ? horizonMonths : properties.horizonMonths();

        log.info("[RecurringGenerationController] asOf={}, horizonMonths={}", effectiveAsOf, effectiveHorizon);
        GenerationSummary summary = generationService.runGeneration(effectiveAsOf, effectiveHorizon);

        return ResponseEntity.ok(ApiResponse.success(summary, "Geração de recorrentes concluída"));
    }

    @PostMapping("/bookmarks/repair")
    public ResponseEntity<ApiResponse<Integer>> repairBookmarks() {
        int repaired = templateService.repairBookmarks();
        return ResponseEntity.ok(ApiResponse.success(repaired, "Próximas datas de geração recalculadas"));
    }
}
