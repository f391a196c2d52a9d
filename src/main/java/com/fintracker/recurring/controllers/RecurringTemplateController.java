package com.fintracker.recurring.controllers;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fintracker.recurring.dto.ApiResponse;
import com.fintracker.recurring.dto.RecurringTemplateRequestDTO;
import com.fintracker.recurring.dto.RecurringTemplateResponseDTO;
import com.fintracker.recurring.dto.TransactionInstanceResponseDTO;
import com.fintracker.recurring.services.recurring.RecurringTemplateService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/recurring")
@RequiredArgsConstructor
public class RecurringTemplateController {

    private final RecurringTemplateService templateService;
    private final Clock clock;

    @PostMapping("/templates")
    public ResponseEntity<ApiResponse<RecurringTemplateResponseDTO>> create(
            @Valid @RequestBody RecurringTemplateRequestDTO dto) {
        RecurringTemplateResponseDTO created = templateService.create(dto);
        return ResponseEntity.status(201).body(ApiResponse.success(created, "Template recorrente criado"));
    }

    @GetMapping("/templates/{id}")
    public ResponseEntity<ApiResponse<RecurringTemplateResponseDTO>> findById(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(templateService.findById(id), "Template encontrado"));
    }

    @GetMapping("/templates/user/{userId}")
    public ResponseEntity<ApiResponse<List<RecurringTemplateResponseDTO>>> findByUser(@PathVariable String userId) {
        return ResponseEntity.ok(ApiResponse.success(templateService.findByUser(userId), "Templates carregados"));
    }

    @GetMapping("/templates/{id}/instances")
    public ResponseEntity<ApiResponse<List<TransactionInstanceResponseDTO>>> findInstances(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(templateService.findInstances(id), "Lançamentos carregados"));
    }

    @GetMapping("/instances/{type}/user/{userId}")
    public ResponseEntity<ApiResponse<List<TransactionInstanceResponseDTO>>> findInstancesByUser(
            @PathVariable String type,
            @PathVariable String userId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        List<TransactionInstanceResponseDTO> instances = templateService.findInstancesByUser(type, userId, from, to);
        return ResponseEntity.ok(ApiResponse.success(instances, "Lançamentos carregados"));
    }

    // edita o template e todos os lançamentos futuros
    @PutMapping("/templates/{id}")
    public ResponseEntity<ApiResponse<RecurringTemplateResponseDTO>> update(
            @PathVariable String id,
            @RequestParam(required = false) String editedInstanceId,
            @Valid @RequestBody RecurringTemplateRequestDTO dto) {
        RecurringTemplateResponseDTO updated =
                templateService.updateAllFuture(id, dto, LocalDate.now(clock), editedInstanceId);
        return ResponseEntity.ok(ApiResponse.success(updated, "Template atualizado"));
    }

    @DeleteMapping("/templates/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String id) {
        templateService.delete(id, LocalDate.now(clock));
        return ResponseEntity.ok(ApiResponse.success(null, "Template removido"));
    }

    @PostMapping("/templates/{id}/pause")
    public ResponseEntity<ApiResponse<RecurringTemplateResponseDTO>> pause(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(templateService.pause(id), "Template pausado"));
    }

    @PostMapping("/templates/{id}/resume")
    public ResponseEntity<ApiResponse<RecurringTemplateResponseDTO>> resume(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(templateService.resume(id), "Template retomado"));
    }

    // edita somente este lançamento: desvincula da série
    @PostMapping("/instances/{type}/{id}/detach")
    public ResponseEntity<ApiResponse<Void>> detach(@PathVariable String type, @PathVariable String id) {
        templateService.detachInstance(type, id);
        return ResponseEntity.ok(ApiResponse.success(null, "Lançamento desvinculado"));
    }
}
