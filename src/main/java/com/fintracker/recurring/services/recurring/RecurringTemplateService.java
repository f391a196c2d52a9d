package com.fintracker.recurring.services.recurring;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fintracker.recurring.dto.RecurringTemplateRequestDTO;
import com.fintracker.recurring.dto.RecurringTemplateResponseDTO;
import com.fintracker.recurring.dto.TransactionInstanceResponseDTO;
import com.fintracker.recurring.entities.RecurringTemplate;
import com.fintracker.recurring.entities.TransactionInstance;
import com.fintracker.recurring.enums.ReconciliationMode;
import com.fintracker.recurring.enums.TemplateType;
import com.fintracker.recurring.exceptions.BadRequestException;
import com.fintracker.recurring.exceptions.ResourceNotFoundException;
import com.fintracker.recurring.mappers.RecurringTemplateMapper;
import com.fintracker.recurring.repositories.RecurringTemplateRepository;
import com.fintracker.recurring.repositories.TransactionInstanceRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Template lifecycle: create, edit all future instances, delete, pause/resume and
 * detaching a single instance from its series.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecurringTemplateService {

    private final RecurringTemplateRepository templateRepository;
    private final InstanceReconciliationService reconciliationService;

    @Transactional
    public RecurringTemplateResponseDTO create(RecurringTemplateRequestDTO dto) {
        UUID userId = parseUuid(dto.getUserId(), "Usuário inválido");
        UUID expenseTypeId = validateBusinessRules(dto);

        RecurringTemplate template = RecurringTemplateMapper.toEntity(dto, userId, expenseTypeId);
        template.setLastGeneratedDate(null);
        template.setNextGenerationDate(template.getStartDate());

        template = templateRepository.save(template);
        log.info("[RecurringTemplate] created template={} type={} frequency={}",
                template.getId(), template.getTemplateType(), template.getFrequency());
        return RecurringTemplateMapper.toResponseDTO(template);
    }

    @Transactional(readOnly = true)
    public RecurringTemplateResponseDTO findById(String id) {
        return RecurringTemplateMapper.toResponseDTO(load(id));
    }

    @Transactional(readOnly = true)
    public List<RecurringTemplateResponseDTO> findByUser(String userId) {
        UUID uuid = parseUuid(userId, "Usuário inválido");
        return templateRepository.findByUserIdOrderByCreatedAtDesc(uuid).stream()
                .map(RecurringTemplateMapper::toResponseDTO)
                .toList();
    }

    /**
     * Instances still linked to the template, oldest first.
     */
    @Transactional(readOnly = true)
    public List<TransactionInstanceResponseDTO> findInstances(String id) {
        RecurringTemplate template = load(id);
        return reconciliationService.instancesFor(template.resolveType())
                .findByRecurringTemplateIdOrderByTransactionDateAsc(template.getId()).stream()
                .map(RecurringTemplateMapper::toInstanceResponseDTO)
                .toList();
    }

    /**
     * A user's expenses or incomes dated within {@code [from, to]}, linked or not.
     */
    @Transactional(readOnly = true)
    public List<TransactionInstanceResponseDTO> findInstancesByUser(
            String type,
            String userId,
            LocalDate from,
            LocalDate to
    ) {
        TemplateType templateType = parseType(type);
        UUID uuid = parseUuid(userId, "Usuário inválido");
        if (from == null || to == null || to.isBefore(from)) {
            throw new BadRequestException("Período inválido");
        }
        return reconciliationService.instancesFor(templateType)
                .findByUserIdAndTransactionDateBetweenOrderByTransactionDateAsc(uuid, from, to).stream()
                .map(RecurringTemplateMapper::toInstanceResponseDTO)
                .toList();
    }

    /**
     * Saves the new template values and replaces its future generated instances with ones carrying
     * those values. The instance being edited, when given, is kept and rewritten in place.
     */
    @Transactional
    public RecurringTemplateResponseDTO updateAllFuture(
            String id,
            RecurringTemplateRequestDTO dto,
            LocalDate today,
            String editedInstanceId
    ) {
        RecurringTemplate template = load(id);
        if (!template.getTemplateType().equals(dto.getTemplateType())) {
            throw new BadRequestException("Tipo do template não pode ser alterado");
        }
        UUID expenseTypeId = validateBusinessRules(dto);

        TransactionInstanceRepository<? extends TransactionInstance> instances =
                reconciliationService.instancesFor(template.resolveType());

        UUID preservedId = null;
        if (editedInstanceId != null && !editedInstanceId.isBlank()) {
            preservedId = parseUuid(editedInstanceId, "Lançamento inválido");
            TransactionInstance edited = instances.findById(preservedId)
                    .orElseThrow(() -> new ResourceNotFoundException("Lançamento não encontrado"));
            if (!template.getId().equals(edited.getRecurringTemplateId())) {
                throw new BadRequestException("Lançamento não pertence a este template");
            }
        }

        SeriesSchedule previousSchedule = SeriesSchedule.of(template);
        RecurringTemplateMapper.updateEntity(template, dto, expenseTypeId);
        templateRepository.saveAndFlush(template);

        ReconciliationResult result = reconciliationService.reconcileInstancesOnTemplateChange(
                template.getId(), today, ReconciliationMode.EDIT_ALL_FUTURE, preservedId, previousSchedule);
        log.info("[RecurringTemplate] updated template={} futureDeleted={} restamped={} preserved={}",
                template.getId(), result.deleted(), result.restamped(), preservedId);

        RecurringTemplate updated = templateRepository.findById(template.getId())
                .orElseThrow(() -> new ResourceNotFoundException("Template recorrente não encontrado"));

        if (preservedId != null) {
            rewriteInstance(instances, preservedId, updated);
        }

        return RecurringTemplateMapper.toResponseDTO(updated);
    }

    /**
     * Deletes future instances, unlinks past ones and only then removes the template row.
     */
    @Transactional
    public void delete(String id, LocalDate today) {
        RecurringTemplate template = load(id);
        ReconciliationResult result = reconciliationService.reconcileInstancesOnTemplateChange(
                template.getId(), today, ReconciliationMode.DELETE_TEMPLATE, null);
        templateRepository.deleteById(template.getId());
        log.info("[RecurringTemplate] deleted template={} futureDeleted={} pastUnlinked={}",
                template.getId(), result.deleted(), result.unlinked());
    }

    /**
     * Stops generation. The bookmark stays where it is.
     */
    @Transactional
    public RecurringTemplateResponseDTO pause(String id) {
        return setActive(id, false);
    }

    /**
     * Restarts generation from the frozen bookmark; the next run backfills the paused gap.
     */
    @Transactional
    public RecurringTemplateResponseDTO resume(String id) {
        return setActive(id, true);
    }

    /**
     * Edit "this instance only": the instance leaves its series, nothing else changes.
     */
    @Transactional
    public void detachInstance(String type, String instanceId) {
        TemplateType templateType = parseType(type);
        UUID uuid = parseUuid(instanceId, "Lançamento inválido");
        detach(reconciliationService.instancesFor(templateType), uuid);
    }

    /**
     * Recomputes {@code next_generation_date} of every active template from its bookmark.
     *
     * @return number of templates whose hint changed
     */
    @Transactional
    public int repairBookmarks() {
        int repaired = 0;
        for (RecurringTemplate template : templateRepository.findByActiveTrue()) {
            try {
                LocalDate expected = RecurrenceCalculator.nextGenerationDate(template);
                if (!expected.equals(template.getNextGenerationDate())) {
                    template.setNextGenerationDate(expected);
                    repaired++;
                }
            } catch (IllegalArgumentException e) {
                log.warn("[RecurringTemplate] cannot repair template={}: {}", template.getId(), e.getMessage());
            }
        }
        log.info("[RecurringTemplate] repaired next_generation_date on {} templates", repaired);
        return repaired;
    }

    private RecurringTemplateResponseDTO setActive(String id, boolean active) {
        RecurringTemplate template = load(id);
        template.setActive(active);
        template = templateRepository.save(template);
        log.info("[RecurringTemplate] template={} {}", template.getId(), active ? "resumed" : "paused");
        return RecurringTemplateMapper.toResponseDTO(template);
    }

    private <T extends TransactionInstance> void rewriteInstance(
            TransactionInstanceRepository<T> instances,
            UUID instanceId,
            RecurringTemplate template
    ) {
        T instance = instances.findById(instanceId)
                .orElseThrow(() -> new ResourceNotFoundException("Lançamento não encontrado"));
        RecurringTemplateMapper.applyTemplate(instance, template);
        instances.save(instance);
    }

    private <T extends TransactionInstance> void detach(TransactionInstanceRepository<T> instances, UUID instanceId) {
        T instance = instances.findById(instanceId)
                .orElseThrow(() -> new ResourceNotFoundException("Lançamento não encontrado"));
        instance.setRecurringTemplateId(null);
        instances.save(instance);
    }

    private RecurringTemplate load(String id) {
        UUID uuid = parseUuid(id, "Template inválido");
        return templateRepository.findById(uuid)
                .orElseThrow(() -> new ResourceNotFoundException("Template recorrente não encontrado"));
    }

    private UUID validateBusinessRules(RecurringTemplateRequestDTO dto) {
        if (dto.getEndDate() != null && dto.getEndDate().isBefore(dto.getStartDate())) {
            throw new BadRequestException("Data final não pode ser anterior à data de início");
        }

        if ("expense".equals(dto.getTemplateType())) {
            if (dto.getExpenseTypeId() == null || dto.getExpenseTypeId().isBlank()) {
                throw new BadRequestException("Tipo de despesa é obrigatório");
            }
            return parseUuid(dto.getExpenseTypeId(), "Tipo de despesa inválido");
        }

        if (dto.getSource() == null || dto.getSource().isBlank()) {
            throw new BadRequestException("Fonte da receita é obrigatória");
        }
        return null;
    }

    private static TemplateType parseType(String type) {
        try {
            return TemplateType.fromValue(type);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage());
        }
    }

    private static UUID parseUuid(String raw, String message) {
        if (raw == null) {
            throw new BadRequestException(message);
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(message);
        }
    }
}
