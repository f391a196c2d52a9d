package com.fintracker.recurring.mappers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.UUID;

import com.fintracker.recurring.dto.RecurringTemplateRequestDTO;
import com.fintracker.recurring.dto.RecurringTemplateResponseDTO;
import com.fintracker.recurring.dto.TransactionInstanceResponseDTO;
import com.fintracker.recurring.entities.Expense;
import com.fintracker.recurring.entities.Income;
import com.fintracker.recurring.entities.RecurringTemplate;
import com.fintracker.recurring.entities.TransactionInstance;
import com.fintracker.recurring.enums.TemplateType;

public class RecurringTemplateMapper {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private RecurringTemplateMapper() {}

    public static RecurringTemplate toEntity(RecurringTemplateRequestDTO dto, UUID userId, UUID expenseTypeId) {
        RecurringTemplate entity = new RecurringTemplate();
        entity.setUserId(userId);
        entity.setActive(true);
        updateEntity(entity, dto, expenseTypeId);
        return entity;
    }

    /**
     * Copies the editable fields. Split expenses store half of the face value in {@code amount}
     * and keep the face value in {@code originalAmount}.
     */
    public static void updateEntity(RecurringTemplate entity, RecurringTemplateRequestDTO dto, UUID expenseTypeId) {
        boolean expense = "expense".equals(dto.getTemplateType());
        boolean split = expense && dto.isSplit();

        entity.setTemplateType(dto.getTemplateType());
        entity.setAmount(split
                ? dto.getAmount().divide(TWO, 2, RoundingMode.HALF_UP)
                : dto.getAmount().setScale(2, RoundingMode.HALF_UP));
        entity.setDescription(blankToNull(dto.getDescription()));
        entity.setFrequency(dto.getFrequency());
        entity.setStartDate(dto.getStartDate());
        entity.setEndDate(dto.getEndDate());

        entity.setExpenseTypeId(expense ? expenseTypeId : null);
        entity.setSplit(split);
        entity.setOriginalAmount(split ? dto.getAmount().setScale(2, RoundingMode.HALF_UP) : null);
        entity.setSplitWith(split ? blankToNull(dto.getSplitWith()) : null);

        entity.setSource(expense ? null : blankToNull(dto.getSource()));
    }

    public static Expense toExpense(RecurringTemplate template, LocalDate date) {
        return Expense.builder()
                .userId(template.getUserId())
                .amount(template.getAmount())
                .description(template.getDescription())
                .transactionDate(date)
                .recurringTemplateId(template.getId())
                .generated(true)
                .recurring(true)
                .expenseTypeId(template.getExpenseTypeId())
                .split(template.isSplit())
                .originalAmount(template.getOriginalAmount())
                .splitWith(template.getSplitWith())
                .build();
    }

    public static Income toIncome(RecurringTemplate template, LocalDate date) {
        return Income.builder()
                .userId(template.getUserId())
                .amount(template.getAmount())
                .description(template.getDescription())
                .transactionDate(date)
                .recurringTemplateId(template.getId())
                .generated(true)
                .recurring(true)
                .source(template.getSource())
                .build();
    }

    /**
     * Rewrites an existing instance with the template's current values, keeping its date and link.
     */
    public static void applyTemplate(TransactionInstance instance, RecurringTemplate template) {
        instance.setAmount(template.getAmount());
        instance.setDescription(template.getDescription());

        if (instance instanceof Expense expense) {
            expense.setExpenseTypeId(template.getExpenseTypeId());
            expense.setSplit(template.isSplit());
            expense.setOriginalAmount(template.getOriginalAmount());
            expense.setSplitWith(template.getSplitWith());
        } else if (instance instanceof Income income) {
            income.setSource(template.getSource());
        }
    }

    public static RecurringTemplateResponseDTO toResponseDTO(RecurringTemplate entity) {
        RecurringTemplateResponseDTO dto = new RecurringTemplateResponseDTO();
        dto.setId(entity.getId() != null ? entity.getId().toString() : null);
        dto.setUserId(entity.getUserId().toString());
        dto.setTemplateType(entity.getTemplateType());
        dto.setAmount(entity.getAmount());
        dto.setDescription(entity.getDescription());
        dto.setExpenseTypeId(entity.getExpenseTypeId() != null ? entity.getExpenseTypeId().toString() : null);
        dto.setSplit(entity.isSplit());
        dto.setOriginalAmount(entity.getOriginalAmount());
        dto.setSplitWith(entity.getSplitWith());
        dto.setSource(entity.getSource());
        dto.setFrequency(entity.getFrequency());
        dto.setStartDate(entity.getStartDate());
        dto.setEndDate(entity.getEndDate());
        dto.setLastGeneratedDate(entity.getLastGeneratedDate());
        dto.setNextGenerationDate(entity.getNextGenerationDate());
        dto.setActive(entity.isActive());
        dto.setCreatedAt(entity.getCreatedAt());
        dto.setUpdatedAt(entity.getUpdatedAt());
        return dto;
    }

    public static TransactionInstanceResponseDTO toInstanceResponseDTO(TransactionInstance instance) {
        TransactionInstanceResponseDTO dto = new TransactionInstanceResponseDTO();
        dto.setId(instance.getId().toString());
        dto.setUserId(instance.getUserId().toString());
        dto.setAmount(instance.getAmount());
        dto.setDescription(instance.getDescription());
        dto.setTransactionDate(instance.getTransactionDate());
        dto.setRecurringTemplateId(instance.getRecurringTemplateId() != null
                ? instance.getRecurringTemplateId().toString()
                : null);
        dto.setGenerated(instance.isGenerated());
        dto.setRecurring(instance.isRecurring());

        if (instance instanceof Expense expense) {
            dto.setType(TemplateType.EXPENSE.getValue());
            dto.setExpenseTypeId(expense.getExpenseTypeId() != null ? expense.getExpenseTypeId().toString() : null);
            dto.setSplit(expense.isSplit());
            dto.setOriginalAmount(expense.getOriginalAmount());
            dto.setSplitWith(expense.getSplitWith());
        } else if (instance instanceof Income income) {
            dto.setType(TemplateType.INCOME.getValue());
            dto.setSource(income.getSource());
        }
        return dto;
    }

    private static String blankToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
