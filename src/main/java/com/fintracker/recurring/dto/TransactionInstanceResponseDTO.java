package com.fintracker.recurring.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import lombok.Data;

@Data
public class TransactionInstanceResponseDTO {
    private String id;
    private String type;
    private String userId;
    private BigDecimal amount;
    private String description;
    private LocalDate transactionDate;
    private String recurringTemplateId;
    private boolean generated;
    private boolean recurring;

    // despesa
    private String expenseTypeId;
    private boolean split;
    private BigDecimal originalAmount;
    private String splitWith;

    // receita
    private String source;
}
