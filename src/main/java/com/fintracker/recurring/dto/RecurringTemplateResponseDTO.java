package com.fintracker.recurring.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import lombok.Data;

@Data
public class RecurringTemplateResponseDTO {
    private String id;
    private String userId;
    private String templateType;
    private BigDecimal amount;
    private String description;
    private String expenseTypeId;
    private boolean split;
    private BigDecimal originalAmount;
    private String splitWith;
    private String source;
    private String frequency;
    private LocalDate startDate;
    private LocalDate endDate;
    private LocalDate lastGeneratedDate;
    private LocalDate nextGenerationDate;
    private boolean active;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
