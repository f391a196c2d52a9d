package com.fintracker.recurring.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class RecurringTemplateRequestDTO {

    @NotBlank(message = "Usuário é obrigatório")
    private String userId;

    @NotBlank(message = "Tipo é obrigatório")
    @Pattern(regexp = "expense|income", message = "Tipo deve ser expense ou income")
    private String templateType;

    /** Face value; halved on save when {@code split} is set. */
    @NotNull(message = "Valor é obrigatório")
    @DecimalMin(value = "0.01", message = "Valor deve ser maior que zero")
    private BigDecimal amount;

    private String description;

    private String expenseTypeId;
    private boolean split;
    private String splitWith;

    private String source;

    @NotBlank(message = "Frequência é obrigatória")
    @Pattern(regexp = "weekly|biweekly|monthly|quarterly|yearly", message = "Frequência inválida")
    private String frequency;

    @NotNull(message = "Data de início é obrigatória")
    private LocalDate startDate;

    private LocalDate endDate;
}
