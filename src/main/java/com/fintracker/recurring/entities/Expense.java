package com.fintracker.recurring.entities;

import java.math.BigDecimal;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Entity
@Table(
        name = "expenses",
        indexes = {
                @Index(name = "idx_expense_user_date", columnList = "user_id, transaction_date")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = Expense.TEMPLATE_DATE_CONSTRAINT, columnNames = {"recurring_template_id", "transaction_date"})
        }
)
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class Expense extends TransactionInstance {

    public static final String TEMPLATE_DATE_CONSTRAINT = "uk_expense_template_date";

    @Column(name = "expense_type_id")
    private UUID expenseTypeId;

    @Column(name = "is_split", nullable = false)
    private boolean split;

    @Column(name = "original_amount", precision = 19, scale = 2)
    private BigDecimal originalAmount;

    @Column(name = "split_with")
    private String splitWith;
}
