package com.fintracker.recurring.entities;

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
        name = "incomes",
        indexes = {
                @Index(name = "idx_income_user_date", columnList = "user_id, transaction_date")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = Income.TEMPLATE_DATE_CONSTRAINT, columnNames = {"recurring_template_id", "transaction_date"})
        }
)
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class Income extends TransactionInstance {

    public static final String TEMPLATE_DATE_CONSTRAINT = "uk_income_template_date";

    private String source;
}
