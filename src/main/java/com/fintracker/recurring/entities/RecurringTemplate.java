package com.fintracker.recurring.entities;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import com.fintracker.recurring.enums.RecurringFrequency;
import com.fintracker.recurring.enums.TemplateType;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Rule from which expense or income instances are stamped out.
 *
 * <p>{@code templateType} and {@code frequency} are kept as raw column values so a single
 * malformed row fails while being processed instead of while the whole batch is loaded.
 */
@Entity
@Table(
        name = "recurring_templates",
        indexes = {
                @Index(name = "idx_recurring_templates_user_id", columnList = "user_id"),
                @Index(name = "idx_recurring_templates_next_generation", columnList = "next_generation_date")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecurringTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "template_type", nullable = false, length = 10)
    private String templateType;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    private String description;

    // expense only
    @Column(name = "expense_type_id")
    private UUID expenseTypeId;

    @Column(name = "is_split", nullable = false)
    @Builder.Default
    private boolean split = false;

    @Column(name = "original_amount", precision = 19, scale = 2)
    private BigDecimal originalAmount;

    @Column(name = "split_with")
    private String splitWith;

    // income only
    private String source;

    @Column(nullable = false, length = 20)
    private String frequency;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    /** Inclusive; null means open-ended. */
    @Column(name = "end_date")
    private LocalDate endDate;

    /** Date of the most recently generated instance, null if never generated. */
    @Column(name = "last_generated_date")
    private LocalDate lastGeneratedDate;

    /** Hint for the pre-filter only; instance existence is the authority. */
    @Column(name = "next_generation_date")
    private LocalDate nextGenerationDate;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public TemplateType resolveType() {
        return TemplateType.fromValue(templateType);
    }

    public RecurringFrequency resolveFrequency() {
        return RecurringFrequency.fromValue(frequency);
    }
}
