package com.fintracker.recurring.services.recurring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fintracker.recurring.entities.Expense;
import com.fintracker.recurring.entities.RecurringTemplate;
import com.fintracker.recurring.enums.ReconciliationMode;
import com.fintracker.recurring.enums.RecurringFrequency;
import com.fintracker.recurring.enums.TemplateType;
import com.fintracker.recurring.exceptions.ResourceNotFoundException;
import com.fintracker.recurring.repositories.ExpenseRepository;
import com.fintracker.recurring.repositories.IncomeRepository;
import com.fintracker.recurring.repositories.RecurringTemplateRepository;

@ExtendWith(MockitoExtension.class)
class InstanceReconciliationServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 1, 15);

    @Mock
    private ExpenseRepository expenseRepository;

    @Mock
    private IncomeRepository incomeRepository;

    @Mock
    private RecurringTemplateRepository templateRepository;

    @InjectMocks
    private InstanceReconciliationService service;

    @Test
    void editAllFuture_restampsDeletedDatesAndKeepsBookmark() {
        RecurringTemplate template = monthlyExpense(LocalDate.of(2025, 4, 1));
        template.setAmount(new BigDecimal("1350.00"));
        when(templateRepository.findById(template.getId())).thenReturn(Optional.of(template));
        when(expenseRepository.findByRecurringTemplateIdAndGeneratedTrueAndTransactionDateAfter(template.getId(), TODAY))
                .thenReturn(List.of(
                        generated(template, LocalDate.of(2025, 2, 1)),
                        generated(template, LocalDate.of(2025, 3, 1)),
                        generated(template, LocalDate.of(2025, 4, 1))));
        when(expenseRepository.deleteFutureGenerated(template.getId(), TODAY)).thenReturn(3);

        ReconciliationResult result = service.reconcileInstancesOnTemplateChange(
                template.getId(), TODAY, ReconciliationMode.EDIT_ALL_FUTURE, null);

        assertEquals(new ReconciliationResult(3, 0, 3), result);
        List<Expense> saved = captureRestamped();
        assertEquals(List.of(LocalDate.of(2025, 2, 1), LocalDate.of(2025, 3, 1), LocalDate.of(2025, 4, 1)),
                saved.stream().map(Expense::getTransactionDate).toList());
        assertTrue(saved.stream().allMatch(e -> new BigDecimal("1350.00").equals(e.getAmount())));
        assertTrue(saved.stream().allMatch(e -> template.getId().equals(e.getRecurringTemplateId())));
        assertEquals(LocalDate.of(2025, 4, 1), template.getLastGeneratedDate());
        assertEquals(LocalDate.of(2025, 5, 1), template.getNextGenerationDate());
        verify(templateRepository).save(template);
        verify(expenseRepository, never()).unlinkPastAndPresent(any(), any());
        verifyNoInteractions(incomeRepository);
    }

    @Test
    void editAllFuture_keepsPreservedInstance() {
        RecurringTemplate template = monthlyExpense(LocalDate.of(2025, 4, 1));
        Expense march = generated(template, LocalDate.of(2025, 3, 1));
        when(templateRepository.findById(template.getId())).thenReturn(Optional.of(template));
        when(expenseRepository.findByRecurringTemplateIdAndGeneratedTrueAndTransactionDateAfter(template.getId(), TODAY))
                .thenReturn(List.of(
                        generated(template, LocalDate.of(2025, 2, 1)),
                        march,
                        generated(template, LocalDate.of(2025, 4, 1))));
        when(expenseRepository.deleteFutureGeneratedExcept(template.getId(), TODAY, march.getId())).thenReturn(2);

        ReconciliationResult result = service.reconcileInstancesOnTemplateChange(
                template.getId(), TODAY, ReconciliationMode.EDIT_ALL_FUTURE, march.getId());

        assertEquals(new ReconciliationResult(2, 0, 2), result);
        assertEquals(List.of(LocalDate.of(2025, 2, 1), LocalDate.of(2025, 4, 1)),
                captureRestamped().stream().map(Expense::getTransactionDate).toList());
        verify(expenseRepository, never()).deleteFutureGenerated(any(), any());
    }

    @Test
    void editAllFuture_detachedDateIsNotRestamped() {
        RecurringTemplate template = monthlyExpense(LocalDate.of(2025, 4, 1));
        when(templateRepository.findById(template.getId())).thenReturn(Optional.of(template));
        // March was detached earlier, so it is no longer among the linked rows
        when(expenseRepository.findByRecurringTemplateIdAndGeneratedTrueAndTransactionDateAfter(template.getId(), TODAY))
                .thenReturn(List.of(
                        generated(template, LocalDate.of(2025, 2, 1)),
                        generated(template, LocalDate.of(2025, 4, 1))));
        when(expenseRepository.deleteFutureGenerated(template.getId(), TODAY)).thenReturn(2);

        ReconciliationResult result = service.reconcileInstancesOnTemplateChange(
                template.getId(), TODAY, ReconciliationMode.EDIT_ALL_FUTURE, null);

        assertEquals(2, result.restamped());
        assertEquals(List.of(LocalDate.of(2025, 2, 1), LocalDate.of(2025, 4, 1)),
                captureRestamped().stream().map(Expense::getTransactionDate).toList());
        assertEquals(LocalDate.of(2025, 4, 1), template.getLastGeneratedDate());
    }

    @Test
    void editAllFuture_changedFrequencyMovesBookmarkOntoNewSchedule() {
        RecurringTemplate template = monthlyExpense(LocalDate.of(2025, 4, 1));
        template.setFrequency("biweekly");
        SeriesSchedule before = new SeriesSchedule(LocalDate.of(2025, 1, 1), RecurringFrequency.MONTHLY);
        when(templateRepository.findById(template.getId())).thenReturn(Optional.of(template));
        when(expenseRepository.findByRecurringTemplateIdAndGeneratedTrueAndTransactionDateAfter(template.getId(), TODAY))
                .thenReturn(List.of(
                        generated(template, LocalDate.of(2025, 2, 1)),
                        generated(template, LocalDate.of(2025, 3, 1)),
                        generated(template, LocalDate.of(2025, 4, 1))));
        when(expenseRepository.deleteFutureGenerated(template.getId(), TODAY)).thenReturn(3);

        ReconciliationResult result = service.reconcileInstancesOnTemplateChange(
                template.getId(), TODAY, ReconciliationMode.EDIT_ALL_FUTURE, null, before);

        assertEquals(new ReconciliationResult(3, 0, 5), result);
        assertEquals(List.of(
                        LocalDate.of(2025, 1, 29),
                        LocalDate.of(2025, 2, 12),
                        LocalDate.of(2025, 2, 26),
                        LocalDate.of(2025, 3, 12),
                        LocalDate.of(2025, 3, 26)),
                captureRestamped().stream().map(Expense::getTransactionDate).toList());
        assertEquals(LocalDate.of(2025, 3, 26), template.getLastGeneratedDate());
        assertEquals(LocalDate.of(2025, 4, 9), template.getNextGenerationDate());
    }

    @Test
    void editAllFuture_neverGeneratedTemplateKeepsEmptyBookmark() {
        RecurringTemplate template = monthlyExpense(null);
        template.setStartDate(LocalDate.of(2025, 3, 1));
        when(templateRepository.findById(template.getId())).thenReturn(Optional.of(template));

        service.reconcileInstancesOnTemplateChange(template.getId(), TODAY, ReconciliationMode.EDIT_ALL_FUTURE, null);

        assertNull(template.getLastGeneratedDate());
        assertEquals(LocalDate.of(2025, 3, 1), template.getNextGenerationDate());
        verify(expenseRepository, never()).saveAll(any());
    }

    @Test
    void editAllFuture_earlierBookmarkIsNotMovedForward() {
        RecurringTemplate template = monthlyExpense(LocalDate.of(2024, 12, 1));
        template.setStartDate(LocalDate.of(2024, 11, 1));
        when(templateRepository.findById(template.getId())).thenReturn(Optional.of(template));

        service.reconcileInstancesOnTemplateChange(template.getId(), TODAY, ReconciliationMode.EDIT_ALL_FUTURE, null);

        assertEquals(LocalDate.of(2024, 12, 1), template.getLastGeneratedDate());
        assertEquals(LocalDate.of(2025, 1, 1), template.getNextGenerationDate());
        verify(expenseRepository, never()).saveAll(any());
    }

    @Test
    void deleteTemplate_deletesFutureThenUnlinksPastAndPresent() {
        RecurringTemplate template = monthlyExpense(LocalDate.of(2025, 4, 1));
        template.setTemplateType("income");
        template.setSource("Empresa X");
        when(templateRepository.findById(template.getId())).thenReturn(Optional.of(template));
        when(incomeRepository.deleteFuture(template.getId(), TODAY)).thenReturn(3);
        when(incomeRepository.unlinkPastAndPresent(template.getId(), TODAY)).thenReturn(1);

        ReconciliationResult result = service.reconcileInstancesOnTemplateChange(
                template.getId(), TODAY, ReconciliationMode.DELETE_TEMPLATE, null);

        assertEquals(new ReconciliationResult(3, 1, 0), result);
        InOrder order = inOrder(incomeRepository);
        order.verify(incomeRepository).deleteFuture(template.getId(), TODAY);
        order.verify(incomeRepository).unlinkPastAndPresent(template.getId(), TODAY);
        verify(templateRepository, never()).save(any());
        verifyNoInteractions(expenseRepository);
    }

    @Test
    void unknownTemplate_throwsNotFound() {
        UUID id = UUID.randomUUID();
        when(templateRepository.findById(id)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> service.reconcileInstancesOnTemplateChange(
                id, TODAY, ReconciliationMode.DELETE_TEMPLATE, null));
    }

    @Test
    void instancesFor_routesByType() {
        assertSame(expenseRepository, service.instancesFor(TemplateType.EXPENSE));
        assertSame(incomeRepository, service.instancesFor(TemplateType.INCOME));
    }

    @SuppressWarnings("unchecked")
    private List<Expense> captureRestamped() {
        ArgumentCaptor<List<Expense>> captor = ArgumentCaptor.forClass(List.class);
        verify(expenseRepository).saveAll(captor.capture());
        return captor.getValue();
    }

    private static Expense generated(RecurringTemplate template, LocalDate date) {
        return Expense.builder()
                .id(UUID.randomUUID())
                .userId(template.getUserId())
                .recurringTemplateId(template.getId())
                .transactionDate(date)
                .amount(template.getAmount())
                .generated(true)
                .recurring(true)
                .build();
    }

    private static RecurringTemplate monthlyExpense(LocalDate lastGenerated) {
        return RecurringTemplate.builder()
                .id(UUID.randomUUID())
                .userId(UUID.randomUUID())
                .templateType("expense")
                .amount(new BigDecimal("1200.00"))
                .expenseTypeId(UUID.randomUUID())
                .frequency("monthly")
                .startDate(LocalDate.of(2025, 1, 1))
                .lastGeneratedDate(lastGenerated)
                .nextGenerationDate(lastGenerated != null ? lastGenerated.plusMonths(1) : null)
                .build();
    }
}
