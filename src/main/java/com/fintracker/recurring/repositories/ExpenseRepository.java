package com.fintracker.recurring.repositories;

import com.fintracker.recurring.entities.Expense;

public interface ExpenseRepository extends TransactionInstanceRepository<Expense> {
}
