package com.fintracker.recurring.repositories;

import com.fintracker.recurring.entities.Income;

public interface IncomeRepository extends TransactionInstanceRepository<Income> {
}
