package com.flagship.personal_ledger.deletion;

import lombok.Value;

@Value
public class CategoryDeletionResult {
    int transactionsReassigned;
    int templatesReassigned;
    int budgetLinksRemoved;
    boolean deleted;
}
