package com.flagship.personal_ledger.recurring;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class SyncResult {
    UUID ownerId;
    LocalDate asOf;
    int transactionsMaterialized;
    int templatesProcessed;
    int accountsReconciled;
    /** Budget recomputations, summed over the materialized units. */
    int budgetsReconciled;
    List<TemplateFailure> failures;
}
