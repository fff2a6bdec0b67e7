package com.flagship.personal_ledger.recurring;

import lombok.Value;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * What one materialization unit (a template, or both templates of a pair) did.
 */
@Value
public class MaterializationOutcome {
    List<UUID> templateIds;
    int transactionsCreated;
    Set<UUID> accountsReconciled;
    int budgetsReconciled;
    boolean skipped;

    static MaterializationOutcome skipped(UUID templateId) {
        return new MaterializationOutcome(List.of(templateId), 0, Set.of(), 0, true);
    }
}
