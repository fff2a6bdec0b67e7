package com.flagship.personal_ledger.recurring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.personal_ledger.recurring.SyncResult;
import com.flagship.personal_ledger.recurring.TemplateFailure;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class SyncResponse {

    @JsonProperty("as_of")
    LocalDate asOf;

    @JsonProperty("transactions_materialized")
    int transactionsMaterialized;

    @JsonProperty("templates_processed")
    int templatesProcessed;

    @JsonProperty("accounts_reconciled")
    int accountsReconciled;

    @JsonProperty("budgets_reconciled")
    int budgetsReconciled;

    @JsonProperty("failures")
    List<TemplateFailure> failures;

    public static SyncResponse from(SyncResult result) {
        return SyncResponse.builder()
            .asOf(result.getAsOf())
            .transactionsMaterialized(result.getTransactionsMaterialized())
            .templatesProcessed(result.getTemplatesProcessed())
            .accountsReconciled(result.getAccountsReconciled())
            .budgetsReconciled(result.getBudgetsReconciled())
            .failures(result.getFailures())
            .build();
    }
}
