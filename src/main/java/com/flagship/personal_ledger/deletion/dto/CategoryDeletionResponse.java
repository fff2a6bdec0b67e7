package com.flagship.personal_ledger.deletion.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.personal_ledger.deletion.CategoryDeletionResult;
import lombok.Value;

@Value
public class CategoryDeletionResponse {

    @JsonProperty("transactions_reassigned")
    int transactionsReassigned;

    @JsonProperty("templates_reassigned")
    int templatesReassigned;

    @JsonProperty("budget_links_removed")
    int budgetLinksRemoved;

    @JsonProperty("deleted")
    boolean deleted;

    public static CategoryDeletionResponse from(CategoryDeletionResult result) {
        return new CategoryDeletionResponse(result.getTransactionsReassigned(), result.getTemplatesReassigned(),
            result.getBudgetLinksRemoved(), result.isDeleted());
    }
}
