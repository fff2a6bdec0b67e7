package com.flagship.personal_ledger.deletion.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.personal_ledger.deletion.AccountCascadeResult;
import com.flagship.personal_ledger.deletion.AccountReassignResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Either reassignment or cascade counters are set, depending on the strategy.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AccountDeletionResponse {

    @JsonProperty("strategy")
    String strategy;

    @JsonProperty("transactions_reassigned")
    Integer transactionsReassigned;

    @JsonProperty("templates_reassigned")
    Integer templatesReassigned;

    @JsonProperty("transactions_soft_deleted")
    Integer transactionsSoftDeleted;

    @JsonProperty("transaction_pairs_detached")
    Integer transactionPairsDetached;

    @JsonProperty("templates_soft_deleted")
    Integer templatesSoftDeleted;

    @JsonProperty("template_pairs_detached")
    Integer templatePairsDetached;

    @JsonProperty("account_soft_deleted")
    boolean accountSoftDeleted;

    @JsonProperty("deleted_at")
    Instant deletedAt;

    public static AccountDeletionResponse from(AccountReassignResult result) {
        return AccountDeletionResponse.builder()
            .strategy("reassign")
            .transactionsReassigned(result.getTransactionsReassigned())
            .templatesReassigned(result.getTemplatesReassigned())
            .accountSoftDeleted(result.isAccountSoftDeleted())
            .deletedAt(result.getDeletedAt())
            .build();
    }

    public static AccountDeletionResponse from(AccountCascadeResult result) {
        return AccountDeletionResponse.builder()
            .strategy("cascade")
            .transactionsSoftDeleted(result.getTransactionsSoftDeleted())
            .transactionPairsDetached(result.getTransactionPairsDetached())
            .templatesSoftDeleted(result.getTemplatesSoftDeleted())
            .templatePairsDetached(result.getTemplatePairsDetached())
            .accountSoftDeleted(result.isAccountSoftDeleted())
            .deletedAt(result.getDeletedAt())
            .build();
    }
}
