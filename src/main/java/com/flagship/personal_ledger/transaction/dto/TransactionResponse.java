package com.flagship.personal_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.personal_ledger.common.FlowType;
import com.flagship.personal_ledger.transaction.LedgerTransaction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("category_id")
    UUID categoryId;

    @JsonProperty("flow_type")
    FlowType flowType;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("description")
    String description;

    @JsonProperty("invoice_id")
    UUID invoiceId;

    @JsonProperty("paired_transaction_id")
    UUID pairedTransactionId;

    @JsonProperty("recurring_template_id")
    UUID recurringTemplateId;

    @JsonProperty("system_generated_key")
    String systemGeneratedKey;

    @JsonProperty("deleted_at")
    Instant deletedAt;

    public static TransactionResponse from(LedgerTransaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .accountId(transaction.getAccountId())
            .categoryId(transaction.getCategoryId())
            .flowType(transaction.getFlowType())
            .amount(transaction.getAmount())
            .date(transaction.getDate())
            .description(transaction.getDescription())
            .invoiceId(transaction.getInvoiceId())
            .pairedTransactionId(transaction.getPairedTransactionId())
            .recurringTemplateId(transaction.getRecurringTemplateId())
            .systemGeneratedKey(transaction.getSystemGeneratedKey() != null
                ? transaction.getSystemGeneratedKey().key() : null)
            .deletedAt(transaction.getDeletedAt())
            .build();
    }
}
