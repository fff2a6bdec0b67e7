package com.flagship.personal_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.personal_ledger.common.FlowType;
import com.flagship.personal_ledger.transaction.TransactionCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class CreateTransactionRequest {

    @NotNull(message = "Account ID is required")
    @JsonProperty("account_id")
    UUID accountId;

    @NotNull(message = "Category ID is required")
    @JsonProperty("category_id")
    UUID categoryId;

    @NotNull(message = "Flow type is required")
    @JsonProperty("flow_type")
    FlowType flowType;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.00", message = "Amount must not be negative")
    @Digits(integer = 10, fraction = 2, message = "Amount supports at most 2 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    LocalDate date;

    @Size(max = 500, message = "Description is limited to 500 characters")
    @JsonProperty("description")
    String description;

    @JsonProperty("invoice_id")
    UUID invoiceId;

    public TransactionCommand toCommand() {
        return TransactionCommand.builder()
            .accountId(accountId)
            .categoryId(categoryId)
            .flowType(flowType)
            .amount(amount)
            .date(date)
            .description(description)
            .invoiceId(invoiceId)
            .build();
    }
}
