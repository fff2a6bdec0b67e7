package com.flagship.personal_ledger.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class CreateTransferRequest {

    @NotNull(message = "From account ID is required")
    @JsonProperty("from_account_id")
    UUID fromAccountId;

    @NotNull(message = "To account ID is required")
    @JsonProperty("to_account_id")
    UUID toAccountId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 10, fraction = 2, message = "Amount supports at most 2 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    LocalDate date;

    @Size(max = 500, message = "Description is limited to 500 characters")
    @JsonProperty("description")
    String description;
}
