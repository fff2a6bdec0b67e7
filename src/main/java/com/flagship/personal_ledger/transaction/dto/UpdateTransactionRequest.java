package com.flagship.personal_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class UpdateTransactionRequest {

    @DecimalMin(value = "0.00", message = "Amount must not be negative")
    @Digits(integer = 10, fraction = 2, message = "Amount supports at most 2 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("date")
    LocalDate date;

    @Size(max = 500, message = "Description is limited to 500 characters")
    @JsonProperty("description")
    String description;

    @JsonProperty("category_id")
    UUID categoryId;
}
