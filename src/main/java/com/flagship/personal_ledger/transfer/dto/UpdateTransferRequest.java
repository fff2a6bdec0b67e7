package com.flagship.personal_ledger.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial edit; absent fields keep their value on both legs.
 */
@Value
public class UpdateTransferRequest {

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 10, fraction = 2, message = "Amount supports at most 2 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("date")
    LocalDate date;

    @Size(max = 500, message = "Description is limited to 500 characters")
    @JsonProperty("description")
    String description;
}
