package com.flagship.personal_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class AdjustBalanceRequest {

    @NotNull(message = "Target balance is required")
    @Digits(integer = 10, fraction = 2, message = "Target balance supports at most 2 decimal places")
    @JsonProperty("target_balance")
    BigDecimal targetBalance;

    @JsonProperty("date")
    LocalDate date;
}
