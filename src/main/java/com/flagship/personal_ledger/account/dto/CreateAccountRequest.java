package com.flagship.personal_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.personal_ledger.account.Account;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CreateAccountRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name is limited to 255 characters")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Account type is required")
    @JsonProperty("type")
    Account.AccountType type;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @Digits(integer = 10, fraction = 2, message = "Initial balance supports at most 2 decimal places")
    @JsonProperty("initial_balance")
    BigDecimal initialBalance;
}
