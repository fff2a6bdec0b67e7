package com.flagship.personal_ledger.budget.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.personal_ledger.budget.Budget;
import com.flagship.personal_ledger.budget.BudgetCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class CreateBudgetRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Limit amount is required")
    @DecimalMin(value = "0.01", message = "Limit must be positive")
    @Digits(integer = 10, fraction = 2, message = "Limit supports at most 2 decimal places")
    @JsonProperty("limit_amount")
    BigDecimal limitAmount;

    @NotNull(message = "Frequency is required")
    @JsonProperty("frequency")
    Budget.BudgetFrequency frequency;

    @Min(value = 1, message = "Interval must be at least 1")
    @JsonProperty("interval")
    Integer interval;

    @NotNull(message = "Start date is required")
    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("category_ids")
    List<UUID> categoryIds;

    public BudgetCommand toCommand() {
        return BudgetCommand.builder()
            .name(name)
            .limitAmount(limitAmount)
            .frequency(frequency)
            .interval(interval != null ? interval : 1)
            .startDate(startDate)
            .endDate(endDate)
            .categoryIds(categoryIds)
            .build();
    }
}
