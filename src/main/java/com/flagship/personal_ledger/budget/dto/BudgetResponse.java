package com.flagship.personal_ledger.budget.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.personal_ledger.budget.Budget;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class BudgetResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("limit_amount")
    BigDecimal limitAmount;

    @JsonProperty("frequency")
    Budget.BudgetFrequency frequency;

    @JsonProperty("interval")
    int interval;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("cached_consumption")
    BigDecimal cachedConsumption;

    @JsonProperty("category_ids")
    List<UUID> categoryIds;

    public static BudgetResponse from(Budget budget, List<UUID> categoryIds) {
        return BudgetResponse.builder()
            .id(budget.getId())
            .name(budget.getName())
            .limitAmount(budget.getLimitAmount())
            .frequency(budget.getFrequency())
            .interval(budget.getInterval())
            .startDate(budget.getStartDate())
            .endDate(budget.getEndDate())
            .active(budget.isActive())
            .cachedConsumption(budget.getCachedConsumption())
            .categoryIds(categoryIds)
            .build();
    }
}
