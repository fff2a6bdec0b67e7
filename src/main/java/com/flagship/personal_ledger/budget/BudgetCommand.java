package com.flagship.personal_ledger.budget;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class BudgetCommand {
    String name;
    BigDecimal limitAmount;
    Budget.BudgetFrequency frequency;
    int interval;
    LocalDate startDate;
    LocalDate endDate;
    List<UUID> categoryIds;
}
