package com.flagship.personal_ledger.budget;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A spending limit over a set of categories. {@code cachedConsumption} is the
 * outcome total of the current cycle, maintained by the reconciler.
 */
@Value
@Builder
public class Budget {
    UUID id;
    UUID ownerId;
    String name;
    BigDecimal limitAmount;
    BudgetFrequency frequency;
    int interval;
    LocalDate startDate;
    LocalDate endDate;
    boolean active;
    BigDecimal cachedConsumption;
    Instant deletedAt;

    public BudgetCycle.Window currentWindow(LocalDate today) {
        return BudgetCycle.windowContaining(frequency, interval, startDate, endDate, today);
    }

    public enum BudgetFrequency {
        ONCE,
        DAILY,
        WEEKLY,
        MONTHLY,
        YEARLY
    }
}
