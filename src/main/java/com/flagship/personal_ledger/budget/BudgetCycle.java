package com.flagship.personal_ledger.budget;

import lombok.Value;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Cycle window arithmetic for budgets.
 *
 * Cycles are {@code interval} days, weeks, calendar months or calendar years
 * long and start at the budget's start date. A one-off budget has a single
 * cycle from start to end date (open-ended without one). Before the start date
 * the first cycle is current; after the end date the last one is. Every window
 * is clamped to the end date.
 */
public final class BudgetCycle {

    /** Stand-in for an open end. Fits a Postgres DATE. */
    public static final LocalDate OPEN_END = LocalDate.of(9999, 12, 31);

    private BudgetCycle() {
        // Utility class
    }

    public static Window windowContaining(Budget.BudgetFrequency frequency, int interval,
                                          LocalDate startDate, LocalDate endDate, LocalDate today) {
        if (interval < 1) {
            throw new IllegalArgumentException("Budget interval must be at least 1, was " + interval);
        }
        LocalDate reference = today.isBefore(startDate) ? startDate : today;
        if (endDate != null && reference.isAfter(endDate)) {
            reference = endDate;
        }

        LocalDate cycleStart;
        LocalDate nextCycleStart;
        switch (frequency) {
            case ONCE:
                return new Window(startDate, endDate != null ? endDate : OPEN_END);
            case DAILY:
            case WEEKLY: {
                long length = frequency == Budget.BudgetFrequency.DAILY ? interval : 7L * interval;
                long index = ChronoUnit.DAYS.between(startDate, reference) / length;
                cycleStart = startDate.plusDays(index * length);
                nextCycleStart = cycleStart.plusDays(length);
                break;
            }
            case MONTHLY: {
                long index = ChronoUnit.MONTHS.between(startDate, reference) / interval;
                cycleStart = startDate.plusMonths(index * interval);
                nextCycleStart = startDate.plusMonths((index + 1) * interval);
                // clamped month ends (Jan 31 + 1 month = Feb 28) can leave the reference one cycle ahead
                while (!reference.isBefore(nextCycleStart)) {
                    index++;
                    cycleStart = nextCycleStart;
                    nextCycleStart = startDate.plusMonths((index + 1) * interval);
                }
                break;
            }
            case YEARLY: {
                long index = ChronoUnit.YEARS.between(startDate, reference) / interval;
                cycleStart = startDate.plusYears(index * interval);
                nextCycleStart = startDate.plusYears((index + 1) * interval);
                // Feb 29 anniversaries clamp to Feb 28 the same way
                while (!reference.isBefore(nextCycleStart)) {
                    index++;
                    cycleStart = nextCycleStart;
                    nextCycleStart = startDate.plusYears((index + 1) * interval);
                }
                break;
            }
            default:
                throw new IllegalArgumentException("Unsupported budget frequency: " + frequency);
        }

        LocalDate cycleEnd = nextCycleStart.minusDays(1);
        if (endDate != null && endDate.isBefore(cycleEnd)) {
            cycleEnd = endDate;
        }
        return new Window(cycleStart, cycleEnd);
    }

    /**
     * Inclusive date range.
     */
    @Value
    public static class Window {
        LocalDate start;
        LocalDate end;

        public boolean contains(LocalDate date) {
            return !date.isBefore(start) && !date.isAfter(end);
        }
    }
}
