package com.flagship.personal_ledger.recurring;

import com.flagship.personal_ledger.common.exception.LedgerErrorCode;
import com.flagship.personal_ledger.common.exception.LedgerException;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Occurrence calculator for a recurring template.
 *
 * Periods are anchored at the start date and repeat every {@code interval} units.
 * With a weekday set, weeks run Monday to Sunday starting from the week of the
 * start date and every listed weekday of an active week is an occurrence. With a
 * month-day set, every listed day of an active month is an occurrence and days a
 * month does not have (31 in April) are skipped. Without a day set the start
 * date itself repeats; monthly and yearly dates are computed from the start date
 * so short months clamp without drifting (Jan 31, Feb 28, Mar 31).
 *
 * No occurrence is ever before the start date.
 */
@Value
public class RecurrenceRule {

    /** Upper bound on empty periods scanned before a day set is declared unsatisfiable. */
    private static final int MAX_EMPTY_PERIODS = 500;

    Frequency frequency;
    int interval;
    List<Integer> byWeekday;
    List<Integer> byMonthday;
    LocalDate startDate;

    public RecurrenceRule(Frequency frequency, int interval, Collection<Integer> byWeekday,
                          Collection<Integer> byMonthday, LocalDate startDate) {
        this.frequency = frequency;
        this.interval = interval;
        this.byWeekday = byWeekday == null ? List.of() : List.copyOf(new TreeSet<>(byWeekday));
        this.byMonthday = byMonthday == null ? List.of() : List.copyOf(new TreeSet<>(byMonthday));
        this.startDate = startDate;
    }

    /**
     * Checks that the rule can produce dates.
     *
     * @throws LedgerException with {@code invalid_schedule} otherwise
     */
    public void validate() {
        if (frequency == null || startDate == null) {
            throw invalidSchedule("frequency and start date are required");
        }
        if (interval < 1) {
            throw invalidSchedule("interval must be at least 1, was " + interval);
        }
        if (!byWeekday.isEmpty()) {
            if (frequency != Frequency.WEEKLY) {
                throw invalidSchedule("weekday constraint requires weekly frequency");
            }
            if (byWeekday.stream().anyMatch(day -> day < 1 || day > 7)) {
                throw invalidSchedule("weekdays must be between 1 (Monday) and 7 (Sunday): " + byWeekday);
            }
        }
        if (!byMonthday.isEmpty()) {
            if (frequency != Frequency.MONTHLY) {
                throw invalidSchedule("month-day constraint requires monthly frequency");
            }
            if (byMonthday.stream().anyMatch(day -> day < 1 || day > 31)) {
                throw invalidSchedule("month days must be between 1 and 31: " + byMonthday);
            }
        }
    }

    /**
     * Earliest occurrence on or after {@code from}.
     */
    public LocalDate nextOnOrAfter(LocalDate from) {
        validate();
        LocalDate target = from.isBefore(startDate) ? startDate : from;

        switch (frequency) {
            case DAILY:
                return stepDays(target, interval);
            case WEEKLY:
                return byWeekday.isEmpty() ? stepDays(target, 7L * interval) : nextWeekdayOccurrence(target);
            case MONTHLY:
                return byMonthday.isEmpty() ? nextMonthlyOccurrence(target) : nextMonthdayOccurrence(target);
            case YEARLY:
                return nextYearlyOccurrence(target);
            default:
                throw invalidSchedule("unsupported frequency " + frequency);
        }
    }

    /**
     * Earliest occurrence strictly after {@code date}.
     */
    public LocalDate nextAfter(LocalDate date) {
        return nextOnOrAfter(date.plusDays(1));
    }

    /**
     * All occurrences in {@code [from, until]}, in order.
     */
    public List<LocalDate> occurrencesBetween(LocalDate from, LocalDate until) {
        List<LocalDate> dates = new ArrayList<>();
        LocalDate next = nextOnOrAfter(from);
        while (!next.isAfter(until)) {
            dates.add(next);
            next = nextAfter(next);
        }
        return dates;
    }

    private LocalDate stepDays(LocalDate target, long step) {
        long days = ChronoUnit.DAYS.between(startDate, target);
        long periods = (days + step - 1) / step;
        return startDate.plusDays(periods * step);
    }

    private LocalDate nextWeekdayOccurrence(LocalDate target) {
        LocalDate anchorWeek = startDate.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        LocalDate targetWeek = target.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        long periods = ChronoUnit.WEEKS.between(anchorWeek, targetWeek) / interval;
        LocalDate week = anchorWeek.plusWeeks(periods * interval);

        for (int scanned = 0; scanned < MAX_EMPTY_PERIODS; scanned++) {
            for (int weekday : byWeekday) {
                LocalDate candidate = week.plusDays(weekday - 1L);
                if (!candidate.isBefore(target)) {
                    return candidate;
                }
            }
            week = week.plusWeeks(interval);
        }
        throw invalidSchedule("no weekday occurrence found after " + target);
    }

    private LocalDate nextMonthlyOccurrence(LocalDate target) {
        long periods = ChronoUnit.MONTHS.between(YearMonth.from(startDate), YearMonth.from(target)) / interval;
        LocalDate candidate = startDate.plusMonths(periods * interval);
        while (candidate.isBefore(target)) {
            periods++;
            candidate = startDate.plusMonths(periods * interval);
        }
        return candidate;
    }

    private LocalDate nextMonthdayOccurrence(LocalDate target) {
        YearMonth anchor = YearMonth.from(startDate);
        long periods = ChronoUnit.MONTHS.between(anchor, YearMonth.from(target)) / interval;
        YearMonth month = anchor.plusMonths(periods * interval);

        for (int scanned = 0; scanned < MAX_EMPTY_PERIODS; scanned++) {
            for (int day : byMonthday) {
                if (day <= month.lengthOfMonth()) {
                    LocalDate candidate = month.atDay(day);
                    if (!candidate.isBefore(target)) {
                        return candidate;
                    }
                }
            }
            month = month.plusMonths(interval);
        }
        throw invalidSchedule("month days " + byMonthday + " never occur every " + interval + " month(s) from " + startDate);
    }

    private LocalDate nextYearlyOccurrence(LocalDate target) {
        long periods = ChronoUnit.YEARS.between(startDate.withDayOfYear(1), target.withDayOfYear(1)) / interval;
        LocalDate candidate = startDate.plusYears(periods * interval);
        while (candidate.isBefore(target)) {
            periods++;
            candidate = startDate.plusYears(periods * interval);
        }
        return candidate;
    }

    private static LedgerException invalidSchedule(String message) {
        return new LedgerException(LedgerErrorCode.INVALID_SCHEDULE, "Invalid schedule: " + message);
    }
}
