package com.flagship.personal_ledger.recurring;

import com.flagship.personal_ledger.common.FlowType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A recurring-transaction template.
 *
 * {@code nextRunDate} is the durable materialization cursor. It only moves
 * through {@link RecurringTemplateRepository#advanceCursor}.
 */
@Value
@Builder
public class RecurringTemplate {
    UUID id;
    UUID ownerId;
    UUID accountId;
    UUID categoryId;
    FlowType flowType;
    BigDecimal amount;
    String description;
    Frequency frequency;
    int interval;
    List<Integer> byWeekday;
    List<Integer> byMonthday;
    LocalDate startDate;
    LocalDate nextRunDate;
    LocalDate endDate;
    boolean active;
    UUID pairedTemplateId;
    Instant deletedAt;

    public RecurrenceRule rule() {
        return new RecurrenceRule(frequency, interval, byWeekday, byMonthday, startDate);
    }

    public boolean isPaired() {
        return pairedTemplateId != null;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    /**
     * Lifecycle state derived from the active flag, the deletion timestamp and the cursor.
     */
    public TemplateState state() {
        if (deletedAt != null) {
            return TemplateState.DELETED;
        }
        if (active) {
            return TemplateState.SCHEDULED;
        }
        if (endDate != null && nextRunDate.isAfter(endDate)) {
            return TemplateState.EXHAUSTED;
        }
        return TemplateState.PAUSED;
    }

    public boolean isDue(LocalDate asOf) {
        return state() == TemplateState.SCHEDULED && !nextRunDate.isAfter(asOf);
    }

    public enum TemplateState {
        /** Active; materialized whenever the cursor falls due. */
        SCHEDULED,
        /** Deactivated by the owner; can be resumed. */
        PAUSED,
        /** Cursor ran past the end date. */
        EXHAUSTED,
        /** Soft-deleted. */
        DELETED
    }
}
