package com.flagship.personal_ledger.outbox.event;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A template (or a recurring-transfer pair) produced transactions during a sync.
 */
@Value
public class RecurringTransactionsMaterializedEvent implements LedgerEvent {
    UUID eventId;
    UUID aggregateId;
    UUID ownerId;
    UUID pairedTemplateId;
    List<LocalDate> occurrenceDates;
    int transactionsCreated;
    LocalDate nextRunDate;
    boolean exhausted;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RecurringTransactionsMaterialized";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static RecurringTransactionsMaterializedEvent of(UUID ownerId, UUID templateId, UUID pairedTemplateId,
                                                            List<LocalDate> dates, int transactionsCreated,
                                                            LocalDate nextRunDate, boolean exhausted) {
        return new RecurringTransactionsMaterializedEvent(UUID.randomUUID(), templateId, ownerId, pairedTemplateId,
            List.copyOf(dates), transactionsCreated, nextRunDate, exhausted, Instant.now());
    }
}
