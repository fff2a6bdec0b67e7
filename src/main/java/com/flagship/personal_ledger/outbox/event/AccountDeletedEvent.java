package com.flagship.personal_ledger.outbox.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AccountDeletedEvent implements LedgerEvent {
    UUID eventId;
    UUID aggregateId;
    UUID ownerId;
    String strategy;
    UUID targetAccountId;
    int transactionsAffected;
    int templatesAffected;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccountDeleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static AccountDeletedEvent reassigned(UUID ownerId, UUID accountId, UUID targetAccountId,
                                                 int transactions, int templates) {
        return new AccountDeletedEvent(UUID.randomUUID(), accountId, ownerId, "reassign", targetAccountId,
            transactions, templates, Instant.now());
    }

    public static AccountDeletedEvent cascaded(UUID ownerId, UUID accountId, int transactions, int templates) {
        return new AccountDeletedEvent(UUID.randomUUID(), accountId, ownerId, "cascade", null,
            transactions, templates, Instant.now());
    }
}
