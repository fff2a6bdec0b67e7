package com.flagship.personal_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in the outbox to be relayed to Kafka.
 *
 * Written in the same database transaction as the ledger change it describes,
 * so an event exists exactly when its change committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // Transfer, RecurringTemplate, Account
    UUID aggregateId;
    UUID ownerId;
    String eventType;
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until relayed
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId, UUID ownerId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            ownerId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
