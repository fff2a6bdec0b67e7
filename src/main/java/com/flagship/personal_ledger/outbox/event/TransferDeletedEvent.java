package com.flagship.personal_ledger.outbox.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A transfer was soft-deleted. {@code orphan} marks the deletion of a pair
 * whose partner leg was already missing.
 */
@Value
public class TransferDeletedEvent implements LedgerEvent {
    UUID eventId;
    UUID aggregateId;
    UUID ownerId;
    UUID requestedLegId;
    int legsRemoved;
    boolean orphan;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransferDeleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferDeletedEvent of(UUID ownerId, UUID legId, int legsRemoved, boolean orphan) {
        return new TransferDeletedEvent(UUID.randomUUID(), legId, ownerId, legId, legsRemoved, orphan, Instant.now());
    }
}
