package com.flagship.personal_ledger.outbox.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of events relayed from the outbox.
 */
public interface LedgerEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    /**
     * Kafka key. Events with the same aggregate id keep their order.
     */
    UUID getAggregateId();

    UUID getOwnerId();

    Instant getOccurredAt();

    String getEventType();
}
