package com.flagship.personal_ledger.outbox.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class TransferUpdatedEvent implements LedgerEvent {
    UUID eventId;
    UUID aggregateId;
    UUID ownerId;
    UUID outgoingTransactionId;
    UUID incomingTransactionId;
    BigDecimal amount;
    LocalDate date;
    String description;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransferUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferUpdatedEvent of(UUID ownerId, UUID outgoingId, UUID incomingId,
                                          BigDecimal amount, LocalDate date, String description) {
        return new TransferUpdatedEvent(UUID.randomUUID(), outgoingId, ownerId, outgoingId, incomingId,
            amount, date, description, Instant.now());
    }
}
