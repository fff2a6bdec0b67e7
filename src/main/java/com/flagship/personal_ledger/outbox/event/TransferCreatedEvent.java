package com.flagship.personal_ledger.outbox.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Both legs of a transfer were written and linked.
 * The aggregate id is the outgoing leg.
 */
@Value
public class TransferCreatedEvent implements LedgerEvent {
    UUID eventId;
    UUID aggregateId;
    UUID ownerId;
    UUID outgoingTransactionId;
    UUID incomingTransactionId;
    UUID fromAccountId;
    UUID toAccountId;
    BigDecimal amount;
    LocalDate date;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransferCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferCreatedEvent of(UUID ownerId, UUID outgoingId, UUID incomingId, UUID fromAccountId,
                                          UUID toAccountId, BigDecimal amount, LocalDate date) {
        return new TransferCreatedEvent(UUID.randomUUID(), outgoingId, ownerId, outgoingId, incomingId,
            fromAccountId, toAccountId, amount, date, Instant.now());
    }
}
