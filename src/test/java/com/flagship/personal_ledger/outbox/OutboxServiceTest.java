package com.flagship.personal_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.personal_ledger.LedgerIntegrationTestSupport;
import com.flagship.personal_ledger.common.exception.LedgerException;
import com.flagship.personal_ledger.outbox.event.TransferCreatedEvent;
import com.flagship.personal_ledger.outbox.event.TransferDeletedEvent;
import com.flagship.personal_ledger.transfer.PairingManager;
import com.flagship.personal_ledger.transfer.Transfer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox rows are written in the same transaction as the ledger change.
 */
class OutboxServiceTest extends LedgerIntegrationTestSupport {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private PairingManager pairingManager;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID checking;
    private UUID savings;

    @BeforeEach
    void setUp() {
        checking = account("Checking", "100.00");
        savings = account("Savings");
    }

    @Test
    @DisplayName("Transfer event carries both legs and is unpublished")
    void transferWritesEvent() throws Exception {
        printTestHeader("Transfer Outbox Event");

        Transfer transfer = pairingManager.createTransfer(ownerId, checking, savings, amount("30.00"),
            LocalDate.of(2025, 11, 3), null, null);

        List<OutboxEvent> events = outboxService.getEventsForAggregate(PairingManager.TRANSFER_AGGREGATE,
            transfer.getOutgoing().getId());
        printOutput("Events", events.size());

        assertEquals(1, events.size());
        OutboxEvent event = events.get(0);
        assertEquals(TransferCreatedEvent.EVENT_TYPE, event.getEventType());
        assertEquals(ownerId, event.getOwnerId());
        assertNull(event.getPublishedAt());
        assertEquals(0, event.getRetryCount());

        JsonNode payload = objectMapper.readTree(event.getPayload());
        printOutput("Payload", payload);
        assertEquals(transfer.getIncoming().getId().toString(), payload.get("incomingTransactionId").asText());
        assertEquals(ownerId.toString(), payload.get("ownerId").asText());
        assertEquals("2025-11-03", payload.get("date").asText());
        printSuccess("Event stored with the transfer");
    }

    @Test
    @DisplayName("A rejected transfer leaves no event behind")
    void rolledBackTransferWritesNothing() {
        assertThrows(LedgerException.class, () ->
            pairingManager.createTransfer(ownerId, checking, checking, amount("30.00"), LocalDate.of(2025, 11, 3),
                null, null));

        assertTrue(outboxService.getEventsForOwner(ownerId).isEmpty());
    }

    @Test
    @DisplayName("Saving an event outside a transaction is refused")
    void requiresTransaction() {
        TransferDeletedEvent event = TransferDeletedEvent.of(ownerId, UUID.randomUUID(), 2, false);

        assertThrows(IllegalTransactionStateException.class, () ->
            outboxService.saveEvent(PairingManager.TRANSFER_AGGREGATE, event));
    }

    @Test
    @DisplayName("A failed publish increments the retry count")
    void markFailed() {
        Transfer transfer = pairingManager.createTransfer(ownerId, checking, savings, amount("5.00"),
            LocalDate.of(2025, 11, 3), null, null);
        OutboxEvent event = outboxService.getEventsForAggregate(PairingManager.TRANSFER_AGGREGATE,
            transfer.getOutgoing().getId()).get(0);

        outboxService.markFailed(event.getId(), "broker unavailable");
        outboxService.markFailed(event.getId(), "broker unavailable");

        OutboxEvent reloaded = outboxService.getEventsForAggregate(PairingManager.TRANSFER_AGGREGATE,
            transfer.getOutgoing().getId()).get(0);
        assertEquals(2, reloaded.getRetryCount());
        assertEquals("broker unavailable", reloaded.getLastError());
        assertNull(reloaded.getPublishedAt());
    }

    @Test
    @DisplayName("An owner's events come back in commit order and a long broker error is cut")
    void ownerHistoryAndErrorLength() {
        Transfer first = pairingManager.createTransfer(ownerId, checking, savings, amount("5.00"),
            LocalDate.of(2025, 11, 3), null, null);
        pairingManager.deleteTransfer(ownerId, first.getOutgoing().getId());

        List<OutboxEvent> history = outboxService.getEventsForOwner(ownerId);
        printOutput("History", history.stream().map(OutboxEvent::getEventType).toList());

        assertEquals(List.of(TransferCreatedEvent.EVENT_TYPE, TransferDeletedEvent.EVENT_TYPE),
            history.stream().map(OutboxEvent::getEventType).toList());
        assertTrue(history.get(0).getSequenceNumber() < history.get(1).getSequenceNumber());

        outboxService.markFailed(history.get(0).getId(), "x".repeat(5000));
        OutboxEvent failed = outboxService.getEventsForOwner(ownerId).get(0);
        assertEquals(2000, failed.getLastError().length());
    }
}
