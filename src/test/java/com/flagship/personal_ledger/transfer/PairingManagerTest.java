package com.flagship.personal_ledger.transfer;

import com.flagship.personal_ledger.LedgerIntegrationTestSupport;
import com.flagship.personal_ledger.account.Account;
import com.flagship.personal_ledger.category.Category;
import com.flagship.personal_ledger.common.FlowType;
import com.flagship.personal_ledger.common.exception.LedgerErrorCode;
import com.flagship.personal_ledger.common.exception.LedgerException;
import com.flagship.personal_ledger.outbox.OutboxService;
import com.flagship.personal_ledger.outbox.event.TransferCreatedEvent;
import com.flagship.personal_ledger.recurring.Frequency;
import com.flagship.personal_ledger.recurring.RecurringTemplate;
import com.flagship.personal_ledger.recurring.RecurringTemplateRepository;
import com.flagship.personal_ledger.transaction.LedgerTransaction;
import com.flagship.personal_ledger.transaction.TransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Transfers: both legs are written, edited and removed together.
 */
class PairingManagerTest extends LedgerIntegrationTestSupport {

    private static final LocalDate TRANSFER_DATE = LocalDate.of(2025, 11, 3);

    @Autowired
    private PairingManager pairingManager;

    @Autowired
    private TransactionRepository transactionRepository;

    @Autowired
    private RecurringTemplateRepository templateRepository;

    @Autowired
    private OutboxService outboxService;

    private UUID accountA;
    private UUID accountB;

    @BeforeEach
    void setUp() {
        accountA = account("Checking", "1000.00");
        accountB = account("Savings", "200.00");
    }

    @Test
    @DisplayName("Transfer of 500.00 moves the balance and deleting one leg restores both accounts")
    void transferAndDelete() {
        printTestHeader("Transfer Create And Delete");

        // Given
        printInput("From", accountA);
        printInput("To", accountB);
        printInput("Amount", "500.00");

        // When
        Transfer transfer = pairingManager.createTransfer(ownerId, accountA, accountB, amount("500.00"),
            TRANSFER_DATE, "Rent savings", null);
        printOutput("Outgoing", transfer.getOutgoing().getId());
        printOutput("Incoming", transfer.getIncoming().getId());

        // Then
        assertEquals(0, amount("500.00").compareTo(storedBalance(accountA)));
        assertEquals(0, amount("700.00").compareTo(storedBalance(accountB)));
        assertPairSymmetric(transfer.getOutgoing().getId());

        TransferDeletion deletion = pairingManager.deleteTransfer(ownerId, transfer.getIncoming().getId());
        printOutput("Legs removed", deletion.getLegsRemoved());

        assertEquals(2, deletion.getLegsRemoved());
        assertFalse(deletion.isOrphan());
        assertEquals(0, amount("1000.00").compareTo(storedBalance(accountA)));
        assertEquals(0, amount("200.00").compareTo(storedBalance(accountB)));
        assertTrue(transactionRepository.findActiveOwned(ownerId, transfer.getOutgoing().getId()).isEmpty());
        assertTrue(transactionRepository.findActiveOwned(ownerId, transfer.getIncoming().getId()).isEmpty());
        printSuccess("Both legs removed and balances restored");
    }

    @Test
    @DisplayName("Legs use the system transfer categories and the outbox records the transfer")
    void legsUseTransferCategories() {
        Transfer transfer = pairingManager.createTransfer(ownerId, accountA, accountB, amount("10.00"),
            TRANSFER_DATE, null, null);

        LedgerTransaction outgoing = transfer.getOutgoing();
        LedgerTransaction incoming = transfer.getIncoming();
        assertEquals(FlowType.OUTCOME, outgoing.getFlowType());
        assertEquals(FlowType.INCOME, incoming.getFlowType());
        assertEquals(systemCategory(Category.SystemCategoryKey.TRANSFER,
            FlowType.OUTCOME).getId(), outgoing.getCategoryId());
        assertEquals(1, outboxService.getEventsForAggregate(PairingManager.TRANSFER_AGGREGATE, outgoing.getId())
            .stream().filter(e -> TransferCreatedEvent.EVENT_TYPE.equals(e.getEventType())).count());
    }

    @Test
    @DisplayName("Updating either leg changes both legs identically")
    void updateAppliesToBothLegs() {
        printTestHeader("Transfer Update");

        Transfer transfer = pairingManager.createTransfer(ownerId, accountA, accountB, amount("100.00"),
            TRANSFER_DATE, "Before", null);

        Transfer updated = pairingManager.updateTransfer(ownerId, transfer.getIncoming().getId(),
            amount("250.00"), LocalDate.of(2025, 11, 10), "After");
        printOutput("Outgoing amount", updated.getOutgoing().getAmount());

        assertEquals(0, amount("250.00").compareTo(updated.getOutgoing().getAmount()));
        assertEquals(0, amount("250.00").compareTo(updated.getIncoming().getAmount()));
        assertEquals(LocalDate.of(2025, 11, 10), updated.getIncoming().getDate());
        assertEquals("After", updated.getOutgoing().getDescription());
        assertPairSymmetric(updated.getOutgoing().getId());
        assertEquals(0, amount("750.00").compareTo(storedBalance(accountA)));
        assertEquals(0, amount("450.00").compareTo(storedBalance(accountB)));
        printSuccess("Both legs updated");
    }

    @Test
    @DisplayName("Same account, foreign account and non-positive amount are rejected")
    void invalidAccounts() {
        UUID foreignAccount = accountService.createAccount(UUID.randomUUID(), "Other",
            Account.AccountType.CASH, "EUR", null).getId();

        LedgerException same = assertThrows(LedgerException.class, () ->
            pairingManager.createTransfer(ownerId, accountA, accountA, amount("5.00"), TRANSFER_DATE, null, null));
        LedgerException foreign = assertThrows(LedgerException.class, () ->
            pairingManager.createTransfer(ownerId, accountA, foreignAccount, amount("5.00"), TRANSFER_DATE, null, null));
        LedgerException zero = assertThrows(LedgerException.class, () ->
            pairingManager.createTransfer(ownerId, accountA, accountB, amount("0.00"), TRANSFER_DATE, null, null));

        assertEquals(LedgerErrorCode.INVALID_ACCOUNTS, same.getErrorCode());
        assertEquals(LedgerErrorCode.INVALID_ACCOUNTS, foreign.getErrorCode());
        assertEquals(LedgerErrorCode.INVALID_REQUEST, zero.getErrorCode());
        assertEquals(0, amount("1000.00").compareTo(storedBalance(accountA)));
    }

    @Test
    @DisplayName("Updating a plain transaction through the pairing path fails with not_a_transfer")
    void updateNonTransfer() {
        UUID plainId = transactionRepository.findActiveByAccount(ownerId, accountA).get(0).getId();

        LedgerException e = assertThrows(LedgerException.class, () ->
            pairingManager.updateTransfer(ownerId, plainId, amount("1.00"), null, null));

        printExpectedException(e.getErrorCode().code(), e.getMessage());
        assertEquals(LedgerErrorCode.NOT_A_TRANSFER, e.getErrorCode());
    }

    @Test
    @DisplayName("Another owner cannot see or delete the transfer")
    void ownershipIsEnforced() {
        Transfer transfer = pairingManager.createTransfer(ownerId, accountA, accountB, amount("10.00"),
            TRANSFER_DATE, null, null);

        LedgerException e = assertThrows(LedgerException.class, () ->
            pairingManager.deleteTransfer(UUID.randomUUID(), transfer.getOutgoing().getId()));

        assertEquals(LedgerErrorCode.NOT_FOUND, e.getErrorCode());
        assertTrue(transactionRepository.findActiveOwned(ownerId, transfer.getOutgoing().getId()).isPresent());
    }

    @Test
    @DisplayName("Broken pair: update is refused and delete removes the surviving leg with a warning")
    void orphanPair() {
        printTestHeader("Orphan Pair");

        Transfer transfer = pairingManager.createTransfer(ownerId, accountA, accountB, amount("40.00"),
            TRANSFER_DATE, null, null);
        UUID outgoingId = transfer.getOutgoing().getId();
        // simulate a partner lost outside the pairing manager
        jdbcTemplate.update("UPDATE transactions SET deleted_at = CURRENT_TIMESTAMP WHERE id = ?",
            transfer.getIncoming().getId());

        LedgerException update = assertThrows(LedgerException.class, () ->
            pairingManager.updateTransfer(ownerId, outgoingId, amount("41.00"), null, null));
        assertEquals(LedgerErrorCode.ORPHAN_PAIR, update.getErrorCode());

        TransferDeletion deletion = pairingManager.deleteTransfer(ownerId, outgoingId);
        printOutput("Warning", deletion.getWarning());

        assertEquals(1, deletion.getLegsRemoved());
        assertEquals(PairingManager.ORPHAN_PAIR_WARNING, deletion.getWarning());
        LedgerTransaction deletedLeg = transactionRepository.findOwned(ownerId, outgoingId).orElseThrow();
        assertTrue(deletedLeg.isDeleted());
        assertNull(deletedLeg.getPairedTransactionId());
        assertNull(transactionRepository.findOwned(ownerId, transfer.getIncoming().getId()).orElseThrow()
            .getPairedTransactionId());
        printSuccess("Orphan leg removed and references cleared");
    }

    @Test
    @DisplayName("Repeating a transfer with the same idempotency key returns the first transfer")
    void idempotencyKeyReplay() {
        printTestHeader("Transfer Idempotency");

        String key = "transfer-" + UUID.randomUUID();
        Transfer first = pairingManager.createTransfer(ownerId, accountA, accountB, amount("75.00"),
            TRANSFER_DATE, null, key);
        Transfer second = pairingManager.createTransfer(ownerId, accountA, accountB, amount("75.00"),
            TRANSFER_DATE, null, key);

        assertFalse(first.isReplayed());
        assertTrue(second.isReplayed());
        assertEquals(first.getOutgoing().getId(), second.getOutgoing().getId());
        assertEquals(0, amount("925.00").compareTo(storedBalance(accountA)));
        printSuccess("Second request replayed without writing");
    }

    @Test
    @DisplayName("Recurring transfer creates two linked templates of opposite flow")
    void recurringTransferTemplates() {
        RecurringTransfer recurring = pairingManager.createRecurringTransfer(ownerId, RecurringTransferCommand.builder()
            .fromAccountId(accountA)
            .toAccountId(accountB)
            .amount(amount("50.00"))
            .frequency(Frequency.MONTHLY)
            .interval(1)
            .byMonthday(List.of(5))
            .startDate(LocalDate.of(2025, 11, 1))
            .build());

        RecurringTemplate outgoing = templateRepository.findOwned(ownerId, recurring.getOutgoingTemplateId())
            .orElseThrow();
        RecurringTemplate incoming = templateRepository.findOwned(ownerId, recurring.getIncomingTemplateId())
            .orElseThrow();

        assertEquals(LocalDate.of(2025, 11, 5), recurring.getFirstRunDate());
        assertEquals(incoming.getId(), outgoing.getPairedTemplateId());
        assertEquals(outgoing.getId(), incoming.getPairedTemplateId());
        assertEquals(FlowType.OUTCOME, outgoing.getFlowType());
        assertEquals(FlowType.INCOME, incoming.getFlowType());
        assertEquals(accountB, incoming.getAccountId());
    }

    @Test
    @DisplayName("Recurring transfer with an end before its start is rejected")
    void recurringTransferInvalidSchedule() {
        LedgerException e = assertThrows(LedgerException.class, () ->
            pairingManager.createRecurringTransfer(ownerId, RecurringTransferCommand.builder()
                .fromAccountId(accountA)
                .toAccountId(accountB)
                .amount(amount("50.00"))
                .frequency(Frequency.WEEKLY)
                .interval(1)
                .startDate(LocalDate.of(2025, 11, 1))
                .endDate(LocalDate.of(2025, 10, 1))
                .build()));

        assertEquals(LedgerErrorCode.INVALID_SCHEDULE, e.getErrorCode());
    }

    private void assertPairSymmetric(UUID legId) {
        LedgerTransaction leg = transactionRepository.findOwned(ownerId, legId).orElseThrow();
        LedgerTransaction partner = transactionRepository.findOwned(ownerId, leg.getPairedTransactionId()).orElseThrow();
        assertEquals(leg.getId(), partner.getPairedTransactionId());
        assertEquals(0, leg.getAmount().compareTo(partner.getAmount()));
        assertEquals(leg.getDate(), partner.getDate());
        assertEquals(leg.getDescription(), partner.getDescription());
        assertEquals(leg.getFlowType().opposite(), partner.getFlowType());
    }
}
