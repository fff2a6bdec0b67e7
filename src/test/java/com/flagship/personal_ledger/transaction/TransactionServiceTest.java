package com.flagship.personal_ledger.transaction;

import com.flagship.personal_ledger.LedgerIntegrationTestSupport;
import com.flagship.personal_ledger.category.Category;
import com.flagship.personal_ledger.common.FlowType;
import com.flagship.personal_ledger.common.exception.LedgerErrorCode;
import com.flagship.personal_ledger.common.exception.LedgerException;
import com.flagship.personal_ledger.transfer.PairingManager;
import com.flagship.personal_ledger.transfer.Transfer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TransactionServiceTest extends LedgerIntegrationTestSupport {

    private static final LocalDate DAY = LocalDate.of(2025, 11, 3);

    @Autowired
    private TransactionService transactionService;

    @Autowired
    private PairingManager pairingManager;

    private UUID checking;
    private UUID rent;
    private UUID utilities;

    @BeforeEach
    void setUp() {
        checking = account("Checking", "1000.00");
        rent = category("Rent", FlowType.OUTCOME);
        utilities = category("Utilities", FlowType.OUTCOME);
    }

    @Test
    @DisplayName("Create, update and delete keep the balance in step")
    void lifecycle() {
        printTestHeader("Transaction Lifecycle");

        LedgerTransaction created = transactionService.create(ownerId, TransactionCommand.builder()
            .accountId(checking)
            .categoryId(rent)
            .flowType(FlowType.OUTCOME)
            .amount(amount("700.00"))
            .date(DAY)
            .description("November rent")
            .build());
        assertEquals(0, amount("300.00").compareTo(storedBalance(checking)));

        LedgerTransaction updated = transactionService.update(ownerId, created.getId(), amount("650.00"), null, null,
            utilities);
        printOutput("Updated", updated);
        assertEquals(0, amount("650.00").compareTo(updated.getAmount()));
        assertEquals(utilities, updated.getCategoryId());
        assertEquals("November rent", updated.getDescription());
        assertEquals(0, amount("350.00").compareTo(storedBalance(checking)));

        transactionService.delete(ownerId, created.getId());
        assertTrue(transactionService.getTransaction(ownerId, created.getId()).isDeleted());
        assertEquals(0, amount("1000.00").compareTo(storedBalance(checking)));
        printSuccess("Balance followed every change");
    }

    @Test
    @DisplayName("Category flow type must match the transaction")
    void flowMismatch() {
        UUID salary = category("Salary", FlowType.INCOME);

        LedgerException e = assertThrows(LedgerException.class, () ->
            transactionService.create(ownerId, TransactionCommand.builder()
                .accountId(checking)
                .categoryId(salary)
                .flowType(FlowType.OUTCOME)
                .amount(amount("1.00"))
                .date(DAY)
                .build()));

        assertEquals(LedgerErrorCode.INVALID_REQUEST, e.getErrorCode());
    }

    @Test
    @DisplayName("Another owner's category and the transfer category are refused")
    void categoryGuards() {
        UUID foreignCategory = categoryService.createCategory(UUID.randomUUID(), "Theirs", FlowType.OUTCOME).getId();
        UUID transferCategory = systemCategory(Category.SystemCategoryKey.TRANSFER, FlowType.OUTCOME).getId();

        LedgerException foreign = assertThrows(LedgerException.class, () ->
            transactionService.create(ownerId, TransactionCommand.builder()
                .accountId(checking).categoryId(foreignCategory).flowType(FlowType.OUTCOME)
                .amount(amount("1.00")).date(DAY).build()));
        LedgerException transfer = assertThrows(LedgerException.class, () ->
            transactionService.create(ownerId, TransactionCommand.builder()
                .accountId(checking).categoryId(transferCategory).flowType(FlowType.OUTCOME)
                .amount(amount("1.00")).date(DAY).build()));

        assertEquals(LedgerErrorCode.NOT_FOUND, foreign.getErrorCode());
        assertEquals(LedgerErrorCode.INVALID_REQUEST, transfer.getErrorCode());
    }

    @Test
    @DisplayName("Transfer legs cannot be edited or deleted as plain transactions")
    void transferLegsAreImmutable() {
        printTestHeader("Transfer Leg Immutable");

        UUID savings = account("Savings");
        Transfer transfer = pairingManager.createTransfer(ownerId, checking, savings, amount("50.00"), DAY, null, null);
        UUID legId = transfer.getOutgoing().getId();

        LedgerException update = assertThrows(LedgerException.class, () ->
            transactionService.update(ownerId, legId, amount("60.00"), null, null, null));
        LedgerException delete = assertThrows(LedgerException.class, () ->
            transactionService.delete(ownerId, legId));

        printExpectedException(update.getErrorCode().code(), update.getMessage());
        assertEquals(LedgerErrorCode.TRANSFER_LEG_IMMUTABLE, update.getErrorCode());
        assertEquals(LedgerErrorCode.TRANSFER_LEG_IMMUTABLE, delete.getErrorCode());
        assertEquals(0, amount("50.00").compareTo(
            transactionService.getTransaction(ownerId, legId).getAmount()));
    }
}
