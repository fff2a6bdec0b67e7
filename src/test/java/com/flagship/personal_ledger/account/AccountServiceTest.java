package com.flagship.personal_ledger.account;

import com.flagship.personal_ledger.LedgerIntegrationTestSupport;
import com.flagship.personal_ledger.category.Category;
import com.flagship.personal_ledger.common.FlowType;
import com.flagship.personal_ledger.common.exception.LedgerErrorCode;
import com.flagship.personal_ledger.common.exception.LedgerException;
import com.flagship.personal_ledger.transaction.LedgerTransaction;
import com.flagship.personal_ledger.transaction.TransactionRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AccountServiceTest extends LedgerIntegrationTestSupport {

    @Autowired
    private TransactionRepository transactionRepository;

    @Test
    @DisplayName("Initial balance is booked as a system transaction")
    void initialBalance() {
        UUID accountId = account("Wallet", "250.00");

        List<LedgerTransaction> rows = transactionRepository.findActiveByAccount(ownerId, accountId);

        assertEquals(1, rows.size());
        assertEquals(LedgerTransaction.SystemGeneratedKey.INITIAL_BALANCE, rows.get(0).getSystemGeneratedKey());
        assertEquals(systemCategory(Category.SystemCategoryKey.INITIAL_BALANCE, FlowType.INCOME).getId(),
            rows.get(0).getCategoryId());
        assertEquals(0, amount("250.00").compareTo(storedBalance(accountId)));
    }

    @Test
    @DisplayName("Balance adjustment books the difference with the flow of its sign")
    void adjustBalance() {
        printTestHeader("Balance Adjustment");

        UUID accountId = account("Wallet", "250.00");

        Account lowered = accountService.adjustBalance(ownerId, accountId, amount("200.00"), LocalDate.of(2025, 11, 3));
        printOutput("Balance", lowered.getCachedBalance());
        Account unchanged = accountService.adjustBalance(ownerId, accountId, amount("200.00"), LocalDate.of(2025, 11, 4));

        assertEquals(0, amount("200.00").compareTo(lowered.getCachedBalance()));
        assertEquals(0, amount("200.00").compareTo(unchanged.getCachedBalance()));
        List<LedgerTransaction> rows = transactionRepository.findActiveByAccount(ownerId, accountId);
        assertEquals(2, rows.size());
        LedgerTransaction adjustment = rows.stream()
            .filter(row -> row.getSystemGeneratedKey() == LedgerTransaction.SystemGeneratedKey.BALANCE_UPDATE)
            .findFirst()
            .orElseThrow();
        assertEquals(FlowType.OUTCOME, adjustment.getFlowType());
        assertEquals(0, amount("50.00").compareTo(adjustment.getAmount()));
        printSuccess("Only the difference was booked");
    }

    @Test
    @DisplayName("Currency must be a three-letter code")
    void invalidCurrency() {
        LedgerException e = assertThrows(LedgerException.class, () ->
            accountService.createAccount(ownerId, "Wallet", Account.AccountType.CASH, "euro", null));

        assertEquals(LedgerErrorCode.INVALID_REQUEST, e.getErrorCode());
    }
}
