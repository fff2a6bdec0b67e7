package com.flagship.personal_ledger.reconcile;

import com.flagship.personal_ledger.LedgerIntegrationTestSupport;
import com.flagship.personal_ledger.budget.Budget;
import com.flagship.personal_ledger.budget.BudgetCommand;
import com.flagship.personal_ledger.budget.BudgetService;
import com.flagship.personal_ledger.common.FlowType;
import com.flagship.personal_ledger.common.exception.LedgerErrorCode;
import com.flagship.personal_ledger.common.exception.LedgerException;
import com.flagship.personal_ledger.transaction.TransactionCommand;
import com.flagship.personal_ledger.transaction.TransactionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cached balance and consumption always match a recomputation from the rows.
 */
class CacheReconcilerTest extends LedgerIntegrationTestSupport {

    @Autowired
    private CacheReconciler cacheReconciler;

    @Autowired
    private TransactionService transactionService;

    @Autowired
    private BudgetService budgetService;

    private UUID checking;
    private UUID salary;
    private UUID dining;
    private UUID travel;

    @BeforeEach
    void setUp() {
        checking = account("Checking");
        salary = category("Salary", FlowType.INCOME);
        dining = category("Dining", FlowType.OUTCOME);
        travel = category("Travel", FlowType.OUTCOME);
    }

    @Test
    @DisplayName("Balance is income minus outcome over live transactions")
    void balanceFromRows() {
        printTestHeader("Balance Recompute");

        record(salary, FlowType.INCOME, "3000.00", LocalDate.of(2025, 11, 1));
        record(dining, FlowType.OUTCOME, "45.50", LocalDate.of(2025, 11, 2));
        UUID deleted = record(dining, FlowType.OUTCOME, "100.00", LocalDate.of(2025, 11, 3));
        transactionService.delete(ownerId, deleted);

        // drift the cache on purpose
        jdbcTemplate.update("UPDATE accounts SET cached_balance = 1 WHERE id = ?", checking);

        BigDecimal balance = cacheReconciler.recomputeAccountBalance(ownerId, checking);
        printOutput("Balance", balance);

        assertEquals(0, amount("2954.50").compareTo(balance));
        assertEquals(0, balance.compareTo(storedBalance(checking)));
        printSuccess("Stale balance corrected");
    }

    @Test
    @DisplayName("Consumption counts linked outcome categories inside the window only")
    void consumptionOverWindow() {
        printTestHeader("Budget Consumption");

        Budget budget = budgetService.createBudget(ownerId, BudgetCommand.builder()
            .name("Going out")
            .limitAmount(amount("300.00"))
            .frequency(Budget.BudgetFrequency.ONCE)
            .interval(1)
            .startDate(LocalDate.of(2025, 11, 1))
            .endDate(LocalDate.of(2025, 11, 30))
            .categoryIds(List.of(dining))
            .build());

        record(dining, FlowType.OUTCOME, "20.00", LocalDate.of(2025, 11, 5));
        record(dining, FlowType.OUTCOME, "30.00", LocalDate.of(2025, 11, 30));
        record(dining, FlowType.OUTCOME, "99.00", LocalDate.of(2025, 12, 1));
        record(travel, FlowType.OUTCOME, "500.00", LocalDate.of(2025, 11, 10));
        record(salary, FlowType.INCOME, "1000.00", LocalDate.of(2025, 11, 10));

        printOutput("Cached consumption", storedConsumption(budget.getId()));
        assertEquals(0, amount("50.00").compareTo(storedConsumption(budget.getId())));

        BigDecimal explicit = cacheReconciler.recomputeBudgetConsumption(ownerId, budget.getId(),
            LocalDate.of(2025, 11, 1), LocalDate.of(2025, 12, 31));
        assertEquals(0, amount("149.00").compareTo(explicit));
        printSuccess("Only linked outcome rows in the window are counted");
    }

    @Test
    @DisplayName("An inverted window fails with invalid_range and a foreign budget with not_found")
    void invalidRangeAndOwnership() {
        Budget budget = budgetService.createBudget(ownerId, BudgetCommand.builder()
            .name("Any")
            .limitAmount(amount("10.00"))
            .frequency(Budget.BudgetFrequency.MONTHLY)
            .interval(1)
            .startDate(LocalDate.of(2025, 1, 1))
            .categoryIds(List.of(dining))
            .build());

        LedgerException range = assertThrows(LedgerException.class, () ->
            cacheReconciler.recomputeBudgetConsumption(ownerId, budget.getId(),
                LocalDate.of(2025, 2, 1), LocalDate.of(2025, 1, 1)));
        LedgerException foreign = assertThrows(LedgerException.class, () ->
            cacheReconciler.recomputeBudgetConsumption(UUID.randomUUID(), budget.getId(),
                LocalDate.of(2025, 1, 1), LocalDate.of(2025, 2, 1)));
        LedgerException account = assertThrows(LedgerException.class, () ->
            cacheReconciler.recomputeAccountBalance(UUID.randomUUID(), checking));

        assertEquals(LedgerErrorCode.INVALID_RANGE, range.getErrorCode());
        assertEquals(LedgerErrorCode.NOT_FOUND, foreign.getErrorCode());
        assertEquals(LedgerErrorCode.NOT_FOUND, account.getErrorCode());
    }

    @Test
    @DisplayName("Owner sweep reports and fixes drifted caches")
    void reconcileOwner() {
        record(salary, FlowType.INCOME, "10.00", LocalDate.of(2025, 11, 1));
        jdbcTemplate.update("UPDATE accounts SET cached_balance = 999 WHERE id = ?", checking);

        ReconciliationReport report = cacheReconciler.reconcileOwner(ownerId);
        printOutput("Report", report);

        assertEquals(1, report.getCorrections());
        assertEquals(0, amount("10.00").compareTo(storedBalance(checking)));
        assertEquals(0, cacheReconciler.reconcileOwner(ownerId).getCorrections());
    }

    private UUID record(UUID categoryId, FlowType flowType, String value, LocalDate date) {
        return transactionService.create(ownerId, TransactionCommand.builder()
            .accountId(checking)
            .categoryId(categoryId)
            .flowType(flowType)
            .amount(amount(value))
            .date(date)
            .build()).getId();
    }
}
