package com.flagship.personal_ledger.reconcile;

import com.flagship.personal_ledger.account.Account;
import com.flagship.personal_ledger.account.AccountRepository;
import com.flagship.personal_ledger.budget.Budget;
import com.flagship.personal_ledger.budget.BudgetCycle;
import com.flagship.personal_ledger.budget.BudgetRepository;
import com.flagship.personal_ledger.common.exception.LedgerErrorCode;
import com.flagship.personal_ledger.common.exception.LedgerException;
import com.flagship.personal_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Recomputes the cached aggregates from the transaction set.
 *
 * This is the only writer of {@code accounts.cached_balance} and
 * {@code budgets.cached_consumption}. Every recompute is a pure function of the
 * current rows, so calling it redundantly is harmless. Mutating services call it
 * inside their own transaction; the sweep calls it once per owner.
 *
 * Balance: sum of live transaction amounts, income positive and outcome negative.
 * Consumption: sum of live outcome amounts whose category is linked to the budget
 * and whose date falls inside the window.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CacheReconciler {

    private final JdbcTemplate jdbcTemplate;
    private final AccountRepository accountRepository;
    private final BudgetRepository budgetRepository;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    /**
     * Recomputes and stores the balance of one of the owner's accounts, deleted ones included.
     *
     * @return the new cached balance
     * @throws LedgerException not_found if the account does not belong to the owner
     */
    @Transactional
    public BigDecimal recomputeAccountBalance(UUID ownerId, UUID accountId) {
        return recomputeAccountBalances(ownerId, List.of(accountId)).get(accountId);
    }

    /**
     * Recomputes several accounts of one write. All rows are locked, in id
     * order, before any sum is taken.
     *
     * @return new cached balance per account id
     * @throws LedgerException not_found if any account does not belong to the owner
     */
    @Transactional
    public Map<UUID, BigDecimal> recomputeAccountBalances(UUID ownerId, Collection<UUID> accountIds) {
        Set<UUID> distinct = new LinkedHashSet<>(accountIds);
        List<UUID> locked = accountRepository.lockOwned(ownerId, distinct);
        for (UUID accountId : distinct) {
            if (!locked.contains(accountId)) {
                throw LedgerException.notFound("Account", accountId);
            }
        }
        Map<UUID, BigDecimal> balances = new LinkedHashMap<>();
        for (UUID accountId : locked) {
            balances.put(accountId, storeBalance(ownerId, accountId));
        }
        return balances;
    }

    /**
     * Recomputes consumption of a budget over an explicit inclusive window.
     *
     * @return the new cached consumption
     * @throws LedgerException invalid_range if start is after end, not_found if the budget is not the owner's
     */
    @Transactional
    public BigDecimal recomputeBudgetConsumption(UUID ownerId, UUID budgetId, LocalDate periodStart, LocalDate periodEnd) {
        if (periodStart == null || periodEnd == null || periodStart.isAfter(periodEnd)) {
            throw new LedgerException(LedgerErrorCode.INVALID_RANGE,
                "Invalid period: start=" + periodStart + ", end=" + periodEnd);
        }
        if (budgetRepository.lockOwned(ownerId, List.of(budgetId)).isEmpty()) {
            throw LedgerException.notFound("Budget", budgetId);
        }
        return storeConsumption(ownerId, budgetId, periodStart, periodEnd);
    }

    /**
     * Recomputes a budget over the cycle that contains today.
     */
    @Transactional
    public BigDecimal recomputeBudget(UUID ownerId, UUID budgetId) {
        Budget budget = budgetRepository.findOwned(ownerId, budgetId)
            .orElseThrow(() -> LedgerException.notFound("Budget", budgetId));
        return recomputeCurrentCycle(budget);
    }

    /**
     * Recomputes every active budget linked to any of the categories.
     *
     * @return number of budgets recomputed
     */
    @Transactional
    public int recomputeBudgetsForCategories(UUID ownerId, Collection<UUID> categoryIds) {
        Set<UUID> distinct = new LinkedHashSet<>(categoryIds);
        List<Budget> budgets = budgetRepository.findActiveLinkedToCategories(ownerId, distinct);
        budgetRepository.lockOwned(ownerId, budgets.stream().map(Budget::getId).collect(Collectors.toList()));
        for (Budget budget : budgets) {
            recomputeCurrentCycle(budget);
        }
        return budgets.size();
    }

    /**
     * Recomputes every account and active budget of one owner and reports how
     * many cached values were stale.
     */
    @Transactional
    public ReconciliationReport reconcileOwner(UUID ownerId) {
        int corrections = 0;

        accountRepository.lockAllOwned(ownerId);
        List<Account> accounts = accountRepository.findActiveByOwner(ownerId);
        for (Account account : accounts) {
            BigDecimal recomputed = storeBalance(ownerId, account.getId());
            if (recomputed.compareTo(account.getCachedBalance()) != 0) {
                corrections++;
                ledgerMetrics.recordCorrection("account");
                log.warn("Stale account balance corrected: accountId={}, cached={}, actual={}",
                    account.getId(), account.getCachedBalance(), recomputed);
            }
        }

        List<Budget> budgets = budgetRepository.findActiveByOwner(ownerId);
        budgetRepository.lockOwned(ownerId, budgets.stream().map(Budget::getId).collect(Collectors.toList()));
        for (Budget budget : budgets) {
            BigDecimal recomputed = recomputeCurrentCycle(budget);
            if (recomputed.compareTo(budget.getCachedConsumption()) != 0) {
                corrections++;
                ledgerMetrics.recordCorrection("budget");
                log.info("Budget consumption refreshed: budgetId={}, cached={}, actual={}",
                    budget.getId(), budget.getCachedConsumption(), recomputed);
            }
        }

        return new ReconciliationReport(ownerId, accounts.size(), budgets.size(), corrections);
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    private BigDecimal recomputeCurrentCycle(Budget budget) {
        BudgetCycle.Window window = budget.currentWindow(today());
        return recomputeBudgetConsumption(budget.getOwnerId(), budget.getId(), window.getStart(), window.getEnd());
    }

    // Callers hold the account row lock, so this statement's snapshot starts after
    // every competing writer on the account has committed.
    private BigDecimal storeBalance(UUID ownerId, UUID accountId) {
        BigDecimal balance = jdbcTemplate.queryForObject(
            "UPDATE accounts SET cached_balance = (" +
            "  SELECT COALESCE(SUM(CASE WHEN t.flow_type = 'INCOME' THEN t.amount ELSE -t.amount END), 0) " +
            "  FROM transactions t WHERE t.account_id = accounts.id AND t.deleted_at IS NULL) " +
            "WHERE id = ? AND owner_id = ? RETURNING cached_balance",
            BigDecimal.class, accountId, ownerId
        );
        log.debug("Account balance recomputed: accountId={}, balance={}", accountId, balance);
        return balance;
    }

    private BigDecimal storeConsumption(UUID ownerId, UUID budgetId, LocalDate periodStart, LocalDate periodEnd) {
        BigDecimal consumption = jdbcTemplate.queryForObject(
            "UPDATE budgets SET cached_consumption = (" +
            "  SELECT COALESCE(SUM(t.amount), 0) FROM transactions t " +
            "  JOIN budget_categories bc ON bc.category_id = t.category_id AND bc.budget_id = budgets.id " +
            "  WHERE t.owner_id = budgets.owner_id AND t.flow_type = 'OUTCOME' AND t.deleted_at IS NULL " +
            "  AND t.transaction_date BETWEEN ? AND ?) " +
            "WHERE id = ? AND owner_id = ? RETURNING cached_consumption",
            BigDecimal.class, periodStart, periodEnd, budgetId, ownerId
        );
        log.debug("Budget consumption recomputed: budgetId={}, window=[{}, {}], consumption={}",
            budgetId, periodStart, periodEnd, consumption);
        return consumption;
    }
}
