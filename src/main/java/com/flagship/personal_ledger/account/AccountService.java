package com.flagship.personal_ledger.account;

import com.flagship.personal_ledger.category.Category;
import com.flagship.personal_ledger.category.Category.SystemCategoryKey;
import com.flagship.personal_ledger.category.CategoryRepository;
import com.flagship.personal_ledger.common.FlowType;
import com.flagship.personal_ledger.common.exception.LedgerException;
import com.flagship.personal_ledger.reconcile.CacheReconciler;
import com.flagship.personal_ledger.transaction.LedgerTransaction.SystemGeneratedKey;
import com.flagship.personal_ledger.transaction.NewTransaction;
import com.flagship.personal_ledger.transaction.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Account creation and balance corrections.
 *
 * Balances are never written directly: an opening balance or a correction is
 * recorded as a system transaction and the reconciler derives the new cached
 * balance from it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private static final Pattern CURRENCY = Pattern.compile("^[A-Z]{3}$");

    private final AccountRepository accountRepository;
    private final CategoryRepository categoryRepository;
    private final TransactionRepository transactionRepository;
    private final CacheReconciler cacheReconciler;

    /**
     * @param initialBalance optional; a non-zero value is booked as an
     *        {@code initial_balance} transaction dated today
     */
    @Transactional
    public Account createAccount(UUID ownerId, String name, Account.AccountType type, String currency,
                                 BigDecimal initialBalance) {
        if (name == null || name.isBlank()) {
            throw LedgerException.invalidRequest("Account name is required");
        }
        if (type == null) {
            throw LedgerException.invalidRequest("Account type is required");
        }
        if (currency == null || !CURRENCY.matcher(currency).matches()) {
            throw LedgerException.invalidRequest("Currency must be a 3-letter ISO code: " + currency);
        }

        UUID accountId = accountRepository.insert(ownerId, name.trim(), type, currency);
        if (initialBalance != null && initialBalance.signum() != 0) {
            bookSystemTransaction(ownerId, accountId, SystemCategoryKey.INITIAL_BALANCE,
                SystemGeneratedKey.INITIAL_BALANCE, initialBalance, cacheReconciler.today());
        }
        cacheReconciler.recomputeAccountBalance(ownerId, accountId);

        log.info("Account created: accountId={}, type={}, currency={}, initialBalance={}",
            accountId, type, currency, initialBalance);
        return getAccount(ownerId, accountId);
    }

    /**
     * Books the difference between the current and the target balance as a
     * {@code balance_update} transaction. Nothing is written when they match.
     */
    @Transactional
    public Account adjustBalance(UUID ownerId, UUID accountId, BigDecimal targetBalance, LocalDate date) {
        if (targetBalance == null) {
            throw LedgerException.invalidRequest("Target balance is required");
        }
        accountRepository.findActiveOwned(ownerId, accountId)
            .orElseThrow(() -> LedgerException.notFound("Account", accountId));

        BigDecimal current = cacheReconciler.recomputeAccountBalance(ownerId, accountId);
        BigDecimal delta = targetBalance.subtract(current);
        if (delta.signum() == 0) {
            log.debug("Balance already at target: accountId={}, balance={}", accountId, current);
            return getAccount(ownerId, accountId);
        }

        bookSystemTransaction(ownerId, accountId, SystemCategoryKey.BALANCE_UPDATE,
            SystemGeneratedKey.BALANCE_UPDATE, delta, date != null ? date : cacheReconciler.today());
        cacheReconciler.recomputeAccountBalance(ownerId, accountId);

        log.info("Balance adjusted: accountId={}, from={}, to={}, delta={}", accountId, current, targetBalance, delta);
        return getAccount(ownerId, accountId);
    }

    @Transactional(readOnly = true)
    public Account getAccount(UUID ownerId, UUID accountId) {
        return accountRepository.findOwned(ownerId, accountId)
            .orElseThrow(() -> LedgerException.notFound("Account", accountId));
    }

    private void bookSystemTransaction(UUID ownerId, UUID accountId, SystemCategoryKey categoryKey,
                                       SystemGeneratedKey generatedKey, BigDecimal signedAmount, LocalDate date) {
        FlowType flowType = FlowType.forDelta(signedAmount);
        Category category = categoryRepository.findSystem(categoryKey, flowType);
        transactionRepository.insert(NewTransaction.builder()
            .ownerId(ownerId)
            .accountId(accountId)
            .categoryId(category.getId())
            .flowType(flowType)
            .amount(signedAmount.abs())
            .date(date)
            .systemGeneratedKey(generatedKey)
            .build());
        cacheReconciler.recomputeBudgetsForCategories(ownerId, List.of(category.getId()));
    }
}
