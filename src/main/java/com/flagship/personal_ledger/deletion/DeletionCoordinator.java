package com.flagship.personal_ledger.deletion;

import com.flagship.personal_ledger.account.AccountRepository;
import com.flagship.personal_ledger.budget.Budget;
import com.flagship.personal_ledger.budget.BudgetRepository;
import com.flagship.personal_ledger.category.Category;
import com.flagship.personal_ledger.category.CategoryRepository;
import com.flagship.personal_ledger.common.exception.LedgerErrorCode;
import com.flagship.personal_ledger.common.exception.LedgerException;
import com.flagship.personal_ledger.invoice.Invoice;
import com.flagship.personal_ledger.invoice.InvoiceRepository;
import com.flagship.personal_ledger.invoice.InvoiceService;
import com.flagship.personal_ledger.observability.LedgerMetrics;
import com.flagship.personal_ledger.outbox.OutboxService;
import com.flagship.personal_ledger.outbox.event.AccountDeletedEvent;
import com.flagship.personal_ledger.reconcile.CacheReconciler;
import com.flagship.personal_ledger.recurring.RecurringTemplate;
import com.flagship.personal_ledger.recurring.RecurringTemplateRepository;
import com.flagship.personal_ledger.transaction.LedgerTransaction;
import com.flagship.personal_ledger.transaction.TransactionRepository;
import com.flagship.personal_ledger.transfer.PairingManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Deletes accounts, categories, invoices, recurring templates and budgets
 * without leaving dangling references behind.
 *
 * Each deletion is a single database transaction: references are re-pointed or
 * cleared first, the row is removed last, and the affected caches are
 * recomputed before commit. Pair references are only touched through the
 * {@link PairingManager}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeletionCoordinator {

    private static final String ACCOUNT_AGGREGATE = "Account";

    private final AccountRepository accountRepository;
    private final CategoryRepository categoryRepository;
    private final TransactionRepository transactionRepository;
    private final RecurringTemplateRepository templateRepository;
    private final BudgetRepository budgetRepository;
    private final InvoiceRepository invoiceRepository;
    private final InvoiceService invoiceService;
    private final PairingManager pairingManager;
    private final CacheReconciler cacheReconciler;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Moves every live transaction and template of the account to the target
     * account, then soft-deletes the account.
     *
     * @throws LedgerException not_found for the source, invalid_target for the target
     */
    @Transactional
    public AccountReassignResult deleteAccountReassign(UUID ownerId, UUID accountId, UUID targetAccountId) {
        accountRepository.findActiveOwned(ownerId, accountId)
            .orElseThrow(() -> LedgerException.notFound("Account", accountId));
        if (targetAccountId == null || targetAccountId.equals(accountId)) {
            throw new LedgerException(LedgerErrorCode.INVALID_TARGET,
                "Reassignment needs a different target account: " + targetAccountId);
        }
        accountRepository.findActiveOwned(ownerId, targetAccountId)
            .orElseThrow(() -> new LedgerException(LedgerErrorCode.INVALID_TARGET,
                "Target account not available: " + targetAccountId));

        accountRepository.lockOwned(ownerId, List.of(accountId, targetAccountId));
        int transactions = transactionRepository.reassignAccount(ownerId, accountId, targetAccountId);
        int templates = templateRepository.reassignAccount(ownerId, accountId, targetAccountId);
        Instant deletedAt = accountRepository.softDelete(ownerId, accountId);

        cacheReconciler.recomputeAccountBalances(ownerId, List.of(accountId, targetAccountId));

        outboxService.saveEvent(ACCOUNT_AGGREGATE,
            AccountDeletedEvent.reassigned(ownerId, accountId, targetAccountId, transactions, templates));
        ledgerMetrics.recordDeletion("account", "reassign");

        log.info("Account deleted with reassignment: accountId={}, targetAccountId={}, transactions={}, templates={}",
            accountId, targetAccountId, transactions, templates);
        return new AccountReassignResult(transactions, templates, true, deletedAt);
    }

    /**
     * Soft-deletes the account together with its live transactions and
     * templates. Transfer partners in other accounts survive, unpaired.
     *
     * @throws LedgerException not_found
     */
    @Transactional
    public AccountCascadeResult deleteAccountCascade(UUID ownerId, UUID accountId) {
        accountRepository.findActiveOwned(ownerId, accountId)
            .orElseThrow(() -> LedgerException.notFound("Account", accountId));

        List<UUID> templateIds = templateRepository.findLiveIdsByAccount(ownerId, accountId);
        int templatePairsDetached = pairingManager.detachTemplatePartners(ownerId, templateIds);
        templateRepository.softDeleteByIds(ownerId, templateIds);

        List<LedgerTransaction> transactions = transactionRepository.findActiveByAccount(ownerId, accountId);
        List<UUID> transactionIds = transactions.stream()
            .map(LedgerTransaction::getId)
            .collect(Collectors.toList());
        Set<UUID> categoryIds = transactions.stream()
            .map(LedgerTransaction::getCategoryId)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        int transactionPairsDetached = pairingManager.detachTransactionPartners(ownerId, transactionIds);
        int transactionsDeleted = transactionRepository.softDeleteByIds(ownerId, transactionIds);

        Instant deletedAt = accountRepository.softDelete(ownerId, accountId);

        cacheReconciler.recomputeAccountBalance(ownerId, accountId);
        cacheReconciler.recomputeBudgetsForCategories(ownerId, categoryIds);

        outboxService.saveEvent(ACCOUNT_AGGREGATE,
            AccountDeletedEvent.cascaded(ownerId, accountId, transactionsDeleted, templateIds.size()));
        ledgerMetrics.recordDeletion("account", "cascade");

        if (transactionPairsDetached > 0 || templatePairsDetached > 0) {
            log.warn("Account cascade left unpaired partners: accountId={}, transactionPartners={}, templatePartners={}",
                accountId, transactionPairsDetached, templatePairsDetached);
        }
        log.info("Account deleted with cascade: accountId={}, transactions={}, templates={}",
            accountId, transactionsDeleted, templateIds.size());
        return new AccountCascadeResult(transactionsDeleted, transactionPairsDetached, templateIds.size(),
            templatePairsDetached, true, deletedAt);
    }

    /**
     * Re-points everything in the category to a fallback of the same flow type,
     * removes its budget links and hard-deletes it.
     *
     * @param fallbackCategoryId optional; defaults to the system {@code general}
     *        category of the same flow type
     * @throws LedgerException not_found, system_category_immutable, invalid_target
     */
    @Transactional
    public CategoryDeletionResult deleteCategory(UUID ownerId, UUID categoryId, UUID fallbackCategoryId) {
        Category category = categoryRepository.findVisible(ownerId, categoryId)
            .orElseThrow(() -> LedgerException.notFound("Category", categoryId));
        if (category.isSystem()) {
            throw new LedgerException(LedgerErrorCode.SYSTEM_CATEGORY_IMMUTABLE,
                "System category cannot be deleted: " + category.getSystemKey().key());
        }
        Category fallback = resolveFallback(ownerId, category, fallbackCategoryId);

        List<UUID> affectedBudgets = budgetRepository.findActiveLinkedToCategories(ownerId, List.of(categoryId))
            .stream()
            .map(Budget::getId)
            .collect(Collectors.toList());

        int transactions = transactionRepository.reassignCategory(ownerId, categoryId, fallback.getId());
        int templates = templateRepository.reassignCategory(ownerId, categoryId, fallback.getId());
        int links = budgetRepository.deleteLinksForCategory(ownerId, categoryId);
        boolean deleted = categoryRepository.delete(ownerId, categoryId) > 0;

        for (UUID budgetId : affectedBudgets) {
            cacheReconciler.recomputeBudget(ownerId, budgetId);
        }
        cacheReconciler.recomputeBudgetsForCategories(ownerId, List.of(fallback.getId()));
        ledgerMetrics.recordDeletion("category", "reassign");

        log.info("Category deleted: categoryId={}, fallbackCategoryId={}, transactions={}, templates={}, budgetLinks={}",
            categoryId, fallback.getId(), transactions, templates, links);
        return new CategoryDeletionResult(transactions, templates, links, deleted);
    }

    /**
     * Detaches the invoice from its transactions and soft-deletes it. The stored
     * file is removed once the transaction commits.
     *
     * @throws LedgerException not_found
     */
    @Transactional
    public Instant deleteInvoice(UUID ownerId, UUID invoiceId) {
        Invoice invoice = invoiceRepository.findActiveOwned(ownerId, invoiceId)
            .orElseThrow(() -> LedgerException.notFound("Invoice", invoiceId));
        int detached = transactionRepository.clearInvoice(ownerId, invoiceId);
        Instant deletedAt = invoiceRepository.softDelete(ownerId, invoiceId);
        invoiceService.deleteFileAfterCommit(invoice);
        ledgerMetrics.recordDeletion("invoice", "soft");

        log.info("Invoice deleted: invoiceId={}, transactionsDetached={}", invoiceId, detached);
        return deletedAt;
    }

    /**
     * Soft-deletes a recurring template. With {@code alsoDeletePair} its
     * partner goes too; otherwise the partner is unlinked and keeps running on
     * its own. Transactions already materialized are left alone.
     *
     * @throws LedgerException not_found
     */
    @Transactional
    public TemplateDeletionResult deleteRecurringTemplate(UUID ownerId, UUID templateId, boolean alsoDeletePair) {
        RecurringTemplate template = templateRepository.findOwned(ownerId, templateId)
            .filter(found -> !found.isDeleted())
            .orElseThrow(() -> LedgerException.notFound("RecurringTemplate", templateId));

        Set<UUID> lockIds = new TreeSet<>();
        lockIds.add(templateId);
        if (template.getPairedTemplateId() != null) {
            lockIds.add(template.getPairedTemplateId());
        }
        List<RecurringTemplate> locked = templateRepository.lockOwned(ownerId, lockIds);
        Optional<RecurringTemplate> partner = locked.stream()
            .filter(row -> row.getId().equals(template.getPairedTemplateId()))
            .filter(row -> !row.isDeleted())
            .findFirst();

        Instant deletedAt;
        boolean pairDeleted = false;
        if (alsoDeletePair && partner.isPresent()) {
            List<UUID> pair = List.of(templateId, partner.get().getId());
            pairingManager.detachTemplatePartners(ownerId, pair);
            deletedAt = templateRepository.softDeleteByIds(ownerId, pair);
            pairDeleted = true;
        } else {
            pairingManager.unlinkTemplatePair(ownerId, templateId)
                .ifPresent(formerPartner -> log.info(
                    "Recurring partner continues standalone: templateId={}, partnerId={}", templateId, formerPartner));
            deletedAt = templateRepository.softDeleteByIds(ownerId, List.of(templateId));
        }
        ledgerMetrics.recordDeletion("recurring_template", pairDeleted ? "pair" : "single");

        log.info("Recurring template deleted: templateId={}, pairDeleted={}", templateId, pairDeleted);
        return new TemplateDeletionResult(deletedAt, pairDeleted);
    }

    /**
     * Removes the budget's category links, then deactivates and soft-deletes it.
     *
     * @throws LedgerException not_found
     */
    @Transactional
    public Instant deleteBudget(UUID ownerId, UUID budgetId) {
        budgetRepository.findLiveOwned(ownerId, budgetId)
            .orElseThrow(() -> LedgerException.notFound("Budget", budgetId));
        int links = budgetRepository.deleteLinksForBudget(ownerId, budgetId);
        Instant deletedAt = budgetRepository.softDelete(ownerId, budgetId);
        ledgerMetrics.recordDeletion("budget", "soft");

        log.info("Budget deleted: budgetId={}, linksRemoved={}", budgetId, links);
        return deletedAt;
    }

    private Category resolveFallback(UUID ownerId, Category category, UUID fallbackCategoryId) {
        if (fallbackCategoryId == null) {
            return categoryRepository.findSystem(Category.SystemCategoryKey.GENERAL, category.getFlowType());
        }
        if (fallbackCategoryId.equals(category.getId())) {
            throw new LedgerException(LedgerErrorCode.INVALID_TARGET,
                "Fallback category must differ from the deleted category");
        }
        Category fallback = categoryRepository.findVisible(ownerId, fallbackCategoryId)
            .orElseThrow(() -> new LedgerException(LedgerErrorCode.INVALID_TARGET,
                "Fallback category not available: " + fallbackCategoryId));
        if (fallback.getFlowType() != category.getFlowType()) {
            throw new LedgerException(LedgerErrorCode.INVALID_TARGET,
                "Fallback category " + fallbackCategoryId + " is " + fallback.getFlowType()
                    + " but the deleted category is " + category.getFlowType());
        }
        return fallback;
    }
}
