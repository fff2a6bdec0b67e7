package com.flagship.personal_ledger.transaction;

import com.flagship.personal_ledger.account.AccountRepository;
import com.flagship.personal_ledger.category.Category;
import com.flagship.personal_ledger.category.CategoryRepository;
import com.flagship.personal_ledger.common.exception.LedgerErrorCode;
import com.flagship.personal_ledger.common.exception.LedgerException;
import com.flagship.personal_ledger.invoice.InvoiceRepository;
import com.flagship.personal_ledger.reconcile.CacheReconciler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Single, unpaired transactions. Transfer legs are refused here and handled by
 * the pairing manager.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    private final TransactionRepository transactionRepository;
    private final AccountRepository accountRepository;
    private final CategoryRepository categoryRepository;
    private final InvoiceRepository invoiceRepository;
    private final CacheReconciler cacheReconciler;

    /**
     * Records a transaction. A transaction booked from an invoice is marked
     * {@code invoice_ocr}.
     *
     * @throws LedgerException not_found for a foreign account, category or
     *         invoice; invalid_request for a flow mismatch or the transfer category
     */
    @Transactional
    public LedgerTransaction create(UUID ownerId, TransactionCommand command) {
        if (command.getAmount() == null || command.getAmount().signum() < 0) {
            throw LedgerException.invalidRequest("Amount must not be negative");
        }
        if (command.getDate() == null) {
            throw LedgerException.invalidRequest("Transaction date is required");
        }
        accountRepository.findActiveOwned(ownerId, command.getAccountId())
            .orElseThrow(() -> LedgerException.notFound("Account", command.getAccountId()));
        Category category = requireUsableCategory(ownerId, command.getCategoryId());
        if (category.getFlowType() != command.getFlowType()) {
            throw LedgerException.invalidRequest("Category " + category.getId() + " is " + category.getFlowType()
                + " but the transaction is " + command.getFlowType());
        }
        if (command.getInvoiceId() != null) {
            invoiceRepository.findActiveOwned(ownerId, command.getInvoiceId())
                .orElseThrow(() -> LedgerException.notFound("Invoice", command.getInvoiceId()));
        }

        UUID id = transactionRepository.insert(NewTransaction.builder()
            .ownerId(ownerId)
            .accountId(command.getAccountId())
            .categoryId(category.getId())
            .flowType(command.getFlowType())
            .amount(command.getAmount())
            .date(command.getDate())
            .description(command.getDescription())
            .invoiceId(command.getInvoiceId())
            .systemGeneratedKey(command.getInvoiceId() != null ? LedgerTransaction.SystemGeneratedKey.INVOICE_OCR : null)
            .build());

        cacheReconciler.recomputeAccountBalance(ownerId, command.getAccountId());
        cacheReconciler.recomputeBudgetsForCategories(ownerId, Set.of(category.getId()));

        log.info("Transaction created: transactionId={}, flowType={}, amount={}", id, command.getFlowType(),
            command.getAmount());
        return getTransaction(ownerId, id);
    }

    /**
     * Partial edit of an unpaired transaction; null fields are kept. The flow
     * type and account are fixed, a new category must have the same flow type.
     *
     * @throws LedgerException not_found, transfer_leg_immutable, invalid_request
     */
    @Transactional
    public LedgerTransaction update(UUID ownerId, UUID transactionId, BigDecimal amount, LocalDate date,
                                    String description, UUID categoryId) {
        LedgerTransaction existing = requireEditable(ownerId, transactionId);
        if (amount != null && amount.signum() < 0) {
            throw LedgerException.invalidRequest("Amount must not be negative");
        }
        if (categoryId != null) {
            Category category = requireUsableCategory(ownerId, categoryId);
            if (category.getFlowType() != existing.getFlowType()) {
                throw LedgerException.invalidRequest("Category " + categoryId + " is " + category.getFlowType()
                    + " but the transaction is " + existing.getFlowType());
            }
        }

        int updated = transactionRepository.updateUnpaired(ownerId, transactionId, amount, date, description, categoryId);
        if (updated == 0) {
            throw transferLegImmutable(transactionId);
        }

        Set<UUID> categories = new LinkedHashSet<>();
        categories.add(existing.getCategoryId());
        if (categoryId != null) {
            categories.add(categoryId);
        }
        cacheReconciler.recomputeAccountBalance(ownerId, existing.getAccountId());
        cacheReconciler.recomputeBudgetsForCategories(ownerId, categories);

        log.info("Transaction updated: transactionId={}", transactionId);
        return getTransaction(ownerId, transactionId);
    }

    /**
     * @throws LedgerException not_found, transfer_leg_immutable
     */
    @Transactional
    public void delete(UUID ownerId, UUID transactionId) {
        LedgerTransaction existing = requireEditable(ownerId, transactionId);
        if (transactionRepository.softDeleteUnpaired(ownerId, transactionId) == 0) {
            throw transferLegImmutable(transactionId);
        }
        cacheReconciler.recomputeAccountBalance(ownerId, existing.getAccountId());
        cacheReconciler.recomputeBudgetsForCategories(ownerId, Set.of(existing.getCategoryId()));
        log.info("Transaction deleted: transactionId={}", transactionId);
    }

    @Transactional(readOnly = true)
    public LedgerTransaction getTransaction(UUID ownerId, UUID transactionId) {
        return transactionRepository.findOwned(ownerId, transactionId)
            .orElseThrow(() -> LedgerException.notFound("Transaction", transactionId));
    }

    private LedgerTransaction requireEditable(UUID ownerId, UUID transactionId) {
        LedgerTransaction existing = transactionRepository.findActiveOwned(ownerId, transactionId)
            .orElseThrow(() -> LedgerException.notFound("Transaction", transactionId));
        if (existing.isPaired()) {
            throw transferLegImmutable(transactionId);
        }
        return existing;
    }

    private Category requireUsableCategory(UUID ownerId, UUID categoryId) {
        Category category = categoryRepository.findVisible(ownerId, categoryId)
            .orElseThrow(() -> LedgerException.notFound("Category", categoryId));
        if (category.getSystemKey() == Category.SystemCategoryKey.TRANSFER) {
            throw LedgerException.invalidRequest("The transfer category is reserved for transfers");
        }
        return category;
    }

    private static LedgerException transferLegImmutable(UUID transactionId) {
        return new LedgerException(LedgerErrorCode.TRANSFER_LEG_IMMUTABLE,
            "Transaction " + transactionId + " is a transfer leg; edit or delete it as a transfer");
    }
}
