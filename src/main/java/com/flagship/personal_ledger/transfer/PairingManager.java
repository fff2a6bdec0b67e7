package com.flagship.personal_ledger.transfer;

import com.flagship.personal_ledger.account.Account;
import com.flagship.personal_ledger.account.AccountRepository;
import com.flagship.personal_ledger.category.Category;
import com.flagship.personal_ledger.category.Category.SystemCategoryKey;
import com.flagship.personal_ledger.category.CategoryRepository;
import com.flagship.personal_ledger.common.FlowType;
import com.flagship.personal_ledger.common.exception.LedgerErrorCode;
import com.flagship.personal_ledger.common.exception.LedgerException;
import com.flagship.personal_ledger.observability.LedgerMetrics;
import com.flagship.personal_ledger.outbox.OutboxService;
import com.flagship.personal_ledger.outbox.event.TransferCreatedEvent;
import com.flagship.personal_ledger.outbox.event.TransferDeletedEvent;
import com.flagship.personal_ledger.outbox.event.TransferUpdatedEvent;
import com.flagship.personal_ledger.reconcile.CacheReconciler;
import com.flagship.personal_ledger.recurring.NewTemplate;
import com.flagship.personal_ledger.recurring.RecurrenceRule;
import com.flagship.personal_ledger.recurring.RecurringTemplate;
import com.flagship.personal_ledger.recurring.RecurringTemplateRepository;
import com.flagship.personal_ledger.transaction.LedgerTransaction;
import com.flagship.personal_ledger.transaction.NewTransaction;
import com.flagship.personal_ledger.transaction.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Creates, edits and deletes two linked rows as one unit: the outgoing and
 * incoming legs of a transfer, or the two templates of a recurring transfer.
 *
 * No other component writes the pair columns; the materializer and the
 * deletion coordinator use the primitives at the bottom of this class.
 *
 * Edits lock both legs in id order before checking the pair, so concurrent
 * edits of the same transfer serialize on the row locks. A pair whose partner
 * is missing or does not point back is refused for edits and deleted leg by
 * leg with an {@code orphan_pair} warning.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PairingManager {

    public static final String TRANSFER_AGGREGATE = "Transfer";
    public static final String ORPHAN_PAIR_WARNING = LedgerErrorCode.ORPHAN_PAIR.code();

    private final AccountRepository accountRepository;
    private final CategoryRepository categoryRepository;
    private final TransactionRepository transactionRepository;
    private final RecurringTemplateRepository templateRepository;
    private final PairedRowStore pairedRowStore;
    private final IdempotencyService idempotencyService;
    private final CacheReconciler cacheReconciler;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Writes both legs of a transfer and links them.
     *
     * @param idempotencyKey optional; a key the owner already used returns the earlier transfer
     * @throws LedgerException invalid_accounts when the accounts are equal or not live accounts of the owner
     */
    @Transactional
    public Transfer createTransfer(UUID ownerId, UUID fromAccountId, UUID toAccountId, BigDecimal amount,
                                   LocalDate date, String description, String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        try {
            if (idempotencyKey != null && !idempotencyKey.isBlank()) {
                Optional<UUID> existingLeg = idempotencyService.findTransferLeg(ownerId, idempotencyKey);
                if (existingLeg.isPresent()) {
                    ledgerMetrics.recordIdempotencyHit();
                    log.info("Idempotency key already used, returning existing transfer: legId={}", existingLeg.get());
                    ledgerMetrics.recordTransfer("create", "replayed");
                    return loadTransfer(ownerId, existingLeg.get(), true);
                }
                ledgerMetrics.recordIdempotencyMiss();
            }

            requirePositive(amount);
            if (date == null) {
                throw LedgerException.invalidRequest("Transfer date is required");
            }
            Account from = requireTransferAccounts(ownerId, fromAccountId, toAccountId);

            Category outgoingCategory = categoryRepository.findSystem(SystemCategoryKey.TRANSFER, FlowType.OUTCOME);
            Category incomingCategory = categoryRepository.findSystem(SystemCategoryKey.TRANSFER, FlowType.INCOME);

            UUID outgoingId = transactionRepository.insert(NewTransaction.builder()
                .ownerId(ownerId)
                .accountId(from.getId())
                .categoryId(outgoingCategory.getId())
                .flowType(FlowType.OUTCOME)
                .amount(amount)
                .date(date)
                .description(description)
                .idempotencyKey(blankToNull(idempotencyKey))
                .build());
            UUID incomingId = transactionRepository.insert(NewTransaction.builder()
                .ownerId(ownerId)
                .accountId(toAccountId)
                .categoryId(incomingCategory.getId())
                .flowType(FlowType.INCOME)
                .amount(amount)
                .date(date)
                .description(description)
                .build());
            pairedRowStore.linkTransactions(ownerId, outgoingId, incomingId);

            cacheReconciler.recomputeAccountBalances(ownerId, List.of(fromAccountId, toAccountId));
            cacheReconciler.recomputeBudgetsForCategories(ownerId,
                List.of(outgoingCategory.getId(), incomingCategory.getId()));

            outboxService.saveEvent(TRANSFER_AGGREGATE, TransferCreatedEvent.of(
                ownerId, outgoingId, incomingId, fromAccountId, toAccountId, amount, date));

            if (idempotencyKey != null && !idempotencyKey.isBlank()) {
                idempotencyService.rememberAfterCommit(ownerId, idempotencyKey, outgoingId);
            }

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordTransfer("create", "success");
            log.info("Transfer created: outgoingId={}, incomingId={}, amount={}, date={}, duration={}ms",
                outgoingId, incomingId, amount, date, duration);

            return loadTransfer(ownerId, outgoingId, false);
        } catch (RuntimeException e) {
            ledgerMetrics.recordTransfer("create", "error");
            throw e;
        }
    }

    /**
     * Applies the same amount, date and description change to both legs.
     * Null fields are left unchanged; account, category and flow type are fixed.
     *
     * @throws LedgerException not_found, not_a_transfer, or orphan_pair when the partner is broken
     */
    @Transactional
    public Transfer updateTransfer(UUID ownerId, UUID legId, BigDecimal amount, LocalDate date, String description) {
        try {
            if (amount != null) {
                requirePositive(amount);
            }
            LedgerTransaction[] pair = lockIntactPair(ownerId, legId);
            LedgerTransaction leg = pair[0];
            LedgerTransaction partner = pair[1];

            pairedRowStore.updateLegs(ownerId, List.of(leg.getId(), partner.getId()), amount, date, description);

            Transfer updated = loadTransfer(ownerId, leg.getId(), false);
            cacheReconciler.recomputeAccountBalances(ownerId, List.of(leg.getAccountId(), partner.getAccountId()));
            cacheReconciler.recomputeBudgetsForCategories(ownerId, List.of(leg.getCategoryId(), partner.getCategoryId()));

            outboxService.saveEvent(TRANSFER_AGGREGATE, TransferUpdatedEvent.of(ownerId,
                updated.getOutgoing().getId(), updated.getIncoming().getId(),
                updated.getOutgoing().getAmount(), updated.getOutgoing().getDate(),
                updated.getOutgoing().getDescription()));

            ledgerMetrics.recordTransfer("update", "success");
            log.info("Transfer updated: outgoingId={}, incomingId={}",
                updated.getOutgoing().getId(), updated.getIncoming().getId());
            return updated;
        } catch (RuntimeException e) {
            ledgerMetrics.recordTransfer("update", "error");
            throw e;
        }
    }

    /**
     * Soft-deletes both legs. When the partner is gone or no longer points back,
     * the requested leg is deleted alone, every dangling reference to it is
     * cleared and the result carries an {@code orphan_pair} warning.
     *
     * @throws LedgerException not_found, not_a_transfer
     */
    @Transactional
    public TransferDeletion deleteTransfer(UUID ownerId, UUID legId) {
        try {
            LedgerTransaction leg = requirePairedLeg(ownerId, legId);
            List<LedgerTransaction> locked = transactionRepository.lockOwned(ownerId,
                List.of(leg.getId(), leg.getPairedTransactionId()));
            leg = find(locked, legId)
                .filter(row -> !row.isDeleted())
                .orElseThrow(() -> LedgerException.notFound("Transaction", legId));
            LedgerTransaction partner = leg.isPaired() ? find(locked, leg.getPairedTransactionId()).orElse(null) : null;

            Set<UUID> accountIds = new LinkedHashSet<>();
            accountIds.add(leg.getAccountId());
            Set<UUID> categoryIds = new LinkedHashSet<>();
            categoryIds.add(leg.getCategoryId());
            TransferDeletion result;

            if (isIntactPartner(leg, partner)) {
                pairedRowStore.softDeleteLegs(ownerId, List.of(leg.getId(), partner.getId()));
                accountIds.add(partner.getAccountId());
                categoryIds.add(partner.getCategoryId());
                result = new TransferDeletion(2, null);
                log.info("Transfer deleted: legId={}, partnerId={}", leg.getId(), partner.getId());
            } else {
                pairedRowStore.softDeleteLegs(ownerId, List.of(leg.getId()));
                int healed = pairedRowStore.clearTransactionRefsPointingTo(ownerId, List.of(leg.getId()));
                result = new TransferDeletion(1, ORPHAN_PAIR_WARNING);
                log.warn("Orphan transfer leg deleted alone: legId={}, missingPartnerId={}, danglingRefsCleared={}",
                    leg.getId(), leg.getPairedTransactionId(), healed);
            }

            cacheReconciler.recomputeAccountBalances(ownerId, accountIds);
            cacheReconciler.recomputeBudgetsForCategories(ownerId, categoryIds);

            outboxService.saveEvent(TRANSFER_AGGREGATE,
                TransferDeletedEvent.of(ownerId, legId, result.getLegsRemoved(), result.isOrphan()));
            ledgerMetrics.recordTransfer("delete", result.isOrphan() ? "orphan" : "success");
            return result;
        } catch (RuntimeException e) {
            ledgerMetrics.recordTransfer("delete", "error");
            throw e;
        }
    }

    /**
     * Creates the two templates of a recurring transfer and links them. Both
     * start at the first occurrence on or after the start date.
     *
     * @throws LedgerException invalid_accounts, invalid_schedule
     */
    @Transactional
    public RecurringTransfer createRecurringTransfer(UUID ownerId, RecurringTransferCommand command) {
        requirePositive(command.getAmount());
        Account from = requireTransferAccounts(ownerId, command.getFromAccountId(), command.getToAccountId());

        RecurrenceRule rule = new RecurrenceRule(command.getFrequency(), command.getInterval(),
            command.getByWeekday(), command.getByMonthday(), command.getStartDate());
        rule.validate();
        LocalDate endDate = command.getEndDate();
        if (endDate != null && endDate.isBefore(command.getStartDate())) {
            throw new LedgerException(LedgerErrorCode.INVALID_SCHEDULE,
                "Invalid schedule: end date " + endDate + " is before start date " + command.getStartDate());
        }
        LocalDate firstRun = rule.nextOnOrAfter(command.getStartDate());
        if (endDate != null && firstRun.isAfter(endDate)) {
            throw new LedgerException(LedgerErrorCode.INVALID_SCHEDULE,
                "Invalid schedule: no occurrence between " + command.getStartDate() + " and " + endDate);
        }

        Category outgoingCategory = categoryRepository.findSystem(SystemCategoryKey.TRANSFER, FlowType.OUTCOME);
        Category incomingCategory = categoryRepository.findSystem(SystemCategoryKey.TRANSFER, FlowType.INCOME);

        UUID outgoingId = templateRepository.insert(transferTemplate(ownerId, from.getId(), outgoingCategory,
            FlowType.OUTCOME, command, rule, firstRun));
        UUID incomingId = templateRepository.insert(transferTemplate(ownerId, command.getToAccountId(),
            incomingCategory, FlowType.INCOME, command, rule, firstRun));
        pairedRowStore.linkTemplates(ownerId, outgoingId, incomingId);

        ledgerMetrics.recordTransfer("create_recurring", "success");
        log.info("Recurring transfer created: outgoingTemplateId={}, incomingTemplateId={}, frequency={}, firstRun={}",
            outgoingId, incomingId, command.getFrequency(), firstRun);
        return new RecurringTransfer(outgoingId, incomingId, firstRun);
    }

    /**
     * Links two freshly materialized legs. Runs inside the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void linkMaterializedLegs(UUID ownerId, UUID outgoingId, UUID incomingId) {
        pairedRowStore.linkTransactions(ownerId, outgoingId, incomingId);
    }

    /**
     * Detaches transactions that are about to be deleted from their partners:
     * partners outside the set lose their reference, and the rows themselves
     * drop theirs.
     *
     * @return number of partner rows detached
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int detachTransactionPartners(UUID ownerId, Collection<UUID> transactionIds) {
        if (transactionIds.isEmpty()) {
            return 0;
        }
        int detached = pairedRowStore.clearTransactionRefsPointingTo(ownerId, transactionIds);
        pairedRowStore.clearTransactionRefs(ownerId, transactionIds);
        if (detached > 0) {
            log.info("Detached {} transfer partner(s) of rows being deleted", detached);
        }
        return detached;
    }

    /**
     * Template counterpart of {@link #detachTransactionPartners}.
     *
     * @return number of partner templates detached
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int detachTemplatePartners(UUID ownerId, Collection<UUID> templateIds) {
        if (templateIds.isEmpty()) {
            return 0;
        }
        int detached = pairedRowStore.clearTemplateRefsPointingTo(ownerId, templateIds);
        pairedRowStore.clearTemplateRefs(ownerId, templateIds);
        if (detached > 0) {
            log.info("Detached {} recurring transfer partner(s) of templates being deleted", detached);
        }
        return detached;
    }

    /**
     * Breaks the link between a template and its partner, in both directions.
     *
     * @return the former partner id, if the template was paired
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<UUID> unlinkTemplatePair(UUID ownerId, UUID templateId) {
        Optional<UUID> partnerId = templateRepository.findOwned(ownerId, templateId)
            .map(RecurringTemplate::getPairedTemplateId);
        pairedRowStore.clearTemplateRefsPointingTo(ownerId, List.of(templateId));
        pairedRowStore.clearTemplateRefs(ownerId, List.of(templateId));
        return partnerId;
    }

    /**
     * Both legs of the transfer containing {@code legId}, deleted legs included.
     */
    @Transactional(readOnly = true)
    public Transfer getTransfer(UUID ownerId, UUID legId) {
        return loadTransfer(ownerId, legId, false);
    }

    private Transfer loadTransfer(UUID ownerId, UUID legId, boolean replayed) {
        LedgerTransaction leg = transactionRepository.findOwned(ownerId, legId)
            .orElseThrow(() -> LedgerException.notFound("Transaction", legId));
        if (!leg.isPaired()) {
            throw new LedgerException(LedgerErrorCode.NOT_A_TRANSFER, "Transaction is not a transfer leg: " + legId);
        }
        LedgerTransaction partner = transactionRepository.findOwned(ownerId, leg.getPairedTransactionId())
            .orElseThrow(() -> new LedgerException(LedgerErrorCode.ORPHAN_PAIR,
                "Transfer partner missing for leg " + legId));
        return leg.getFlowType() == FlowType.OUTCOME
            ? new Transfer(leg, partner, replayed)
            : new Transfer(partner, leg, replayed);
    }

    /**
     * Locks both legs and returns {leg, partner}, or fails with orphan_pair.
     */
    private LedgerTransaction[] lockIntactPair(UUID ownerId, UUID legId) {
        LedgerTransaction leg = requirePairedLeg(ownerId, legId);
        List<LedgerTransaction> locked = transactionRepository.lockOwned(ownerId,
            List.of(leg.getId(), leg.getPairedTransactionId()));

        LedgerTransaction lockedLeg = find(locked, legId)
            .filter(row -> !row.isDeleted())
            .orElseThrow(() -> LedgerException.notFound("Transaction", legId));
        if (!lockedLeg.isPaired()) {
            throw new LedgerException(LedgerErrorCode.NOT_A_TRANSFER, "Transaction is not a transfer leg: " + legId);
        }
        LedgerTransaction partner = find(locked, lockedLeg.getPairedTransactionId()).orElse(null);
        if (!isIntactPartner(lockedLeg, partner)) {
            log.warn("Refusing to edit broken transfer pair: legId={}, partnerId={}",
                legId, lockedLeg.getPairedTransactionId());
            throw new LedgerException(LedgerErrorCode.ORPHAN_PAIR,
                "Transfer partner of " + legId + " is missing or does not point back");
        }
        return new LedgerTransaction[] {lockedLeg, partner};
    }

    private LedgerTransaction requirePairedLeg(UUID ownerId, UUID legId) {
        LedgerTransaction leg = transactionRepository.findActiveOwned(ownerId, legId)
            .orElseThrow(() -> LedgerException.notFound("Transaction", legId));
        if (!leg.isPaired()) {
            throw new LedgerException(LedgerErrorCode.NOT_A_TRANSFER, "Transaction is not a transfer leg: " + legId);
        }
        return leg;
    }

    private static boolean isIntactPartner(LedgerTransaction leg, LedgerTransaction partner) {
        return partner != null
            && !partner.isDeleted()
            && leg.getId().equals(partner.getPairedTransactionId())
            && partner.getFlowType() == leg.getFlowType().opposite();
    }

    private static Optional<LedgerTransaction> find(List<LedgerTransaction> rows, UUID id) {
        return rows.stream().filter(row -> row.getId().equals(id)).findFirst();
    }

    private Account requireTransferAccounts(UUID ownerId, UUID fromAccountId, UUID toAccountId) {
        if (fromAccountId == null || toAccountId == null || fromAccountId.equals(toAccountId)) {
            throw new LedgerException(LedgerErrorCode.INVALID_ACCOUNTS,
                "Transfer needs two distinct accounts: from=" + fromAccountId + ", to=" + toAccountId);
        }
        Account from = accountRepository.findActiveOwned(ownerId, fromAccountId)
            .orElseThrow(() -> new LedgerException(LedgerErrorCode.INVALID_ACCOUNTS,
                "Source account not available: " + fromAccountId));
        accountRepository.findActiveOwned(ownerId, toAccountId)
            .orElseThrow(() -> new LedgerException(LedgerErrorCode.INVALID_ACCOUNTS,
                "Target account not available: " + toAccountId));
        return from;
    }

    private static NewTemplate transferTemplate(UUID ownerId, UUID accountId, Category category, FlowType flowType,
                                                RecurringTransferCommand command, RecurrenceRule rule,
                                                LocalDate firstRun) {
        return NewTemplate.builder()
            .ownerId(ownerId)
            .accountId(accountId)
            .categoryId(category.getId())
            .flowType(flowType)
            .amount(command.getAmount())
            .description(command.getDescription())
            .frequency(rule.getFrequency())
            .interval(rule.getInterval())
            .byWeekday(rule.getByWeekday())
            .byMonthday(rule.getByMonthday())
            .startDate(rule.getStartDate())
            .firstRunDate(firstRun)
            .endDate(command.getEndDate())
            .build();
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw LedgerException.invalidRequest("Amount must be greater than 0");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
