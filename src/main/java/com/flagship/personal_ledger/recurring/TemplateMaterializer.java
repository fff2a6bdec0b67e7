package com.flagship.personal_ledger.recurring;

import com.flagship.personal_ledger.common.FlowType;
import com.flagship.personal_ledger.common.exception.LedgerException;
import com.flagship.personal_ledger.outbox.OutboxService;
import com.flagship.personal_ledger.outbox.event.RecurringTransactionsMaterializedEvent;
import com.flagship.personal_ledger.reconcile.CacheReconciler;
import com.flagship.personal_ledger.transaction.LedgerTransaction.SystemGeneratedKey;
import com.flagship.personal_ledger.transaction.NewTransaction;
import com.flagship.personal_ledger.transaction.TransactionRepository;
import com.flagship.personal_ledger.transfer.PairingManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Materializes one template, or one recurring-transfer pair, in its own
 * transaction.
 *
 * The template rows are locked and the cursor re-read before anything is
 * written, so a second sync racing on the same template waits and then finds
 * nothing due.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TemplateMaterializer {

    static final String TEMPLATE_AGGREGATE = "RecurringTemplate";

    private final RecurringTemplateRepository templateRepository;
    private final TransactionRepository transactionRepository;
    private final PairingManager pairingManager;
    private final CacheReconciler cacheReconciler;
    private final OutboxService outboxService;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public MaterializationOutcome materialize(UUID ownerId, UUID templateId, LocalDate asOf) {
        RecurringTemplate peeked = templateRepository.findOwned(ownerId, templateId)
            .orElseThrow(() -> LedgerException.notFound("RecurringTemplate", templateId));

        Set<UUID> lockIds = new TreeSet<>();
        lockIds.add(templateId);
        if (peeked.isPaired()) {
            lockIds.add(peeked.getPairedTemplateId());
        }
        List<RecurringTemplate> locked = templateRepository.lockOwned(ownerId, lockIds);

        RecurringTemplate template = find(locked, templateId)
            .orElseThrow(() -> LedgerException.notFound("RecurringTemplate", templateId));
        if (!template.isDue(asOf)) {
            log.debug("Template no longer due after locking: templateId={}, nextRunDate={}",
                templateId, template.getNextRunDate());
            return MaterializationOutcome.skipped(templateId);
        }

        RecurrenceRule rule = template.rule();
        rule.validate();

        RecurringTemplate partner = usablePartner(template, locked);
        LocalDate cursor = template.getNextRunDate();
        LocalDate until = template.getEndDate() != null && template.getEndDate().isBefore(asOf)
            ? template.getEndDate() : asOf;
        List<LocalDate> dates = cursor.isAfter(until) ? List.of() : rule.occurrencesBetween(cursor, until);

        int created = 0;
        for (LocalDate date : dates) {
            UUID transactionId = transactionRepository.insert(occurrence(template, date));
            created++;
            if (partner != null) {
                UUID partnerTransactionId = transactionRepository.insert(occurrence(partner, date));
                created++;
                if (template.getFlowType() == FlowType.OUTCOME) {
                    pairingManager.linkMaterializedLegs(ownerId, transactionId, partnerTransactionId);
                } else {
                    pairingManager.linkMaterializedLegs(ownerId, partnerTransactionId, transactionId);
                }
            }
        }

        LocalDate newCursor = dates.isEmpty()
            ? rule.nextOnOrAfter(cursor)
            : rule.nextAfter(dates.get(dates.size() - 1));
        boolean exhausted = template.getEndDate() != null && newCursor.isAfter(template.getEndDate());

        List<UUID> templateIds = new ArrayList<>();
        templateIds.add(templateId);
        templateRepository.advanceCursor(ownerId, templateId, newCursor, !exhausted);
        if (partner != null) {
            templateIds.add(partner.getId());
            templateRepository.advanceCursor(ownerId, partner.getId(), newCursor, !exhausted);
        }

        Set<UUID> accounts = new LinkedHashSet<>();
        int budgets = 0;
        if (created > 0) {
            Set<UUID> categories = new LinkedHashSet<>();
            accounts.add(template.getAccountId());
            categories.add(template.getCategoryId());
            if (partner != null) {
                accounts.add(partner.getAccountId());
                categories.add(partner.getCategoryId());
            }
            cacheReconciler.recomputeAccountBalances(ownerId, accounts);
            budgets = cacheReconciler.recomputeBudgetsForCategories(ownerId, categories);

            outboxService.saveEvent(TEMPLATE_AGGREGATE, RecurringTransactionsMaterializedEvent.of(ownerId,
                templateId, partner != null ? partner.getId() : null, dates, created, newCursor, exhausted));
        }

        if (exhausted) {
            log.info("Template exhausted: templateId={}, endDate={}", templateId, template.getEndDate());
        }
        log.info("Template materialized: templateId={}, occurrences={}, transactions={}, nextRunDate={}",
            templateId, dates.size(), created, newCursor);

        return new MaterializationOutcome(templateIds, created, accounts, budgets, false);
    }

    /**
     * The partner of a recurring transfer, when it can be materialized with the
     * template. A broken pair falls back to standalone processing.
     */
    private RecurringTemplate usablePartner(RecurringTemplate template, List<RecurringTemplate> locked) {
        if (!template.isPaired()) {
            return null;
        }
        RecurringTemplate partner = find(locked, template.getPairedTemplateId()).orElse(null);
        boolean usable = partner != null
            && partner.state() == RecurringTemplate.TemplateState.SCHEDULED
            && template.getId().equals(partner.getPairedTemplateId())
            && partner.getFlowType() == template.getFlowType().opposite();
        if (!usable) {
            log.warn("Recurring transfer partner unusable, materializing standalone: templateId={}, partnerId={}",
                template.getId(), template.getPairedTemplateId());
            return null;
        }
        return partner;
    }

    private static NewTransaction occurrence(RecurringTemplate template, LocalDate date) {
        return NewTransaction.builder()
            .ownerId(template.getOwnerId())
            .accountId(template.getAccountId())
            .categoryId(template.getCategoryId())
            .flowType(template.getFlowType())
            .amount(template.getAmount())
            .date(date)
            .description(template.getDescription())
            .recurringTemplateId(template.getId())
            .systemGeneratedKey(SystemGeneratedKey.RECURRING_SYNC)
            .build();
    }

    private static Optional<RecurringTemplate> find(List<RecurringTemplate> templates, UUID id) {
        return templates.stream().filter(template -> template.getId().equals(id)).findFirst();
    }
}
