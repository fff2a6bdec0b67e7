package com.flagship.personal_ledger.recurring;

import com.flagship.personal_ledger.common.exception.LedgerErrorCode;
import com.flagship.personal_ledger.common.exception.LedgerException;
import com.flagship.personal_ledger.observability.CorrelationContext;
import com.flagship.personal_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Drives materialization of an owner's due templates, and owns the template
 * lifecycle transitions that move the cursor (pause, resume).
 *
 * A sync is a batch of independent units; each template, or recurring-transfer
 * pair, commits or rolls back on its own. A failing unit is reported in
 * {@link SyncResult#getFailures()} and the batch goes on. Running the same sync
 * twice writes nothing the second time because every cursor has moved past
 * {@code asOf}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecurringSyncService {

    private static final String INTERNAL_ERROR = "internal_error";

    private final RecurringTemplateRepository templateRepository;
    private final TemplateMaterializer templateMaterializer;
    private final LedgerMetrics ledgerMetrics;

    public SyncResult sync(UUID ownerId, LocalDate asOf) {
        if (asOf == null) {
            throw LedgerException.invalidRequest("as_of date is required");
        }
        long startTime = System.currentTimeMillis();

        List<UUID> dueTemplateIds = templateRepository.findDueTemplateIds(ownerId, asOf);
        Set<UUID> handled = new HashSet<>();
        Set<UUID> accounts = new LinkedHashSet<>();
        List<TemplateFailure> failures = new ArrayList<>();
        int materialized = 0;
        int processed = 0;
        int budgets = 0;

        for (UUID templateId : dueTemplateIds) {
            if (handled.contains(templateId)) {
                continue;
            }
            MDC.put(CorrelationContext.TEMPLATE_ID_MDC_KEY, templateId.toString());
            try {
                MaterializationOutcome outcome = templateMaterializer.materialize(ownerId, templateId, asOf);
                handled.addAll(outcome.getTemplateIds());
                if (!outcome.isSkipped()) {
                    processed += outcome.getTemplateIds().size();
                    materialized += outcome.getTransactionsCreated();
                    accounts.addAll(outcome.getAccountsReconciled());
                    budgets += outcome.getBudgetsReconciled();
                }
            } catch (LedgerException e) {
                handled.add(templateId);
                failures.add(new TemplateFailure(templateId, e.getErrorCode().code(), e.getMessage()));
                ledgerMetrics.recordSyncFailure();
                log.warn("Template skipped during sync: code={}, error={}", e.getErrorCode().code(), e.getMessage());
            } catch (RuntimeException e) {
                handled.add(templateId);
                failures.add(new TemplateFailure(templateId, INTERNAL_ERROR, e.getMessage()));
                ledgerMetrics.recordSyncFailure();
                log.error("Template failed during sync: error={}", e.getMessage(), e);
            } finally {
                MDC.remove(CorrelationContext.TEMPLATE_ID_MDC_KEY);
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        ledgerMetrics.recordMaterialized(materialized);
        ledgerMetrics.recordSyncDuration(duration);
        log.info("Recurring sync finished: asOf={}, due={}, processed={}, materialized={}, failures={}, duration={}ms",
            asOf, dueTemplateIds.size(), processed, materialized, failures.size(), duration);

        return SyncResult.builder()
            .ownerId(ownerId)
            .asOf(asOf)
            .transactionsMaterialized(materialized)
            .templatesProcessed(processed)
            .accountsReconciled(accounts.size())
            .budgetsReconciled(budgets)
            .failures(List.copyOf(failures))
            .build();
    }

    /**
     * SCHEDULED to PAUSED, together with a live partner. Pausing a paused
     * template is a no-op.
     *
     * @throws LedgerException not_found, invalid_state for exhausted or deleted templates
     */
    @Transactional
    public RecurringTemplate pause(UUID ownerId, UUID templateId) {
        List<RecurringTemplate> locked = lockWithPartner(ownerId, templateId);
        RecurringTemplate template = requireTemplate(locked, templateId);
        requireResumable(template);
        if (template.state() == RecurringTemplate.TemplateState.PAUSED) {
            return template;
        }

        List<UUID> ids = livePairIds(template, locked);
        templateRepository.deactivate(ownerId, ids);
        log.info("Template paused: templateId={}, pairedWith={}", templateId, template.getPairedTemplateId());
        return reload(ownerId, templateId);
    }

    /**
     * PAUSED to SCHEDULED. The cursor moves to the first occurrence on or after
     * {@code today}; occurrences missed while paused are not backfilled.
     *
     * @throws LedgerException not_found, invalid_state when exhausted, deleted or without a future occurrence
     */
    @Transactional
    public RecurringTemplate resume(UUID ownerId, UUID templateId, LocalDate today) {
        List<RecurringTemplate> locked = lockWithPartner(ownerId, templateId);
        RecurringTemplate template = requireTemplate(locked, templateId);
        requireResumable(template);
        if (template.state() == RecurringTemplate.TemplateState.SCHEDULED) {
            return template;
        }

        RecurrenceRule rule = template.rule();
        LocalDate from = template.getNextRunDate().isAfter(today) ? template.getNextRunDate() : today;
        LocalDate next = rule.nextOnOrAfter(from);
        if (template.getEndDate() != null && next.isAfter(template.getEndDate())) {
            throw new LedgerException(LedgerErrorCode.INVALID_STATE,
                "Template has no occurrence left before its end date " + template.getEndDate());
        }

        for (UUID id : livePairIds(template, locked)) {
            templateRepository.advanceCursor(ownerId, id, next, true);
        }
        log.info("Template resumed: templateId={}, nextRunDate={}", templateId, next);
        return reload(ownerId, templateId);
    }

    private List<RecurringTemplate> lockWithPartner(UUID ownerId, UUID templateId) {
        RecurringTemplate peeked = templateRepository.findOwned(ownerId, templateId)
            .orElseThrow(() -> LedgerException.notFound("RecurringTemplate", templateId));
        Set<UUID> ids = new TreeSet<>();
        ids.add(templateId);
        if (peeked.isPaired()) {
            ids.add(peeked.getPairedTemplateId());
        }
        return templateRepository.lockOwned(ownerId, ids);
    }

    private static RecurringTemplate requireTemplate(List<RecurringTemplate> locked, UUID templateId) {
        return locked.stream()
            .filter(template -> template.getId().equals(templateId))
            .findFirst()
            .orElseThrow(() -> LedgerException.notFound("RecurringTemplate", templateId));
    }

    private static void requireResumable(RecurringTemplate template) {
        RecurringTemplate.TemplateState state = template.state();
        if (state == RecurringTemplate.TemplateState.DELETED || state == RecurringTemplate.TemplateState.EXHAUSTED) {
            throw new LedgerException(LedgerErrorCode.INVALID_STATE,
                "Template " + template.getId() + " is " + state);
        }
    }

    /**
     * The template plus its partner when the partner is live and points back.
     */
    private static List<UUID> livePairIds(RecurringTemplate template, List<RecurringTemplate> locked) {
        List<UUID> ids = new ArrayList<>();
        ids.add(template.getId());
        if (template.isPaired()) {
            locked.stream()
                .filter(candidate -> candidate.getId().equals(template.getPairedTemplateId()))
                .filter(candidate -> !candidate.isDeleted())
                .filter(candidate -> template.getId().equals(candidate.getPairedTemplateId()))
                .findFirst()
                .ifPresent(partner -> ids.add(partner.getId()));
        }
        return ids;
    }

    private RecurringTemplate reload(UUID ownerId, UUID templateId) {
        return templateRepository.findOwned(ownerId, templateId)
            .orElseThrow(() -> LedgerException.notFound("RecurringTemplate", templateId));
    }
}
