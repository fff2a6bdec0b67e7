package com.flagship.personal_ledger.recurring;

import com.flagship.personal_ledger.LedgerIntegrationTestSupport;
import com.flagship.personal_ledger.common.FlowType;
import com.flagship.personal_ledger.common.exception.LedgerErrorCode;
import com.flagship.personal_ledger.common.exception.LedgerException;
import com.flagship.personal_ledger.transaction.LedgerTransaction;
import com.flagship.personal_ledger.transaction.TransactionRepository;
import com.flagship.personal_ledger.transfer.PairingManager;
import com.flagship.personal_ledger.transfer.RecurringTransfer;
import com.flagship.personal_ledger.transfer.RecurringTransferCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Materialization of recurring templates up to an as-of date.
 */
class RecurringSyncServiceTest extends LedgerIntegrationTestSupport {

    @Autowired
    private RecurringSyncService recurringSyncService;

    @Autowired
    private RecurringTemplateService templateService;

    @Autowired
    private RecurringTemplateRepository templateRepository;

    @Autowired
    private TransactionRepository transactionRepository;

    @Autowired
    private PairingManager pairingManager;

    private UUID checking;
    private UUID groceries;

    @BeforeEach
    void setUp() {
        checking = account("Checking");
        groceries = category("Groceries", FlowType.OUTCOME);
    }

    @Test
    @DisplayName("Monthly template on the 1st and 15th materializes four dates and moves the cursor to Jan 1")
    void monthlyScenario() {
        printTestHeader("Monthly Sync Scenario");

        // Given
        RecurringTemplate template = monthlyTemplate(List.of(1, 15), LocalDate.of(2025, 11, 1), null);
        printInput("Template", template.getId());
        printInput("As of", "2025-12-16");

        // When
        SyncResult result = recurringSyncService.sync(ownerId, LocalDate.of(2025, 12, 16));
        printOutput("Materialized", result.getTransactionsMaterialized());

        // Then
        assertEquals(4, result.getTransactionsMaterialized());
        assertEquals(1, result.getTemplatesProcessed());
        assertTrue(result.getFailures().isEmpty());
        assertEquals(List.of(
            LocalDate.of(2025, 11, 1),
            LocalDate.of(2025, 11, 15),
            LocalDate.of(2025, 12, 1),
            LocalDate.of(2025, 12, 15)), materializedDates(template.getId()));
        assertEquals(LocalDate.of(2026, 1, 1), reload(template.getId()).getNextRunDate());
        assertEquals(0, amount("-100.00").compareTo(storedBalance(checking)));
        printSuccess("Four occurrences written, cursor at 2026-01-01");
    }

    @Test
    @DisplayName("Syncing twice with the same date writes nothing the second time")
    void syncIsIdempotent() {
        printTestHeader("Sync Idempotence");

        RecurringTemplate template = monthlyTemplate(List.of(1, 15), LocalDate.of(2025, 11, 1), null);
        recurringSyncService.sync(ownerId, LocalDate.of(2025, 12, 16));
        LocalDate cursorAfterFirst = reload(template.getId()).getNextRunDate();

        SyncResult second = recurringSyncService.sync(ownerId, LocalDate.of(2025, 12, 16));

        assertEquals(0, second.getTransactionsMaterialized());
        assertEquals(0, second.getTemplatesProcessed());
        assertEquals(cursorAfterFirst, reload(template.getId()).getNextRunDate());
        assertEquals(4, transactionRepository.findActiveByTemplate(ownerId, template.getId()).size());
        printSuccess("No duplicates on re-run");
    }

    @Test
    @DisplayName("Sync before the start date materializes nothing and keeps the cursor")
    void syncBeforeStart() {
        RecurringTemplate template = monthlyTemplate(List.of(10), LocalDate.of(2026, 3, 1), null);
        LocalDate cursor = template.getNextRunDate();

        SyncResult result = recurringSyncService.sync(ownerId, LocalDate.of(2026, 1, 1));

        assertEquals(0, result.getTransactionsMaterialized());
        assertEquals(cursor, reload(template.getId()).getNextRunDate());
        assertTrue(materializedDates(template.getId()).isEmpty());
    }

    @Test
    @DisplayName("Cursor past the end date exhausts the template")
    void exhaustion() {
        printTestHeader("Template Exhaustion");

        RecurringTemplate template = templateService.createTemplate(ownerId, RecurringTemplateCommand.builder()
            .accountId(checking)
            .categoryId(groceries)
            .flowType(FlowType.OUTCOME)
            .amount(amount("5.00"))
            .frequency(Frequency.DAILY)
            .interval(1)
            .startDate(LocalDate.of(2025, 1, 1))
            .endDate(LocalDate.of(2025, 1, 3))
            .build());

        SyncResult result = recurringSyncService.sync(ownerId, LocalDate.of(2025, 1, 10));
        RecurringTemplate exhausted = reload(template.getId());
        printOutput("State", exhausted.state());

        assertEquals(3, result.getTransactionsMaterialized());
        assertEquals(RecurringTemplate.TemplateState.EXHAUSTED, exhausted.state());
        assertFalse(exhausted.isActive());
        assertEquals(0, recurringSyncService.sync(ownerId, LocalDate.of(2025, 2, 1)).getTransactionsMaterialized());
    }

    @Test
    @DisplayName("A recurring transfer materializes linked legs in both accounts")
    void recurringTransferMaterializesPairs() {
        printTestHeader("Recurring Transfer Sync");

        UUID savings = account("Savings");
        RecurringTransfer recurring = pairingManager.createRecurringTransfer(ownerId, RecurringTransferCommand.builder()
            .fromAccountId(checking)
            .toAccountId(savings)
            .amount(amount("200.00"))
            .frequency(Frequency.MONTHLY)
            .interval(1)
            .startDate(LocalDate.of(2025, 9, 1))
            .build());

        SyncResult result = recurringSyncService.sync(ownerId, LocalDate.of(2025, 11, 15));
        printOutput("Materialized", result.getTransactionsMaterialized());

        assertEquals(6, result.getTransactionsMaterialized());
        assertEquals(2, result.getTemplatesProcessed());
        List<LedgerTransaction> outgoing = transactionRepository.findActiveByTemplate(ownerId,
            recurring.getOutgoingTemplateId());
        assertEquals(3, outgoing.size());
        for (LedgerTransaction leg : outgoing) {
            LedgerTransaction partner = transactionRepository.findOwned(ownerId, leg.getPairedTransactionId())
                .orElseThrow();
            assertEquals(leg.getId(), partner.getPairedTransactionId());
            assertEquals(leg.getDate(), partner.getDate());
            assertEquals(savings, partner.getAccountId());
            assertEquals(recurring.getIncomingTemplateId(), partner.getRecurringTemplateId());
        }
        assertEquals(reload(recurring.getOutgoingTemplateId()).getNextRunDate(),
            reload(recurring.getIncomingTemplateId()).getNextRunDate());
        assertEquals(0, amount("-600.00").compareTo(storedBalance(checking)));
        assertEquals(0, amount("600.00").compareTo(storedBalance(savings)));
        printSuccess("Three linked transfers materialized");
    }

    @Test
    @DisplayName("A malformed template is reported and does not stop the others")
    void failureIsIsolated() {
        printTestHeader("Sync Failure Isolation");

        RecurringTemplate broken = monthlyTemplate(List.of(1), LocalDate.of(2025, 11, 1), null);
        RecurringTemplate healthy = monthlyTemplate(List.of(2), LocalDate.of(2025, 11, 1), null);
        jdbcTemplate.update("UPDATE recurring_templates SET interval_count = 0 WHERE id = ?", broken.getId());

        SyncResult result = recurringSyncService.sync(ownerId, LocalDate.of(2025, 12, 31));
        printOutput("Failures", result.getFailures());

        assertEquals(1, result.getFailures().size());
        assertEquals(broken.getId(), result.getFailures().get(0).getTemplateId());
        assertEquals(LedgerErrorCode.INVALID_SCHEDULE.code(), result.getFailures().get(0).getCode());
        assertEquals(2, result.getTransactionsMaterialized());
        assertTrue(materializedDates(broken.getId()).isEmpty());
        assertEquals(LocalDate.of(2025, 11, 1), reload(broken.getId()).getNextRunDate());
        assertEquals(2, materializedDates(healthy.getId()).size());
    }

    @Test
    @DisplayName("Paused templates are skipped and resume from today without backfill")
    void pauseAndResume() {
        printTestHeader("Pause And Resume");

        RecurringTemplate template = monthlyTemplate(List.of(1), LocalDate.of(2025, 6, 1), null);
        recurringSyncService.pause(ownerId, template.getId());

        SyncResult whilePaused = recurringSyncService.sync(ownerId, LocalDate.of(2025, 9, 15));
        assertEquals(0, whilePaused.getTransactionsMaterialized());
        assertEquals(RecurringTemplate.TemplateState.PAUSED, reload(template.getId()).state());

        RecurringTemplate resumed = recurringSyncService.resume(ownerId, template.getId(), LocalDate.of(2025, 9, 15));
        printOutput("Next run", resumed.getNextRunDate());

        assertEquals(RecurringTemplate.TemplateState.SCHEDULED, resumed.state());
        assertEquals(LocalDate.of(2025, 10, 1), resumed.getNextRunDate());
        assertEquals(1, recurringSyncService.sync(ownerId, LocalDate.of(2025, 10, 1)).getTransactionsMaterialized());
    }

    @Test
    @DisplayName("Exhausted templates cannot be resumed")
    void resumeExhausted() {
        RecurringTemplate template = templateService.createTemplate(ownerId, RecurringTemplateCommand.builder()
            .accountId(checking)
            .categoryId(groceries)
            .flowType(FlowType.OUTCOME)
            .amount(amount("5.00"))
            .frequency(Frequency.DAILY)
            .interval(1)
            .startDate(LocalDate.of(2025, 1, 1))
            .endDate(LocalDate.of(2025, 1, 1))
            .build());
        recurringSyncService.sync(ownerId, LocalDate.of(2025, 1, 5));

        LedgerException e = assertThrows(LedgerException.class, () ->
            recurringSyncService.resume(ownerId, template.getId(), LocalDate.of(2025, 1, 5)));

        assertEquals(LedgerErrorCode.INVALID_STATE, e.getErrorCode());
    }

    @Test
    @DisplayName("Template creation rejects a zero interval and a category of the other flow")
    void createValidation() {
        LedgerException schedule = assertThrows(LedgerException.class, () ->
            templateService.createTemplate(ownerId, RecurringTemplateCommand.builder()
                .accountId(checking)
                .categoryId(groceries)
                .flowType(FlowType.OUTCOME)
                .amount(amount("5.00"))
                .frequency(Frequency.WEEKLY)
                .interval(0)
                .startDate(LocalDate.of(2025, 1, 1))
                .build()));
        LedgerException flow = assertThrows(LedgerException.class, () ->
            templateService.createTemplate(ownerId, RecurringTemplateCommand.builder()
                .accountId(checking)
                .categoryId(groceries)
                .flowType(FlowType.INCOME)
                .amount(amount("5.00"))
                .frequency(Frequency.WEEKLY)
                .interval(1)
                .startDate(LocalDate.of(2025, 1, 1))
                .build()));

        assertEquals(LedgerErrorCode.INVALID_SCHEDULE, schedule.getErrorCode());
        assertEquals(LedgerErrorCode.INVALID_REQUEST, flow.getErrorCode());
    }

    private RecurringTemplate monthlyTemplate(List<Integer> monthDays, LocalDate start, LocalDate end) {
        return templateService.createTemplate(ownerId, RecurringTemplateCommand.builder()
            .accountId(checking)
            .categoryId(groceries)
            .flowType(FlowType.OUTCOME)
            .amount(amount("25.00"))
            .description("Groceries box")
            .frequency(Frequency.MONTHLY)
            .interval(1)
            .byMonthday(monthDays)
            .startDate(start)
            .endDate(end)
            .build());
    }

    private RecurringTemplate reload(UUID templateId) {
        return templateRepository.findOwned(ownerId, templateId).orElseThrow();
    }

    private List<LocalDate> materializedDates(UUID templateId) {
        return transactionRepository.findActiveByTemplate(ownerId, templateId).stream()
            .map(LedgerTransaction::getDate)
            .sorted(Comparator.naturalOrder())
            .collect(Collectors.toList());
    }
}
