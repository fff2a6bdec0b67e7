package com.flagship.personal_ledger.failure;

import com.flagship.personal_ledger.LedgerIntegrationTestSupport;
import com.flagship.personal_ledger.common.FlowType;
import com.flagship.personal_ledger.outbox.OutboxService;
import com.flagship.personal_ledger.recurring.Frequency;
import com.flagship.personal_ledger.recurring.RecurringSyncService;
import com.flagship.personal_ledger.recurring.RecurringTemplate;
import com.flagship.personal_ledger.recurring.RecurringTemplateCommand;
import com.flagship.personal_ledger.recurring.RecurringTemplateRepository;
import com.flagship.personal_ledger.recurring.RecurringTemplateService;
import com.flagship.personal_ledger.recurring.SyncResult;
import com.flagship.personal_ledger.transaction.NewTransaction;
import com.flagship.personal_ledger.transaction.TransactionCommand;
import com.flagship.personal_ledger.transaction.TransactionRepository;
import com.flagship.personal_ledger.transaction.TransactionService;
import com.flagship.personal_ledger.transfer.PairingManager;
import com.flagship.personal_ledger.transfer.RecurringTransfer;
import com.flagship.personal_ledger.transfer.RecurringTransferCommand;
import com.flagship.personal_ledger.transfer.Transfer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

/**
 * Ledger behaviour when writers race each other or a dependency fails midway.
 *
 * Redis is replaced by a mock so outages can be simulated. The transaction
 * repository is spied so a failure can be injected after the first leg of a
 * pair was already inserted.
 */
class FailureScenarioTest extends LedgerIntegrationTestSupport {

    @Autowired
    private PairingManager pairingManager;

    @Autowired
    private TransactionService transactionService;

    @Autowired
    private RecurringSyncService recurringSyncService;

    @Autowired
    private RecurringTemplateService templateService;

    @Autowired
    private RecurringTemplateRepository templateRepository;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @SpyBean
    private TransactionRepository transactionRepository;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @MockBean
    private ValueOperations<String, String> valueOperations;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    private void printSection(String sectionName) {
        System.out.println("\n--- " + sectionName + " ---");
    }

    private int liveTransactionCount(UUID accountId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM transactions WHERE account_id = ? AND deleted_at IS NULL", Integer.class, accountId);
        return count == null ? 0 : count;
    }

    private BigDecimal liveSum(UUID accountId) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE WHEN flow_type = 'INCOME' THEN amount ELSE -amount END), 0) " +
            "FROM transactions WHERE account_id = ? AND deleted_at IS NULL", BigDecimal.class, accountId);
    }

    private int materializedCount(UUID templateId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM transactions WHERE recurring_template_id = ?", Integer.class, templateId);
        return count == null ? 0 : count;
    }

    // ========================================================================
    // REDIS FAILURE SCENARIOS
    // ========================================================================

    @Nested
    @DisplayName("1. Redis Failure Scenarios")
    class RedisFailureTests {

        @Test
        @DisplayName("1.1 Transfer replay is answered from the database when Redis is down")
        void replayWorksWithoutRedis() {
            printTestHeader("Idempotency Database Fallback");

            // Given: every Redis call fails
            when(valueOperations.get(anyString())).thenThrow(new RuntimeException("Redis connection refused"));
            doThrow(new RuntimeException("Redis connection refused"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));
            UUID checking = account("Checking", "300.00");
            UUID savings = account("Savings");
            String key = "rent-" + UUID.randomUUID();

            // When
            Transfer first = pairingManager.createTransfer(ownerId, checking, savings, amount("120.00"),
                LocalDate.of(2025, 11, 3), "Rent share", key);
            Transfer replay = pairingManager.createTransfer(ownerId, checking, savings, amount("120.00"),
                LocalDate.of(2025, 11, 3), "Rent share", key);
            printOutput("First outgoing leg", first.getOutgoing().getId());
            printOutput("Replayed outgoing leg", replay.getOutgoing().getId());

            // Then
            assertFalse(first.isReplayed());
            assertTrue(replay.isReplayed());
            assertEquals(first.getOutgoing().getId(), replay.getOutgoing().getId());
            assertEquals(1, liveTransactionCount(savings));
            assertEquals(0, amount("180.00").compareTo(storedBalance(checking)));
            printSuccess("Database column served the replay");
        }

        @Test
        @DisplayName("1.2 A key cached in Redis short-circuits the lookup")
        void replayServedFromRedis() {
            UUID checking = account("Checking", "300.00");
            UUID savings = account("Savings");
            Transfer first = pairingManager.createTransfer(ownerId, checking, savings, amount("40.00"),
                LocalDate.of(2025, 11, 4), null, null);
            when(valueOperations.get(anyString())).thenReturn(first.getOutgoing().getId().toString());

            Transfer replay = pairingManager.createTransfer(ownerId, checking, savings, amount("40.00"),
                LocalDate.of(2025, 11, 4), null, "cached-" + UUID.randomUUID());

            assertTrue(replay.isReplayed());
            assertEquals(first.getOutgoing().getId(), replay.getOutgoing().getId());
            assertEquals(1, liveTransactionCount(savings));
        }
    }

    // ========================================================================
    // ROLLBACK SCENARIOS
    // ========================================================================

    @Nested
    @DisplayName("2. Rollback Scenarios")
    class RollbackTests {

        @Test
        @DisplayName("2.1 Transfer failing after the first leg is inserted leaves no leg behind")
        void transferRollsBackCompletely() {
            printTestHeader("Transfer Rollback - No Half Pair");

            // Given
            UUID checking = account("Checking", "500.00");
            UUID savings = account("Savings");
            doThrow(new RuntimeException("Simulated failure on the incoming leg"))
                .when(transactionRepository).insert(argThat((NewTransaction tx) -> savings.equals(tx.getAccountId())));

            // When
            RuntimeException e = assertThrows(RuntimeException.class, () ->
                pairingManager.createTransfer(ownerId, checking, savings, amount("75.00"),
                    LocalDate.of(2025, 11, 5), null, "rollback-" + UUID.randomUUID()));
            printOutput("Exception", e.getMessage());

            // Then
            assertEquals(1, liveTransactionCount(checking), "only the initial balance row remains");
            assertEquals(0, liveTransactionCount(savings));
            assertEquals(0, amount("500.00").compareTo(storedBalance(checking)));
            assertEquals(0, BigDecimal.ZERO.compareTo(storedBalance(savings)));
            assertTrue(outboxService.getEventsForOwner(ownerId).isEmpty());
            printSuccess("Neither leg survived the rollback");
        }

        @Test
        @DisplayName("2.2 Recurring transfer failing mid-materialization keeps both cursors and writes nothing")
        void materializationRollsBackCompletely() {
            printTestHeader("Materialization Rollback - No Half-Advanced Cursor");

            // Given
            UUID checking = account("Checking");
            UUID savings = account("Savings");
            RecurringTransfer recurring = pairingManager.createRecurringTransfer(ownerId,
                RecurringTransferCommand.builder()
                    .fromAccountId(checking)
                    .toAccountId(savings)
                    .amount(amount("200.00"))
                    .frequency(Frequency.MONTHLY)
                    .interval(1)
                    .startDate(LocalDate.of(2025, 9, 1))
                    .build());
            UUID incomingTemplateId = recurring.getIncomingTemplateId();
            doThrow(new RuntimeException("Simulated failure on the incoming leg"))
                .when(transactionRepository).insert(argThat((NewTransaction tx) ->
                    incomingTemplateId.equals(tx.getRecurringTemplateId())));

            // When
            SyncResult failed = recurringSyncService.sync(ownerId, LocalDate.of(2025, 11, 15));
            printOutput("Failures", failed.getFailures());

            // Then
            // one report per template of the pair, each attempt rolled back on its own
            assertEquals(2, failed.getFailures().size());
            assertTrue(failed.getFailures().stream().allMatch(failure ->
                failure.getTemplateId().equals(recurring.getOutgoingTemplateId())
                    || failure.getTemplateId().equals(recurring.getIncomingTemplateId())));
            assertEquals(0, failed.getTransactionsMaterialized());
            assertEquals(0, materializedCount(recurring.getOutgoingTemplateId()));
            assertEquals(0, materializedCount(recurring.getIncomingTemplateId()));
            assertEquals(LocalDate.of(2025, 9, 1), cursor(recurring.getOutgoingTemplateId()));
            assertEquals(LocalDate.of(2025, 9, 1), cursor(recurring.getIncomingTemplateId()));
            assertEquals(0, BigDecimal.ZERO.compareTo(storedBalance(checking)));
            assertTrue(outboxService.getEventsForOwner(ownerId).isEmpty());

            // And the pair recovers once the failure is gone
            doCallRealMethod().when(transactionRepository).insert(any(NewTransaction.class));
            SyncResult retried = recurringSyncService.sync(ownerId, LocalDate.of(2025, 11, 15));
            assertEquals(6, retried.getTransactionsMaterialized());
            assertEquals(0, amount("-600.00").compareTo(storedBalance(checking)));
            printSuccess("Failed unit rolled back; retry materialized every occurrence once");
        }

        private LocalDate cursor(UUID templateId) {
            return templateRepository.findOwned(ownerId, templateId).map(RecurringTemplate::getNextRunDate)
                .orElseThrow();
        }
    }

    // ========================================================================
    // CONCURRENCY SCENARIOS
    // ========================================================================

    @Nested
    @DisplayName("3. Concurrent Writers")
    class ConcurrencyTests {

        @Test
        @DisplayName("3.1 Concurrent syncs of the same template materialize each occurrence once")
        void concurrentSyncNeverDoubleMaterializes() throws Exception {
            printTestHeader("Concurrent Sync - No Double Materialization");

            // Given: a daily template with 20 occurrences due
            UUID checking = account("Checking");
            UUID groceries = category("Groceries", FlowType.OUTCOME);
            RecurringTemplate template = templateService.createTemplate(ownerId, RecurringTemplateCommand.builder()
                .accountId(checking)
                .categoryId(groceries)
                .flowType(FlowType.OUTCOME)
                .amount(amount("5.00"))
                .frequency(Frequency.DAILY)
                .interval(1)
                .startDate(LocalDate.of(2025, 1, 1))
                .build());
            LocalDate asOf = LocalDate.of(2025, 1, 20);
            int threadCount = 4;

            // When
            List<SyncResult> results = runConcurrently(threadCount, () -> recurringSyncService.sync(ownerId, asOf));

            // Then
            int materialized = results.stream().mapToInt(SyncResult::getTransactionsMaterialized).sum();
            printOutput("Materialized across threads", materialized);
            assertEquals(20, materialized);
            assertEquals(20, materializedCount(template.getId()));
            assertEquals(LocalDate.of(2025, 1, 21),
                templateRepository.findOwned(ownerId, template.getId()).orElseThrow().getNextRunDate());
            assertEquals(0, amount("-100.00").compareTo(storedBalance(checking)));
            printSuccess("Row lock plus cursor re-read kept every occurrence single");
        }

        @Test
        @DisplayName("3.2 A write committing while another waits leaves the cached balance equal to the rows")
        void overlappingWritesKeepBalanceExact() throws Exception {
            printTestHeader("Overlapping Writes - Cached Balance");

            // Given
            UUID checking = account("Checking");
            UUID salary = category("Salary", FlowType.INCOME);
            TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
            CountDownLatch firstWritten = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(2);

            // When: the first write holds its commit while the second one runs
            Future<?> first = executor.submit(() -> transactionTemplate.executeWithoutResult(status -> {
                transactionService.create(ownerId, income(checking, salary, "100.00"));
                firstWritten.countDown();
                sleep(1000);
            }));
            assertTrue(firstWritten.await(10, TimeUnit.SECONDS));
            Future<?> second = executor.submit(() -> transactionService.create(ownerId, income(checking, salary, "50.00")));
            first.get(15, TimeUnit.SECONDS);
            second.get(15, TimeUnit.SECONDS);
            executor.shutdown();

            // Then
            printOutput("Cached balance", storedBalance(checking));
            printOutput("Row sum", liveSum(checking));
            assertEquals(0, amount("150.00").compareTo(liveSum(checking)));
            assertEquals(0, amount("150.00").compareTo(storedBalance(checking)));
            printSuccess("Cached balance includes both writes");
        }

        @Test
        @DisplayName("3.3 Transfers in opposite directions run side by side without deadlock")
        void oppositeTransfersDoNotDeadlock() throws Exception {
            printTestHeader("Opposite Transfers - No Deadlock");

            UUID a = account("Checking", "1000.00");
            UUID b = account("Savings", "1000.00");
            int threadCount = 8;
            List<Boolean> directions = new ArrayList<>();
            for (int i = 0; i < threadCount; i++) {
                directions.add(i % 2 == 0);
            }

            List<Transfer> transfers = runConcurrently(threadCount, index -> directions.get(index)
                ? pairingManager.createTransfer(ownerId, a, b, amount("10.00"), LocalDate.of(2025, 11, 6), null, null)
                : pairingManager.createTransfer(ownerId, b, a, amount("30.00"), LocalDate.of(2025, 11, 6), null, null));

            // 4 x 10.00 out of a, 4 x 30.00 into a
            assertEquals(threadCount, transfers.size());
            assertEquals(0, amount("1080.00").compareTo(storedBalance(a)));
            assertEquals(0, amount("920.00").compareTo(storedBalance(b)));
            assertEquals(0, liveSum(a).compareTo(storedBalance(a)));
            assertEquals(0, liveSum(b).compareTo(storedBalance(b)));
            printSuccess("All transfers committed with exact balances");
        }

        private TransactionCommand income(UUID accountId, UUID categoryId, String value) {
            return TransactionCommand.builder()
                .accountId(accountId)
                .categoryId(categoryId)
                .flowType(FlowType.INCOME)
                .amount(amount(value))
                .date(LocalDate.of(2025, 11, 7))
                .build();
        }
    }

    private interface IndexedCall<T> {
        T call(int index) throws Exception;
    }

    private <T> List<T> runConcurrently(int threadCount, Callable<T> call) throws Exception {
        return runConcurrently(threadCount, index -> call.call());
    }

    private <T> List<T> runConcurrently(int threadCount, IndexedCall<T> call) throws Exception {
        CountDownLatch startLatch = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < threadCount; i++) {
            int index = i;
            futures.add(executor.submit(() -> {
                startLatch.await();
                return call.call(index);
            }));
        }
        startLatch.countDown();
        List<T> results = new ArrayList<>();
        try {
            for (Future<T> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdown();
        }
        return results;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
