package com.flagship.personal_ledger.transaction;

import com.flagship.personal_ledger.common.FlowType;
import com.flagship.personal_ledger.common.SqlLists;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the transactions table.
 *
 * Nothing here writes {@code paired_transaction_id}. Single-row updates and
 * deletes only match unpaired rows, so a transfer leg cannot be changed
 * on its own through this class.
 */
@Repository
public class TransactionRepository {

    private static final String SELECT_COLUMNS =
        "SELECT id, owner_id, account_id, category_id, flow_type, amount, transaction_date, description, " +
        "invoice_id, paired_transaction_id, recurring_template_id, system_generated_key, deleted_at " +
        "FROM transactions ";

    private final JdbcTemplate jdbcTemplate;

    public TransactionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public UUID insert(NewTransaction transaction) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO transactions (id, owner_id, account_id, category_id, flow_type, amount, transaction_date, " +
            "description, invoice_id, recurring_template_id, system_generated_key, idempotency_key) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            id,
            transaction.getOwnerId(),
            transaction.getAccountId(),
            transaction.getCategoryId(),
            transaction.getFlowType().name(),
            transaction.getAmount(),
            transaction.getDate(),
            transaction.getDescription(),
            transaction.getInvoiceId(),
            transaction.getRecurringTemplateId(),
            transaction.getSystemGeneratedKey() != null ? transaction.getSystemGeneratedKey().key() : null,
            transaction.getIdempotencyKey()
        );
        return id;
    }

    /**
     * Finds a row of the owner, including soft-deleted ones.
     */
    public Optional<LedgerTransaction> findOwned(UUID ownerId, UUID transactionId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE id = ? AND owner_id = ?",
            transactionRowMapper(), transactionId, ownerId
        ).stream().findFirst();
    }

    public Optional<LedgerTransaction> findActiveOwned(UUID ownerId, UUID transactionId) {
        return findOwned(ownerId, transactionId).filter(transaction -> !transaction.isDeleted());
    }

    /**
     * Locks the owner's rows with the given ids, in id order, for the rest of the
     * current database transaction. Foreign or missing ids are simply absent.
     */
    public List<LedgerTransaction> lockOwned(UUID ownerId, Collection<UUID> transactionIds) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE owner_id = ? AND id IN (" + SqlLists.placeholders(transactionIds.size()) + ") " +
            "ORDER BY id FOR UPDATE",
            transactionRowMapper(), SqlLists.args(transactionIds, ownerId)
        );
    }

    public List<LedgerTransaction> findActiveByAccount(UUID ownerId, UUID accountId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE owner_id = ? AND account_id = ? AND deleted_at IS NULL ORDER BY transaction_date, id",
            transactionRowMapper(), ownerId, accountId
        );
    }

    public List<LedgerTransaction> findActiveByTemplate(UUID ownerId, UUID templateId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE owner_id = ? AND recurring_template_id = ? AND deleted_at IS NULL " +
            "ORDER BY transaction_date, id",
            transactionRowMapper(), ownerId, templateId
        );
    }

    public Optional<UUID> findIdByIdempotencyKey(UUID ownerId, String idempotencyKey) {
        return jdbcTemplate.queryForList(
            "SELECT id FROM transactions WHERE owner_id = ? AND idempotency_key = ?",
            UUID.class, ownerId, idempotencyKey
        ).stream().findFirst();
    }

    /**
     * Applies a partial edit to an unpaired, live row. Null arguments keep the current value.
     */
    public int updateUnpaired(UUID ownerId, UUID transactionId, BigDecimal amount, LocalDate date,
                              String description, UUID categoryId) {
        return jdbcTemplate.update(
            "UPDATE transactions SET amount = COALESCE(?, amount), transaction_date = COALESCE(?, transaction_date), " +
            "description = COALESCE(?, description), category_id = COALESCE(?, category_id), " +
            "updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND owner_id = ? AND deleted_at IS NULL AND paired_transaction_id IS NULL",
            amount, date, description, categoryId, transactionId, ownerId
        );
    }

    public int softDeleteUnpaired(UUID ownerId, UUID transactionId) {
        return jdbcTemplate.update(
            "UPDATE transactions SET deleted_at = CURRENT_TIMESTAMP, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND owner_id = ? AND deleted_at IS NULL AND paired_transaction_id IS NULL",
            transactionId, ownerId
        );
    }

    /**
     * Soft-deletes live rows by id. Callers detach pair partners beforehand.
     */
    public int softDeleteByIds(UUID ownerId, Collection<UUID> transactionIds) {
        if (transactionIds.isEmpty()) {
            return 0;
        }
        return jdbcTemplate.update(
            "UPDATE transactions SET deleted_at = CURRENT_TIMESTAMP, updated_at = CURRENT_TIMESTAMP " +
            "WHERE owner_id = ? AND deleted_at IS NULL AND id IN (" + SqlLists.placeholders(transactionIds.size()) + ")",
            SqlLists.args(transactionIds, ownerId)
        );
    }

    public int reassignAccount(UUID ownerId, UUID fromAccountId, UUID toAccountId) {
        return jdbcTemplate.update(
            "UPDATE transactions SET account_id = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE owner_id = ? AND account_id = ? AND deleted_at IS NULL",
            toAccountId, ownerId, fromAccountId
        );
    }

    /**
     * Re-points every row of the category, soft-deleted ones included, so the
     * category itself can be removed.
     */
    public int reassignCategory(UUID ownerId, UUID fromCategoryId, UUID toCategoryId) {
        return jdbcTemplate.update(
            "UPDATE transactions SET category_id = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE owner_id = ? AND category_id = ?",
            toCategoryId, ownerId, fromCategoryId
        );
    }

    public int clearInvoice(UUID ownerId, UUID invoiceId) {
        return jdbcTemplate.update(
            "UPDATE transactions SET invoice_id = NULL, updated_at = CURRENT_TIMESTAMP " +
            "WHERE owner_id = ? AND invoice_id = ?",
            ownerId, invoiceId
        );
    }

    private RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> {
            Timestamp deletedAt = rs.getTimestamp("deleted_at");
            String systemKey = rs.getString("system_generated_key");
            return LedgerTransaction.builder()
                .id(UUID.fromString(rs.getString("id")))
                .ownerId(UUID.fromString(rs.getString("owner_id")))
                .accountId(UUID.fromString(rs.getString("account_id")))
                .categoryId(UUID.fromString(rs.getString("category_id")))
                .flowType(FlowType.valueOf(rs.getString("flow_type")))
                .amount(rs.getBigDecimal("amount"))
                .date(rs.getObject("transaction_date", LocalDate.class))
                .description(rs.getString("description"))
                .invoiceId(uuidOrNull(rs.getString("invoice_id")))
                .pairedTransactionId(uuidOrNull(rs.getString("paired_transaction_id")))
                .recurringTemplateId(uuidOrNull(rs.getString("recurring_template_id")))
                .systemGeneratedKey(systemKey != null ? LedgerTransaction.SystemGeneratedKey.fromKey(systemKey) : null)
                .deletedAt(deletedAt != null ? deletedAt.toInstant() : null)
                .build();
        };
    }

    private static UUID uuidOrNull(String value) {
        return value != null ? UUID.fromString(value) : null;
    }
}
