package com.flagship.personal_ledger.account;

import com.flagship.personal_ledger.common.SqlLists;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the accounts table. Every lookup is scoped to the owner.
 *
 * There is no write path for {@code cached_balance} here.
 */
@Repository
public class AccountRepository {

    private static final String SELECT_COLUMNS =
        "SELECT id, owner_id, name, account_type, currency, cached_balance, created_at, deleted_at FROM accounts ";

    private final JdbcTemplate jdbcTemplate;

    public AccountRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public UUID insert(UUID ownerId, String name, Account.AccountType type, String currency) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO accounts (id, owner_id, name, account_type, currency) VALUES (?, ?, ?, ?, ?)",
            id, ownerId, name, type.name(), currency
        );
        return id;
    }

    /**
     * Finds an account of the owner, including soft-deleted ones.
     */
    public Optional<Account> findOwned(UUID ownerId, UUID accountId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE id = ? AND owner_id = ?",
            accountRowMapper(), accountId, ownerId
        ).stream().findFirst();
    }

    public Optional<Account> findActiveOwned(UUID ownerId, UUID accountId) {
        return findOwned(ownerId, accountId).filter(account -> !account.isDeleted());
    }

    /**
     * Row-locks the owner's accounts in id order and returns the ids locked.
     *
     * NO KEY UPDATE does not conflict with the KEY SHARE locks that transaction
     * inserts take through the foreign key, so writers that inserted rows into
     * both accounts can still queue here in a single order.
     */
    public List<UUID> lockOwned(UUID ownerId, Collection<UUID> accountIds) {
        if (accountIds.isEmpty()) {
            return List.of();
        }
        return jdbcTemplate.queryForList(
            "SELECT id FROM accounts WHERE owner_id = ? AND id IN (" + SqlLists.placeholders(accountIds.size()) +
            ") ORDER BY id FOR NO KEY UPDATE",
            UUID.class, SqlLists.args(accountIds, ownerId)
        );
    }

    public List<UUID> lockAllOwned(UUID ownerId) {
        return jdbcTemplate.queryForList(
            "SELECT id FROM accounts WHERE owner_id = ? ORDER BY id FOR NO KEY UPDATE", UUID.class, ownerId);
    }

    public List<Account> findActiveByOwner(UUID ownerId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE owner_id = ? AND deleted_at IS NULL ORDER BY created_at",
            accountRowMapper(), ownerId
        );
    }

    /**
     * Soft-deletes the account and returns the deletion timestamp.
     */
    public Instant softDelete(UUID ownerId, UUID accountId) {
        Instant deletedAt = Instant.now();
        jdbcTemplate.update(
            "UPDATE accounts SET deleted_at = ?, updated_at = ? WHERE id = ? AND owner_id = ? AND deleted_at IS NULL",
            Timestamp.from(deletedAt), Timestamp.from(deletedAt), accountId, ownerId
        );
        return deletedAt;
    }

    public List<UUID> findOwnerIds() {
        return jdbcTemplate.queryForList(
            "SELECT DISTINCT owner_id FROM accounts WHERE deleted_at IS NULL", UUID.class);
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> {
            Timestamp deletedAt = rs.getTimestamp("deleted_at");
            return new Account(
                UUID.fromString(rs.getString("id")),
                UUID.fromString(rs.getString("owner_id")),
                rs.getString("name"),
                Account.AccountType.valueOf(rs.getString("account_type")),
                rs.getString("currency"),
                rs.getBigDecimal("cached_balance"),
                rs.getTimestamp("created_at").toInstant(),
                deletedAt != null ? deletedAt.toInstant() : null
            );
        };
    }
}
