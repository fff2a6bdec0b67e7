package com.flagship.personal_ledger.budget;

import com.flagship.personal_ledger.common.SqlLists;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to budgets and their category links. {@code cached_consumption}
 * is read here and written by the reconciler only.
 */
@Repository
public class BudgetRepository {

    private static final String SELECT_COLUMNS =
        "SELECT b.id, b.owner_id, b.name, b.limit_amount, b.frequency, b.interval_count, b.start_date, b.end_date, " +
        "b.is_active, b.cached_consumption, b.deleted_at FROM budgets b ";

    private final JdbcTemplate jdbcTemplate;

    public BudgetRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public UUID insert(UUID ownerId, String name, BigDecimal limitAmount, Budget.BudgetFrequency frequency,
                       int interval, LocalDate startDate, LocalDate endDate) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO budgets (id, owner_id, name, limit_amount, frequency, interval_count, start_date, end_date) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
            id, ownerId, name, limitAmount, frequency.name(), interval, startDate, endDate
        );
        return id;
    }

    public void linkCategory(UUID ownerId, UUID budgetId, UUID categoryId) {
        jdbcTemplate.update(
            "INSERT INTO budget_categories (id, owner_id, budget_id, category_id) VALUES (?, ?, ?, ?) " +
            "ON CONFLICT (budget_id, category_id) DO NOTHING",
            UUID.randomUUID(), ownerId, budgetId, categoryId
        );
    }

    public Optional<Budget> findOwned(UUID ownerId, UUID budgetId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE b.id = ? AND b.owner_id = ?",
            budgetRowMapper(), budgetId, ownerId
        ).stream().findFirst();
    }

    public Optional<Budget> findLiveOwned(UUID ownerId, UUID budgetId) {
        return findOwned(ownerId, budgetId).filter(budget -> budget.getDeletedAt() == null);
    }

    /**
     * Row-locks the owner's budgets in id order and returns the ids locked.
     */
    public List<UUID> lockOwned(UUID ownerId, Collection<UUID> budgetIds) {
        if (budgetIds.isEmpty()) {
            return List.of();
        }
        return jdbcTemplate.queryForList(
            "SELECT id FROM budgets WHERE owner_id = ? AND id IN (" + SqlLists.placeholders(budgetIds.size()) +
            ") ORDER BY id FOR NO KEY UPDATE",
            UUID.class, SqlLists.args(budgetIds, ownerId)
        );
    }

    public List<Budget> findActiveByOwner(UUID ownerId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE b.owner_id = ? AND b.is_active AND b.deleted_at IS NULL ORDER BY b.created_at",
            budgetRowMapper(), ownerId
        );
    }

    /**
     * Active budgets of the owner linked to at least one of the categories.
     */
    public List<Budget> findActiveLinkedToCategories(UUID ownerId, Collection<UUID> categoryIds) {
        if (categoryIds.isEmpty()) {
            return List.of();
        }
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE b.owner_id = ? AND b.is_active AND b.deleted_at IS NULL AND EXISTS (" +
            "SELECT 1 FROM budget_categories bc WHERE bc.budget_id = b.id AND bc.category_id IN (" +
            SqlLists.placeholders(categoryIds.size()) + ")) ORDER BY b.id",
            budgetRowMapper(), SqlLists.args(categoryIds, ownerId)
        );
    }

    public List<UUID> findLinkedCategoryIds(UUID budgetId) {
        return jdbcTemplate.queryForList(
            "SELECT category_id FROM budget_categories WHERE budget_id = ? ORDER BY category_id",
            UUID.class, budgetId
        );
    }

    public int deleteLinksForCategory(UUID ownerId, UUID categoryId) {
        return jdbcTemplate.update(
            "DELETE FROM budget_categories WHERE owner_id = ? AND category_id = ?",
            ownerId, categoryId
        );
    }

    public int deleteLinksForBudget(UUID ownerId, UUID budgetId) {
        return jdbcTemplate.update(
            "DELETE FROM budget_categories WHERE owner_id = ? AND budget_id = ?",
            ownerId, budgetId
        );
    }

    /**
     * Deactivates and soft-deletes the budget.
     */
    public Instant softDelete(UUID ownerId, UUID budgetId) {
        Instant deletedAt = Instant.now();
        jdbcTemplate.update(
            "UPDATE budgets SET deleted_at = ?, is_active = FALSE, updated_at = ? " +
            "WHERE id = ? AND owner_id = ? AND deleted_at IS NULL",
            Timestamp.from(deletedAt), Timestamp.from(deletedAt), budgetId, ownerId
        );
        return deletedAt;
    }

    public List<UUID> findOwnerIds() {
        return jdbcTemplate.queryForList(
            "SELECT DISTINCT owner_id FROM budgets WHERE is_active AND deleted_at IS NULL", UUID.class);
    }

    private RowMapper<Budget> budgetRowMapper() {
        return (rs, rowNum) -> {
            Timestamp deletedAt = rs.getTimestamp("deleted_at");
            return Budget.builder()
                .id(UUID.fromString(rs.getString("id")))
                .ownerId(UUID.fromString(rs.getString("owner_id")))
                .name(rs.getString("name"))
                .limitAmount(rs.getBigDecimal("limit_amount"))
                .frequency(Budget.BudgetFrequency.valueOf(rs.getString("frequency")))
                .interval(rs.getInt("interval_count"))
                .startDate(rs.getObject("start_date", LocalDate.class))
                .endDate(rs.getObject("end_date", LocalDate.class))
                .active(rs.getBoolean("is_active"))
                .cachedConsumption(rs.getBigDecimal("cached_consumption"))
                .deletedAt(deletedAt != null ? deletedAt.toInstant() : null)
                .build();
        };
    }
}
