package com.flagship.personal_ledger.recurring;

import com.flagship.personal_ledger.common.FlowType;
import com.flagship.personal_ledger.common.SqlLists;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to recurring templates.
 *
 * Cursor and activation writes are package-private, so only the materializer
 * in this package moves {@code next_run_date}. Pair links are written by the
 * pairing manager.
 */
@Repository
public class RecurringTemplateRepository {

    private static final String SELECT_COLUMNS =
        "SELECT id, owner_id, account_id, category_id, flow_type, amount, description, frequency, interval_count, " +
        "by_weekday, by_monthday, start_date, next_run_date, end_date, is_active, paired_template_id, deleted_at " +
        "FROM recurring_templates ";

    private final JdbcTemplate jdbcTemplate;

    public RecurringTemplateRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public UUID insert(NewTemplate template) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO recurring_templates (id, owner_id, account_id, category_id, flow_type, amount, description, " +
            "frequency, interval_count, by_weekday, by_monthday, start_date, next_run_date, end_date) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::integer[], ?::integer[], ?, ?, ?)",
            id,
            template.getOwnerId(),
            template.getAccountId(),
            template.getCategoryId(),
            template.getFlowType().name(),
            template.getAmount(),
            template.getDescription(),
            template.getFrequency().name(),
            template.getInterval(),
            SqlLists.intArrayLiteral(template.getByWeekday()),
            SqlLists.intArrayLiteral(template.getByMonthday()),
            template.getStartDate(),
            template.getFirstRunDate(),
            template.getEndDate()
        );
        return id;
    }

    public Optional<RecurringTemplate> findOwned(UUID ownerId, UUID templateId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE id = ? AND owner_id = ?",
            templateRowMapper(), templateId, ownerId
        ).stream().findFirst();
    }

    public Optional<RecurringTemplate> findActiveOwned(UUID ownerId, UUID templateId) {
        return findOwned(ownerId, templateId).filter(template -> !template.isDeleted());
    }

    /**
     * Locks the owner's templates with the given ids in id order.
     */
    public List<RecurringTemplate> lockOwned(UUID ownerId, Collection<UUID> templateIds) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE owner_id = ? AND id IN (" + SqlLists.placeholders(templateIds.size()) + ") " +
            "ORDER BY id FOR UPDATE",
            templateRowMapper(), SqlLists.args(templateIds, ownerId)
        );
    }

    public List<UUID> findDueTemplateIds(UUID ownerId, LocalDate asOf) {
        return jdbcTemplate.queryForList(
            "SELECT id FROM recurring_templates " +
            "WHERE owner_id = ? AND is_active AND deleted_at IS NULL AND next_run_date <= ? ORDER BY id",
            UUID.class, ownerId, asOf
        );
    }

    public List<UUID> findOwnersWithDueTemplates(LocalDate asOf) {
        return jdbcTemplate.queryForList(
            "SELECT DISTINCT owner_id FROM recurring_templates " +
            "WHERE is_active AND deleted_at IS NULL AND next_run_date <= ?",
            UUID.class, asOf
        );
    }

    public List<UUID> findLiveIdsByAccount(UUID ownerId, UUID accountId) {
        return jdbcTemplate.queryForList(
            "SELECT id FROM recurring_templates WHERE owner_id = ? AND account_id = ? AND deleted_at IS NULL",
            UUID.class, ownerId, accountId
        );
    }

    /**
     * Single write path for the materialization cursor.
     */
    int advanceCursor(UUID ownerId, UUID templateId, LocalDate nextRunDate, boolean active) {
        return jdbcTemplate.update(
            "UPDATE recurring_templates SET next_run_date = ?, is_active = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND owner_id = ? AND deleted_at IS NULL",
            nextRunDate, active, templateId, ownerId
        );
    }

    int deactivate(UUID ownerId, Collection<UUID> templateIds) {
        return jdbcTemplate.update(
            "UPDATE recurring_templates SET is_active = FALSE, updated_at = CURRENT_TIMESTAMP " +
            "WHERE owner_id = ? AND deleted_at IS NULL AND id IN (" + SqlLists.placeholders(templateIds.size()) + ")",
            SqlLists.args(templateIds, ownerId)
        );
    }

    public int reassignAccount(UUID ownerId, UUID fromAccountId, UUID toAccountId) {
        return jdbcTemplate.update(
            "UPDATE recurring_templates SET account_id = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE owner_id = ? AND account_id = ? AND deleted_at IS NULL",
            toAccountId, ownerId, fromAccountId
        );
    }

    /**
     * Re-points every template of the category, soft-deleted ones included.
     */
    public int reassignCategory(UUID ownerId, UUID fromCategoryId, UUID toCategoryId) {
        return jdbcTemplate.update(
            "UPDATE recurring_templates SET category_id = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE owner_id = ? AND category_id = ?",
            toCategoryId, ownerId, fromCategoryId
        );
    }

    /**
     * Deactivates and soft-deletes live templates. Transactions already
     * materialized from them are left untouched.
     */
    public Instant softDeleteByIds(UUID ownerId, Collection<UUID> templateIds) {
        Instant deletedAt = Instant.now();
        if (templateIds.isEmpty()) {
            return deletedAt;
        }
        jdbcTemplate.update(
            "UPDATE recurring_templates SET deleted_at = ?, is_active = FALSE, updated_at = ? " +
            "WHERE owner_id = ? AND deleted_at IS NULL AND id IN (" + SqlLists.placeholders(templateIds.size()) + ")",
            SqlLists.args(templateIds, Timestamp.from(deletedAt), Timestamp.from(deletedAt), ownerId)
        );
        return deletedAt;
    }

    private RowMapper<RecurringTemplate> templateRowMapper() {
        return (rs, rowNum) -> {
            Timestamp deletedAt = rs.getTimestamp("deleted_at");
            String pairedId = rs.getString("paired_template_id");
            return RecurringTemplate.builder()
                .id(UUID.fromString(rs.getString("id")))
                .ownerId(UUID.fromString(rs.getString("owner_id")))
                .accountId(UUID.fromString(rs.getString("account_id")))
                .categoryId(UUID.fromString(rs.getString("category_id")))
                .flowType(FlowType.valueOf(rs.getString("flow_type")))
                .amount(rs.getBigDecimal("amount"))
                .description(rs.getString("description"))
                .frequency(Frequency.valueOf(rs.getString("frequency")))
                .interval(rs.getInt("interval_count"))
                .byWeekday(toIntList(rs.getArray("by_weekday")))
                .byMonthday(toIntList(rs.getArray("by_monthday")))
                .startDate(rs.getObject("start_date", LocalDate.class))
                .nextRunDate(rs.getObject("next_run_date", LocalDate.class))
                .endDate(rs.getObject("end_date", LocalDate.class))
                .active(rs.getBoolean("is_active"))
                .pairedTemplateId(pairedId != null ? UUID.fromString(pairedId) : null)
                .deletedAt(deletedAt != null ? deletedAt.toInstant() : null)
                .build();
        };
    }

    private static List<Integer> toIntList(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        Integer[] values = (Integer[]) array.getArray();
        return Arrays.asList(values);
    }
}
