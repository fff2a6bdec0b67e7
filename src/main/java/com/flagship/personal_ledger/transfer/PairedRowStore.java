package com.flagship.personal_ledger.transfer;

import com.flagship.personal_ledger.common.SqlLists;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * The only SQL that writes {@code paired_transaction_id} and
 * {@code paired_template_id}, and the only SQL that edits or deletes a paired
 * transaction row. Package-private: everything goes through {@link PairingManager}.
 */
@Repository
class PairedRowStore {

    private final JdbcTemplate jdbcTemplate;

    PairedRowStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    int linkTransactions(UUID ownerId, UUID firstId, UUID secondId) {
        return jdbcTemplate.update(
            "UPDATE transactions SET paired_transaction_id = CASE WHEN id = ? THEN ?::uuid ELSE ?::uuid END, " +
            "updated_at = CURRENT_TIMESTAMP WHERE owner_id = ? AND id IN (?, ?)",
            firstId, secondId, firstId, ownerId, firstId, secondId
        );
    }

    /**
     * Same field changes on both legs; null keeps the current value.
     */
    int updateLegs(UUID ownerId, Collection<UUID> legIds, BigDecimal amount, LocalDate date, String description) {
        return jdbcTemplate.update(
            "UPDATE transactions SET amount = COALESCE(?, amount), transaction_date = COALESCE(?, transaction_date), " +
            "description = COALESCE(?, description), updated_at = CURRENT_TIMESTAMP " +
            "WHERE owner_id = ? AND deleted_at IS NULL AND id IN (" + SqlLists.placeholders(legIds.size()) + ")",
            SqlLists.args(legIds, amount, date, description, ownerId)
        );
    }

    /**
     * Soft-deletes the given legs and drops their pair references.
     */
    int softDeleteLegs(UUID ownerId, Collection<UUID> legIds) {
        return jdbcTemplate.update(
            "UPDATE transactions SET deleted_at = CURRENT_TIMESTAMP, paired_transaction_id = NULL, " +
            "updated_at = CURRENT_TIMESTAMP " +
            "WHERE owner_id = ? AND deleted_at IS NULL AND id IN (" + SqlLists.placeholders(legIds.size()) + ")",
            SqlLists.args(legIds, ownerId)
        );
    }

    /**
     * Clears references held by rows outside {@code ids} that point into {@code ids}.
     *
     * @return number of partner rows detached
     */
    int clearTransactionRefsPointingTo(UUID ownerId, Collection<UUID> ids) {
        String in = SqlLists.placeholders(ids.size());
        List<Object> args = new ArrayList<>();
        args.add(ownerId);
        args.addAll(ids);
        args.addAll(ids);
        return jdbcTemplate.update(
            "UPDATE transactions SET paired_transaction_id = NULL, updated_at = CURRENT_TIMESTAMP " +
            "WHERE owner_id = ? AND paired_transaction_id IN (" + in + ") AND id NOT IN (" + in + ")",
            args.toArray()
        );
    }

    int clearTransactionRefs(UUID ownerId, Collection<UUID> ids) {
        return jdbcTemplate.update(
            "UPDATE transactions SET paired_transaction_id = NULL, updated_at = CURRENT_TIMESTAMP " +
            "WHERE owner_id = ? AND paired_transaction_id IS NOT NULL " +
            "AND id IN (" + SqlLists.placeholders(ids.size()) + ")",
            SqlLists.args(ids, ownerId)
        );
    }

    int linkTemplates(UUID ownerId, UUID firstId, UUID secondId) {
        return jdbcTemplate.update(
            "UPDATE recurring_templates SET paired_template_id = CASE WHEN id = ? THEN ?::uuid ELSE ?::uuid END, " +
            "updated_at = CURRENT_TIMESTAMP WHERE owner_id = ? AND id IN (?, ?)",
            firstId, secondId, firstId, ownerId, firstId, secondId
        );
    }

    int clearTemplateRefsPointingTo(UUID ownerId, Collection<UUID> ids) {
        String in = SqlLists.placeholders(ids.size());
        List<Object> args = new ArrayList<>();
        args.add(ownerId);
        args.addAll(ids);
        args.addAll(ids);
        return jdbcTemplate.update(
            "UPDATE recurring_templates SET paired_template_id = NULL, updated_at = CURRENT_TIMESTAMP " +
            "WHERE owner_id = ? AND paired_template_id IN (" + in + ") AND id NOT IN (" + in + ")",
            args.toArray()
        );
    }

    int clearTemplateRefs(UUID ownerId, Collection<UUID> ids) {
        return jdbcTemplate.update(
            "UPDATE recurring_templates SET paired_template_id = NULL, updated_at = CURRENT_TIMESTAMP " +
            "WHERE owner_id = ? AND paired_template_id IS NOT NULL " +
            "AND id IN (" + SqlLists.placeholders(ids.size()) + ")",
            SqlLists.args(ids, ownerId)
        );
    }
}
