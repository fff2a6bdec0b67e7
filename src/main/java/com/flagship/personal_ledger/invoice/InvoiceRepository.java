package com.flagship.personal_ledger.invoice;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public class InvoiceRepository {

    private static final String SELECT_COLUMNS =
        "SELECT id, owner_id, storage_path, extracted_text, created_at, deleted_at FROM invoices ";

    private final JdbcTemplate jdbcTemplate;

    public InvoiceRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public UUID insert(UUID ownerId, String storagePath, String extractedText) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO invoices (id, owner_id, storage_path, extracted_text) VALUES (?, ?, ?, ?)",
            id, ownerId, storagePath, extractedText
        );
        return id;
    }

    public Optional<Invoice> findOwned(UUID ownerId, UUID invoiceId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE id = ? AND owner_id = ?",
            invoiceRowMapper(), invoiceId, ownerId
        ).stream().findFirst();
    }

    public Optional<Invoice> findActiveOwned(UUID ownerId, UUID invoiceId) {
        return findOwned(ownerId, invoiceId).filter(invoice -> !invoice.isDeleted());
    }

    public Instant softDelete(UUID ownerId, UUID invoiceId) {
        Instant deletedAt = Instant.now();
        jdbcTemplate.update(
            "UPDATE invoices SET deleted_at = ?, updated_at = ? WHERE id = ? AND owner_id = ? AND deleted_at IS NULL",
            Timestamp.from(deletedAt), Timestamp.from(deletedAt), invoiceId, ownerId
        );
        return deletedAt;
    }

    private RowMapper<Invoice> invoiceRowMapper() {
        return (rs, rowNum) -> {
            Timestamp deletedAt = rs.getTimestamp("deleted_at");
            return new Invoice(
                UUID.fromString(rs.getString("id")),
                UUID.fromString(rs.getString("owner_id")),
                rs.getString("storage_path"),
                rs.getString("extracted_text"),
                rs.getTimestamp("created_at").toInstant(),
                deletedAt != null ? deletedAt.toInstant() : null
            );
        };
    }
}
