package com.flagship.personal_ledger.category;

import com.flagship.personal_ledger.common.FlowType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public class CategoryRepository {

    private static final String SELECT_COLUMNS =
        "SELECT id, owner_id, system_key, name, flow_type FROM categories ";

    private final JdbcTemplate jdbcTemplate;

    public CategoryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public UUID insert(UUID ownerId, String name, FlowType flowType) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO categories (id, owner_id, name, flow_type) VALUES (?, ?, ?, ?)",
            id, ownerId, name, flowType.name()
        );
        return id;
    }

    /**
     * Finds a category the owner may use: one of their own, or a system category.
     */
    public Optional<Category> findVisible(UUID ownerId, UUID categoryId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE id = ? AND (owner_id = ? OR owner_id IS NULL)",
            categoryRowMapper(), categoryId, ownerId
        ).stream().findFirst();
    }

    /**
     * Looks up a seeded system category. A missing row means the seed migration did not run.
     */
    public Category findSystem(Category.SystemCategoryKey key, FlowType flowType) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE system_key = ? AND flow_type = ? AND owner_id IS NULL",
            categoryRowMapper(), key.key(), flowType.name()
        ).stream().findFirst().orElseThrow(() -> new IllegalStateException(
            "System category missing: " + key.key() + "/" + flowType));
    }

    public int countSystemCategories() {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM categories WHERE owner_id IS NULL AND system_key IS NOT NULL",
            Integer.class);
        return count != null ? count : 0;
    }

    public int rename(UUID ownerId, UUID categoryId, String name) {
        return jdbcTemplate.update(
            "UPDATE categories SET name = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ? AND owner_id = ?",
            name, categoryId, ownerId
        );
    }

    /**
     * Hard-deletes a user category. Callers must re-point references first.
     */
    public int delete(UUID ownerId, UUID categoryId) {
        return jdbcTemplate.update(
            "DELETE FROM categories WHERE id = ? AND owner_id = ?",
            categoryId, ownerId
        );
    }

    private RowMapper<Category> categoryRowMapper() {
        return (rs, rowNum) -> {
            String ownerId = rs.getString("owner_id");
            String systemKey = rs.getString("system_key");
            return new Category(
                UUID.fromString(rs.getString("id")),
                ownerId != null ? UUID.fromString(ownerId) : null,
                systemKey != null ? Category.SystemCategoryKey.fromKey(systemKey) : null,
                rs.getString("name"),
                FlowType.valueOf(rs.getString("flow_type"))
            );
        };
    }
}
