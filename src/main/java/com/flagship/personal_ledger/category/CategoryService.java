package com.flagship.personal_ledger.category;

import com.flagship.personal_ledger.common.FlowType;
import com.flagship.personal_ledger.common.exception.LedgerErrorCode;
import com.flagship.personal_ledger.common.exception.LedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * User category management. Deletion lives in the deletion coordinator
 * because it re-points transactions and templates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CategoryService {

    private final CategoryRepository categoryRepository;

    @Transactional
    public Category createCategory(UUID ownerId, String name, FlowType flowType) {
        if (name == null || name.isBlank()) {
            throw LedgerException.invalidRequest("Category name is required");
        }
        if (flowType == null) {
            throw LedgerException.invalidRequest("Category flow type is required");
        }
        UUID id = categoryRepository.insert(ownerId, name.trim(), flowType);
        log.info("Category created: categoryId={}, flowType={}", id, flowType);
        return new Category(id, ownerId, null, name.trim(), flowType);
    }

    /**
     * Renames a user category. The flow type is fixed at creation.
     */
    @Transactional
    public Category renameCategory(UUID ownerId, UUID categoryId, String name) {
        if (name == null || name.isBlank()) {
            throw LedgerException.invalidRequest("Category name is required");
        }
        Category category = categoryRepository.findVisible(ownerId, categoryId)
            .orElseThrow(() -> LedgerException.notFound("Category", categoryId));
        if (category.isSystem()) {
            throw new LedgerException(LedgerErrorCode.SYSTEM_CATEGORY_IMMUTABLE,
                "System category cannot be modified: " + category.getSystemKey().key());
        }
        categoryRepository.rename(ownerId, categoryId, name.trim());
        return new Category(categoryId, ownerId, null, name.trim(), category.getFlowType());
    }
}
