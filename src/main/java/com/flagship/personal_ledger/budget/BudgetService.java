package com.flagship.personal_ledger.budget;

import com.flagship.personal_ledger.category.CategoryRepository;
import com.flagship.personal_ledger.common.exception.LedgerException;
import com.flagship.personal_ledger.reconcile.CacheReconciler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetService {

    private final BudgetRepository budgetRepository;
    private final CategoryRepository categoryRepository;
    private final CacheReconciler cacheReconciler;

    /**
     * Creates a budget over the given categories and computes its consumption
     * for the current cycle.
     *
     * @throws LedgerException invalid_request for a bad limit, interval or date range;
     *         not_found for a category the owner cannot see
     */
    @Transactional
    public Budget createBudget(UUID ownerId, BudgetCommand command) {
        if (command.getName() == null || command.getName().isBlank()) {
            throw LedgerException.invalidRequest("Budget name is required");
        }
        if (command.getLimitAmount() == null || command.getLimitAmount().signum() <= 0) {
            throw LedgerException.invalidRequest("Budget limit must be positive");
        }
        if (command.getFrequency() == null || command.getStartDate() == null) {
            throw LedgerException.invalidRequest("Budget frequency and start date are required");
        }
        if (command.getInterval() < 1) {
            throw LedgerException.invalidRequest("Budget interval must be at least 1");
        }
        if (command.getEndDate() != null && command.getEndDate().isBefore(command.getStartDate())) {
            throw LedgerException.invalidRequest("Budget end date is before its start date");
        }

        Set<UUID> categoryIds = new LinkedHashSet<>(
            command.getCategoryIds() != null ? command.getCategoryIds() : List.of());
        for (UUID categoryId : categoryIds) {
            categoryRepository.findVisible(ownerId, categoryId)
                .orElseThrow(() -> LedgerException.notFound("Category", categoryId));
        }

        UUID budgetId = budgetRepository.insert(ownerId, command.getName().trim(), command.getLimitAmount(),
            command.getFrequency(), command.getInterval(), command.getStartDate(), command.getEndDate());
        for (UUID categoryId : categoryIds) {
            budgetRepository.linkCategory(ownerId, budgetId, categoryId);
        }
        cacheReconciler.recomputeBudget(ownerId, budgetId);

        log.info("Budget created: budgetId={}, frequency={}, categories={}", budgetId, command.getFrequency(),
            categoryIds.size());
        return getBudget(ownerId, budgetId);
    }

    @Transactional(readOnly = true)
    public Budget getBudget(UUID ownerId, UUID budgetId) {
        return budgetRepository.findOwned(ownerId, budgetId)
            .orElseThrow(() -> LedgerException.notFound("Budget", budgetId));
    }

    @Transactional(readOnly = true)
    public List<UUID> getLinkedCategories(UUID ownerId, UUID budgetId) {
        getBudget(ownerId, budgetId);
        return budgetRepository.findLinkedCategoryIds(budgetId);
    }
}
