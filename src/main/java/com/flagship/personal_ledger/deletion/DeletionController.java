package com.flagship.personal_ledger.deletion;

import com.flagship.personal_ledger.common.exception.LedgerException;
import com.flagship.personal_ledger.deletion.dto.AccountDeletionResponse;
import com.flagship.personal_ledger.deletion.dto.CategoryDeletionResponse;
import com.flagship.personal_ledger.deletion.dto.TemplateDeletionResponse;
import com.flagship.personal_ledger.security.OwnerContext;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DeletionController {

    private final DeletionCoordinator deletionCoordinator;

    @DeleteMapping("/accounts/{id}")
    public ResponseEntity<AccountDeletionResponse> deleteAccount(
            @PathVariable("id") UUID id,
            @RequestParam(value = "strategy", defaultValue = "reassign") String strategy,
            @RequestParam(value = "target_account_id", required = false) UUID targetAccountId) {
        UUID ownerId = OwnerContext.requireOwnerId();
        switch (parseStrategy(strategy)) {
            case CASCADE:
                return ResponseEntity.ok(AccountDeletionResponse.from(
                    deletionCoordinator.deleteAccountCascade(ownerId, id)));
            case REASSIGN:
            default:
                return ResponseEntity.ok(AccountDeletionResponse.from(
                    deletionCoordinator.deleteAccountReassign(ownerId, id, targetAccountId)));
        }
    }

    @DeleteMapping("/categories/{id}")
    public ResponseEntity<CategoryDeletionResponse> deleteCategory(
            @PathVariable("id") UUID id,
            @RequestParam(value = "fallback_category_id", required = false) UUID fallbackCategoryId) {
        CategoryDeletionResult result = deletionCoordinator.deleteCategory(OwnerContext.requireOwnerId(), id,
            fallbackCategoryId);
        return ResponseEntity.ok(CategoryDeletionResponse.from(result));
    }

    @DeleteMapping("/invoices/{id}")
    public ResponseEntity<Map<String, Object>> deleteInvoice(@PathVariable("id") UUID id) {
        Instant deletedAt = deletionCoordinator.deleteInvoice(OwnerContext.requireOwnerId(), id);
        return ResponseEntity.ok(Map.of("invoice_id", id, "deleted_at", deletedAt));
    }

    @DeleteMapping("/recurring-templates/{id}")
    public ResponseEntity<TemplateDeletionResponse> deleteRecurringTemplate(
            @PathVariable("id") UUID id,
            @RequestParam(value = "also_delete_pair", defaultValue = "true") boolean alsoDeletePair) {
        TemplateDeletionResult result = deletionCoordinator.deleteRecurringTemplate(OwnerContext.requireOwnerId(),
            id, alsoDeletePair);
        return ResponseEntity.ok(TemplateDeletionResponse.from(result));
    }

    @DeleteMapping("/budgets/{id}")
    public ResponseEntity<Map<String, Object>> deleteBudget(@PathVariable("id") UUID id) {
        Instant deletedAt = deletionCoordinator.deleteBudget(OwnerContext.requireOwnerId(), id);
        return ResponseEntity.ok(Map.of("budget_id", id, "deleted_at", deletedAt));
    }

    private static DeletionStrategy parseStrategy(String strategy) {
        try {
            return DeletionStrategy.valueOf(strategy.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw LedgerException.invalidRequest("Unknown deletion strategy: " + strategy);
        }
    }
}
