package com.flagship.personal_ledger.budget;

import com.flagship.personal_ledger.budget.dto.BudgetResponse;
import com.flagship.personal_ledger.budget.dto.CreateBudgetRequest;
import com.flagship.personal_ledger.reconcile.CacheReconciler;
import com.flagship.personal_ledger.security.OwnerContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/budgets")
@RequiredArgsConstructor
public class BudgetController {

    private final BudgetService budgetService;
    private final CacheReconciler cacheReconciler;

    @PostMapping
    public ResponseEntity<BudgetResponse> createBudget(@Valid @RequestBody CreateBudgetRequest request) {
        UUID ownerId = OwnerContext.requireOwnerId();
        Budget budget = budgetService.createBudget(ownerId, request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(BudgetResponse.from(budget, budgetService.getLinkedCategories(ownerId, budget.getId())));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BudgetResponse> getBudget(@PathVariable("id") UUID id) {
        UUID ownerId = OwnerContext.requireOwnerId();
        Budget budget = budgetService.getBudget(ownerId, id);
        return ResponseEntity.ok(BudgetResponse.from(budget, budgetService.getLinkedCategories(ownerId, id)));
    }

    /**
     * Recomputes consumption over an explicit window, or over the current cycle
     * when no window is given.
     */
    @PostMapping("/{id}/reconcile")
    public ResponseEntity<Map<String, Object>> reconcile(
            @PathVariable("id") UUID id,
            @RequestParam(value = "period_start", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate periodStart,
            @RequestParam(value = "period_end", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate periodEnd) {
        UUID ownerId = OwnerContext.requireOwnerId();
        BigDecimal consumption = (periodStart == null && periodEnd == null)
            ? cacheReconciler.recomputeBudget(ownerId, id)
            : cacheReconciler.recomputeBudgetConsumption(ownerId, id, periodStart, periodEnd);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("budget_id", id);
        body.put("period_start", periodStart);
        body.put("period_end", periodEnd);
        body.put("consumption", consumption);
        return ResponseEntity.ok(body);
    }
}
