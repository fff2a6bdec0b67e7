package com.flagship.personal_ledger.account;

import com.flagship.personal_ledger.account.dto.AccountResponse;
import com.flagship.personal_ledger.account.dto.AdjustBalanceRequest;
import com.flagship.personal_ledger.account.dto.CreateAccountRequest;
import com.flagship.personal_ledger.reconcile.CacheReconciler;
import com.flagship.personal_ledger.security.OwnerContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;
    private final CacheReconciler cacheReconciler;

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        Account account = accountService.createAccount(OwnerContext.requireOwnerId(), request.getName(),
            request.getType(), request.getCurrency(), request.getInitialBalance());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(AccountResponse.from(accountService.getAccount(OwnerContext.requireOwnerId(), id)));
    }

    @PostMapping("/{id}/balance-adjustments")
    public ResponseEntity<AccountResponse> adjustBalance(@PathVariable("id") UUID id,
                                                         @Valid @RequestBody AdjustBalanceRequest request) {
        Account account = accountService.adjustBalance(OwnerContext.requireOwnerId(), id,
            request.getTargetBalance(), request.getDate());
        return ResponseEntity.ok(AccountResponse.from(account));
    }

    /**
     * Recomputes the cached balance from the account's transactions.
     */
    @PostMapping("/{id}/reconcile")
    public ResponseEntity<Map<String, Object>> reconcile(@PathVariable("id") UUID id) {
        BigDecimal balance = cacheReconciler.recomputeAccountBalance(OwnerContext.requireOwnerId(), id);
        return ResponseEntity.ok(Map.of("account_id", id, "balance", balance));
    }
}
