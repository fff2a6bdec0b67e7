package com.flagship.personal_ledger.transaction;

import com.flagship.personal_ledger.security.OwnerContext;
import com.flagship.personal_ledger.transaction.dto.CreateTransactionRequest;
import com.flagship.personal_ledger.transaction.dto.TransactionResponse;
import com.flagship.personal_ledger.transaction.dto.UpdateTransactionRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private final TransactionService transactionService;

    @PostMapping
    public ResponseEntity<TransactionResponse> create(@Valid @RequestBody CreateTransactionRequest request) {
        LedgerTransaction transaction = transactionService.create(OwnerContext.requireOwnerId(), request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(transaction));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransactionResponse> get(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(TransactionResponse.from(
            transactionService.getTransaction(OwnerContext.requireOwnerId(), id)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<TransactionResponse> update(@PathVariable("id") UUID id,
                                                      @Valid @RequestBody UpdateTransactionRequest request) {
        LedgerTransaction transaction = transactionService.update(OwnerContext.requireOwnerId(), id,
            request.getAmount(), request.getDate(), request.getDescription(), request.getCategoryId());
        return ResponseEntity.ok(TransactionResponse.from(transaction));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") UUID id) {
        transactionService.delete(OwnerContext.requireOwnerId(), id);
        return ResponseEntity.noContent().build();
    }
}
