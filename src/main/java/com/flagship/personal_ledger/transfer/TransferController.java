package com.flagship.personal_ledger.transfer;

import com.flagship.personal_ledger.security.OwnerContext;
import com.flagship.personal_ledger.transfer.dto.CreateRecurringTransferRequest;
import com.flagship.personal_ledger.transfer.dto.CreateTransferRequest;
import com.flagship.personal_ledger.transfer.dto.RecurringTransferResponse;
import com.flagship.personal_ledger.transfer.dto.TransferDeletionResponse;
import com.flagship.personal_ledger.transfer.dto.TransferResponse;
import com.flagship.personal_ledger.transfer.dto.UpdateTransferRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Transfers and recurring transfers. Either leg id addresses a transfer.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class TransferController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final PairingManager pairingManager;

    /**
     * Creates a transfer. With an Idempotency-Key header a repeated request
     * returns the original transfer with 200 instead of 201.
     */
    @PostMapping("/api/transfers")
    public ResponseEntity<TransferResponse> createTransfer(
            @Valid @RequestBody CreateTransferRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received transfer request: amount={}, date={}, idempotencyKey={}",
            request.getAmount(), request.getDate(), idempotencyKey);

        Transfer transfer = pairingManager.createTransfer(OwnerContext.requireOwnerId(),
            request.getFromAccountId(), request.getToAccountId(), request.getAmount(),
            request.getDate(), request.getDescription(), idempotencyKey);

        return ResponseEntity.status(transfer.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(TransferResponse.from(transfer));
    }

    @GetMapping("/api/transfers/{legId}")
    public ResponseEntity<TransferResponse> getTransfer(@PathVariable("legId") UUID legId) {
        return ResponseEntity.ok(TransferResponse.from(
            pairingManager.getTransfer(OwnerContext.requireOwnerId(), legId)));
    }

    @PatchMapping("/api/transfers/{legId}")
    public ResponseEntity<TransferResponse> updateTransfer(@PathVariable("legId") UUID legId,
                                                           @Valid @RequestBody UpdateTransferRequest request) {
        Transfer transfer = pairingManager.updateTransfer(OwnerContext.requireOwnerId(), legId,
            request.getAmount(), request.getDate(), request.getDescription());
        return ResponseEntity.ok(TransferResponse.from(transfer));
    }

    @DeleteMapping("/api/transfers/{legId}")
    public ResponseEntity<TransferDeletionResponse> deleteTransfer(@PathVariable("legId") UUID legId) {
        TransferDeletion deletion = pairingManager.deleteTransfer(OwnerContext.requireOwnerId(), legId);
        return ResponseEntity.ok(TransferDeletionResponse.from(deletion));
    }

    @PostMapping("/api/recurring-transfers")
    public ResponseEntity<RecurringTransferResponse> createRecurringTransfer(
            @Valid @RequestBody CreateRecurringTransferRequest request) {
        RecurringTransfer transfer = pairingManager.createRecurringTransfer(OwnerContext.requireOwnerId(),
            request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(RecurringTransferResponse.from(transfer));
    }
}
