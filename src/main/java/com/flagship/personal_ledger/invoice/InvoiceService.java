package com.flagship.personal_ledger.invoice;

import com.flagship.personal_ledger.common.exception.LedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.UUID;

/**
 * Invoice registration. The file is written before the row; if the
 * transaction rolls back the file is removed again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceService {

    private final InvoiceRepository invoiceRepository;
    private final InvoiceFileStorage fileStorage;

    @Transactional
    public Invoice register(UUID ownerId, String filename, byte[] content, String extractedText) {
        if (content == null || content.length == 0) {
            throw LedgerException.invalidRequest("Invoice file is empty");
        }

        String storagePath;
        try {
            storagePath = fileStorage.store(ownerId, filename, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store invoice file", e);
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status != STATUS_COMMITTED) {
                    deleteQuietly(storagePath);
                }
            }
        });

        UUID id = invoiceRepository.insert(ownerId, storagePath, extractedText);
        log.info("Invoice registered: invoiceId={}, bytes={}", id, content.length);
        return getInvoice(ownerId, id);
    }

    @Transactional(readOnly = true)
    public Invoice getInvoice(UUID ownerId, UUID invoiceId) {
        return invoiceRepository.findOwned(ownerId, invoiceId)
            .orElseThrow(() -> LedgerException.notFound("Invoice", invoiceId));
    }

    /**
     * Removes the stored file once the surrounding transaction has committed.
     */
    public void deleteFileAfterCommit(Invoice invoice) {
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                deleteQuietly(invoice.getStoragePath());
            }
        });
    }

    private void deleteQuietly(String storagePath) {
        try {
            fileStorage.delete(storagePath);
        } catch (IOException e) {
            log.warn("Failed to remove invoice file {}: {}", storagePath, e.getMessage());
        }
    }
}
