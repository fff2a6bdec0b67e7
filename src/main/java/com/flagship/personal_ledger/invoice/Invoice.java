package com.flagship.personal_ledger.invoice;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An uploaded receipt. {@code extractedText} is whatever the OCR step returned.
 */
@Value
public class Invoice {
    UUID id;
    UUID ownerId;
    String storagePath;
    String extractedText;
    Instant createdAt;
    Instant deletedAt;

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
