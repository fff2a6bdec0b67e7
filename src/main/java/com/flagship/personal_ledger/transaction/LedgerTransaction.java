package com.flagship.personal_ledger.transaction;

import com.flagship.personal_ledger.common.FlowType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A single ledger row. Amounts are non-negative; the flow type gives the sign.
 *
 * A row with {@code pairedTransactionId} is one leg of a transfer and can only
 * be changed through the pairing manager.
 */
@Value
@Builder
public class LedgerTransaction {
    UUID id;
    UUID ownerId;
    UUID accountId;
    UUID categoryId;
    FlowType flowType;
    BigDecimal amount;
    LocalDate date;
    String description;
    UUID invoiceId;
    UUID pairedTransactionId;
    UUID recurringTemplateId;
    SystemGeneratedKey systemGeneratedKey;
    Instant deletedAt;

    public boolean isPaired() {
        return pairedTransactionId != null;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    /**
     * Signed effect of this row on its account balance.
     */
    public BigDecimal signedAmount() {
        return flowType.signed(amount);
    }

    /**
     * Provenance marker for rows the system wrote on the user's behalf.
     */
    public enum SystemGeneratedKey {
        RECURRING_SYNC("recurring_sync"),
        INVOICE_OCR("invoice_ocr"),
        INITIAL_BALANCE("initial_balance"),
        BALANCE_UPDATE("balance_update");

        private final String key;

        SystemGeneratedKey(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }

        public static SystemGeneratedKey fromKey(String key) {
            for (SystemGeneratedKey value : values()) {
                if (value.key.equals(key)) {
                    return value;
                }
            }
            throw new IllegalArgumentException("Unknown system generated key: " + key);
        }
    }
}
