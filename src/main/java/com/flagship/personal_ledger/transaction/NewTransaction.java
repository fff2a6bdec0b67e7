package com.flagship.personal_ledger.transaction;

import com.flagship.personal_ledger.common.FlowType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Insert model for a transaction row. Pair links are never part of an insert;
 * they are written afterwards by the pairing manager.
 */
@Value
@Builder
public class NewTransaction {
    UUID ownerId;
    UUID accountId;
    UUID categoryId;
    FlowType flowType;
    BigDecimal amount;
    LocalDate date;
    String description;
    UUID invoiceId;
    UUID recurringTemplateId;
    LedgerTransaction.SystemGeneratedKey systemGeneratedKey;
    String idempotencyKey;
}
