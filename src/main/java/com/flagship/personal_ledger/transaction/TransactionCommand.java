package com.flagship.personal_ledger.transaction;

import com.flagship.personal_ledger.common.FlowType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class TransactionCommand {
    UUID accountId;
    UUID categoryId;
    FlowType flowType;
    BigDecimal amount;
    LocalDate date;
    String description;
    UUID invoiceId;
}
