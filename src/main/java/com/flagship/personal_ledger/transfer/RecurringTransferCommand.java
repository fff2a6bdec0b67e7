package com.flagship.personal_ledger.transfer;

import com.flagship.personal_ledger.recurring.Frequency;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Schedule and accounts of a recurring transfer. The owner is passed separately.
 */
@Value
@Builder
public class RecurringTransferCommand {
    UUID fromAccountId;
    UUID toAccountId;
    BigDecimal amount;
    String description;
    Frequency frequency;
    int interval;
    List<Integer> byWeekday;
    List<Integer> byMonthday;
    LocalDate startDate;
    LocalDate endDate;
}
