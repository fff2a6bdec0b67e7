package com.flagship.personal_ledger.recurring;

import com.flagship.personal_ledger.common.FlowType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class RecurringTemplateCommand {
    UUID accountId;
    UUID categoryId;
    FlowType flowType;
    BigDecimal amount;
    String description;
    Frequency frequency;
    int interval;
    List<Integer> byWeekday;
    List<Integer> byMonthday;
    LocalDate startDate;
    LocalDate endDate;
}
