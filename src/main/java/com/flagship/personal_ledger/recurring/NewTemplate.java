package com.flagship.personal_ledger.recurring;

import com.flagship.personal_ledger.common.FlowType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Insert model for a template. The first cursor value is part of the insert;
 * later values are written by the materializer only.
 */
@Value
@Builder
public class NewTemplate {
    UUID ownerId;
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
    LocalDate firstRunDate;
    LocalDate endDate;
}
