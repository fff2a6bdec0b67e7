package com.flagship.personal_ledger.recurring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.personal_ledger.common.FlowType;
import com.flagship.personal_ledger.recurring.Frequency;
import com.flagship.personal_ledger.recurring.RecurringTemplateCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class CreateTemplateRequest {

    @NotNull(message = "Account ID is required")
    @JsonProperty("account_id")
    UUID accountId;

    @NotNull(message = "Category ID is required")
    @JsonProperty("category_id")
    UUID categoryId;

    @NotNull(message = "Flow type is required")
    @JsonProperty("flow_type")
    FlowType flowType;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 10, fraction = 2, message = "Amount supports at most 2 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @Size(max = 500, message = "Description is limited to 500 characters")
    @JsonProperty("description")
    String description;

    @NotNull(message = "Frequency is required")
    @JsonProperty("frequency")
    Frequency frequency;

    @JsonProperty("interval")
    Integer interval;

    @JsonProperty("by_weekday")
    List<Integer> byWeekday;

    @JsonProperty("by_monthday")
    List<Integer> byMonthday;

    @NotNull(message = "Start date is required")
    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    public RecurringTemplateCommand toCommand() {
        return RecurringTemplateCommand.builder()
            .accountId(accountId)
            .categoryId(categoryId)
            .flowType(flowType)
            .amount(amount)
            .description(description)
            .frequency(frequency)
            .interval(interval != null ? interval : 1)
            .byWeekday(byWeekday)
            .byMonthday(byMonthday)
            .startDate(startDate)
            .endDate(endDate)
            .build();
    }
}
