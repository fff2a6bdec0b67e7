package com.flagship.personal_ledger.recurring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.personal_ledger.common.FlowType;
import com.flagship.personal_ledger.recurring.Frequency;
import com.flagship.personal_ledger.recurring.RecurringTemplate;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class TemplateResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("category_id")
    UUID categoryId;

    @JsonProperty("flow_type")
    FlowType flowType;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("description")
    String description;

    @JsonProperty("frequency")
    Frequency frequency;

    @JsonProperty("interval")
    int interval;

    @JsonProperty("by_weekday")
    List<Integer> byWeekday;

    @JsonProperty("by_monthday")
    List<Integer> byMonthday;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("next_run_date")
    LocalDate nextRunDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("state")
    RecurringTemplate.TemplateState state;

    @JsonProperty("paired_template_id")
    UUID pairedTemplateId;

    public static TemplateResponse from(RecurringTemplate template) {
        return TemplateResponse.builder()
            .id(template.getId())
            .accountId(template.getAccountId())
            .categoryId(template.getCategoryId())
            .flowType(template.getFlowType())
            .amount(template.getAmount())
            .description(template.getDescription())
            .frequency(template.getFrequency())
            .interval(template.getInterval())
            .byWeekday(template.getByWeekday())
            .byMonthday(template.getByMonthday())
            .startDate(template.getStartDate())
            .nextRunDate(template.getNextRunDate())
            .endDate(template.getEndDate())
            .state(template.state())
            .pairedTemplateId(template.getPairedTemplateId())
            .build();
    }
}
