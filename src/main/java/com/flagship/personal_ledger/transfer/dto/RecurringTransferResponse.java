package com.flagship.personal_ledger.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.personal_ledger.transfer.RecurringTransfer;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
public class RecurringTransferResponse {

    @JsonProperty("outgoing_template_id")
    UUID outgoingTemplateId;

    @JsonProperty("incoming_template_id")
    UUID incomingTemplateId;

    @JsonProperty("next_run_date")
    LocalDate nextRunDate;

    public static RecurringTransferResponse from(RecurringTransfer transfer) {
        return new RecurringTransferResponse(transfer.getOutgoingTemplateId(), transfer.getIncomingTemplateId(),
            transfer.getFirstRunDate());
    }
}
