package com.flagship.personal_ledger.transfer;

import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
public class RecurringTransfer {
    UUID outgoingTemplateId;
    UUID incomingTemplateId;
    LocalDate firstRunDate;
}
