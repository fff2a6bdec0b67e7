package com.flagship.personal_ledger.recurring;

import lombok.Value;

import java.util.UUID;

/**
 * A template a sync could not materialize. Its unit was rolled back; the rest of
 * the batch was not affected.
 */
@Value
public class TemplateFailure {
    UUID templateId;
    String code;
    String message;
}
