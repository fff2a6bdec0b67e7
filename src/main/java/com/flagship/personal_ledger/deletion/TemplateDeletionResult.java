package com.flagship.personal_ledger.deletion;

import lombok.Value;

import java.time.Instant;

@Value
public class TemplateDeletionResult {
    Instant deletedAt;
    boolean pairDeleted;
}
