package com.flagship.personal_ledger.deletion.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.personal_ledger.deletion.TemplateDeletionResult;
import lombok.Value;

import java.time.Instant;

@Value
public class TemplateDeletionResponse {

    @JsonProperty("deleted_at")
    Instant deletedAt;

    @JsonProperty("pair_deleted")
    boolean pairDeleted;

    public static TemplateDeletionResponse from(TemplateDeletionResult result) {
        return new TemplateDeletionResponse(result.getDeletedAt(), result.isPairDeleted());
    }
}
