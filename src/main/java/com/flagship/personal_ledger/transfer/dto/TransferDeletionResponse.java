package com.flagship.personal_ledger.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.personal_ledger.transfer.TransferDeletion;
import lombok.Value;

@Value
public class TransferDeletionResponse {

    @JsonProperty("legs_removed")
    int legsRemoved;

    @JsonProperty("warning")
    String warning;

    public static TransferDeletionResponse from(TransferDeletion deletion) {
        return new TransferDeletionResponse(deletion.getLegsRemoved(), deletion.getWarning());
    }
}
