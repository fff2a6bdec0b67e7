package com.flagship.personal_ledger.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.personal_ledger.transaction.dto.TransactionResponse;
import com.flagship.personal_ledger.transfer.Transfer;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TransferResponse {

    @JsonProperty("outgoing")
    TransactionResponse outgoing;

    @JsonProperty("incoming")
    TransactionResponse incoming;

    public static TransferResponse from(Transfer transfer) {
        return TransferResponse.builder()
            .outgoing(TransactionResponse.from(transfer.getOutgoing()))
            .incoming(TransactionResponse.from(transfer.getIncoming()))
            .build();
    }
}
