package com.flagship.personal_ledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.personal_ledger.invoice.Invoice;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class InvoiceResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("extracted_text")
    String extractedText;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("deleted_at")
    Instant deletedAt;

    public static InvoiceResponse from(Invoice invoice) {
        return new InvoiceResponse(invoice.getId(), invoice.getExtractedText(), invoice.getCreatedAt(),
            invoice.getDeletedAt());
    }
}
