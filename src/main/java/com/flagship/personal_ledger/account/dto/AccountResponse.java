package com.flagship.personal_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.personal_ledger.account.Account;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("type")
    Account.AccountType type;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("deleted_at")
    Instant deletedAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .name(account.getName())
            .type(account.getType())
            .currency(account.getCurrency())
            .balance(account.getCachedBalance())
            .createdAt(account.getCreatedAt())
            .deletedAt(account.getDeletedAt())
            .build();
    }
}
