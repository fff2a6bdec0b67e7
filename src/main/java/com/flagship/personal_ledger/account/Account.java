package com.flagship.personal_ledger.account;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An account owned by a single user.
 *
 * {@code cachedBalance} is derived from the account's transactions and only
 * ever written by the reconciler.
 */
@Value
public class Account {
    UUID id;
    UUID ownerId;
    String name;
    AccountType type;
    String currency;
    BigDecimal cachedBalance;
    Instant createdAt;
    Instant deletedAt;

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public enum AccountType {
        CASH,
        BANK,
        CREDIT_CARD,
        LOAN,
        REMITTANCE,
        CRYPTO,
        INVESTMENT
    }
}
