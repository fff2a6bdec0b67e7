package com.flagship.personal_ledger.deletion;

import lombok.Value;

import java.time.Instant;

/**
 * Outcome of a cascading account deletion. The pair counters are the partners
 * outside the account whose reference to a deleted row was cleared.
 */
@Value
public class AccountCascadeResult {
    int transactionsSoftDeleted;
    int transactionPairsDetached;
    int templatesSoftDeleted;
    int templatePairsDetached;
    boolean accountSoftDeleted;
    Instant deletedAt;
}
