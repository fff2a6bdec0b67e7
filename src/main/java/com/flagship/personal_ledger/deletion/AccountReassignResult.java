package com.flagship.personal_ledger.deletion;

import lombok.Value;

import java.time.Instant;

@Value
public class AccountReassignResult {
    int transactionsReassigned;
    int templatesReassigned;
    boolean accountSoftDeleted;
    Instant deletedAt;
}
