package com.flagship.personal_ledger.deletion;

public enum DeletionStrategy {
    REASSIGN,
    CASCADE
}
