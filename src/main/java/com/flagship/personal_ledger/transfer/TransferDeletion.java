package com.flagship.personal_ledger.transfer;

import lombok.Value;

@Value
public class TransferDeletion {
    int legsRemoved;
    /** {@code orphan_pair} when only one leg was found, otherwise null. */
    String warning;

    public boolean isOrphan() {
        return warning != null;
    }
}
