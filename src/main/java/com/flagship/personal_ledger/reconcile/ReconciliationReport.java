package com.flagship.personal_ledger.reconcile;

import lombok.Value;

import java.util.UUID;

@Value
public class ReconciliationReport {
    UUID ownerId;
    int accountsChecked;
    int budgetsChecked;
    int corrections;
}
