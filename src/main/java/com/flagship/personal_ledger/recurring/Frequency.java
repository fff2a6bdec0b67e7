package com.flagship.personal_ledger.recurring;

public enum Frequency {
    DAILY,
    WEEKLY,
    MONTHLY,
    YEARLY
}
