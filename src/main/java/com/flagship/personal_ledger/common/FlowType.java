package com.flagship.personal_ledger.common;

import java.math.BigDecimal;

/**
 * Direction of money for a category, a transaction or a recurring template.
 *
 * Balances are signed from this value: income adds, outcome subtracts.
 */
public enum FlowType {
    INCOME,
    OUTCOME;

    public FlowType opposite() {
        return this == INCOME ? OUTCOME : INCOME;
    }

    /**
     * Applies the balance sign of this flow to a non-negative amount.
     */
    public BigDecimal signed(BigDecimal amount) {
        return this == INCOME ? amount : amount.negate();
    }

    /**
     * Flow that moves a balance by the given signed delta.
     */
    public static FlowType forDelta(BigDecimal delta) {
        return delta.signum() >= 0 ? INCOME : OUTCOME;
    }
}
