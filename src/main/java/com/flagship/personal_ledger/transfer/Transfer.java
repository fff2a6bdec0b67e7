package com.flagship.personal_ledger.transfer;

import com.flagship.personal_ledger.transaction.LedgerTransaction;
import lombok.Value;

/**
 * Both legs of a transfer. {@code replayed} is set when an idempotency key
 * matched an earlier request and nothing was written.
 */
@Value
public class Transfer {
    LedgerTransaction outgoing;
    LedgerTransaction incoming;
    boolean replayed;
}
