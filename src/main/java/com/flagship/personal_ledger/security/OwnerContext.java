package com.flagship.personal_ledger.security;

import com.flagship.personal_ledger.common.exception.LedgerErrorCode;
import com.flagship.personal_ledger.common.exception.LedgerException;

import java.util.Optional;
import java.util.UUID;

/**
 * Verified owner of the current request, set by {@link AuthenticatedOwnerFilter}.
 */
public final class OwnerContext {

    private static final ThreadLocal<UUID> OWNER = new ThreadLocal<>();

    private OwnerContext() {
    }

    public static void set(UUID ownerId) {
        OWNER.set(ownerId);
    }

    public static Optional<UUID> get() {
        return Optional.ofNullable(OWNER.get());
    }

    /**
     * Owner of the current request.
     *
     * @throws LedgerException unauthenticated when no verified owner is bound
     */
    public static UUID requireOwnerId() {
        UUID ownerId = OWNER.get();
        if (ownerId == null) {
            throw new LedgerException(LedgerErrorCode.UNAUTHENTICATED, "No authenticated owner");
        }
        return ownerId;
    }

    public static void clear() {
        OWNER.remove();
    }
}
