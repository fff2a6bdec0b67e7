package com.flagship.personal_ledger.common.exception;

import java.util.UUID;

/**
 * Failure of a ledger operation, tagged with the code reported to the caller.
 *
 * Thrown inside a transactional unit, it rolls the whole unit back.
 */
public class LedgerException extends RuntimeException {

    private final LedgerErrorCode errorCode;

    public LedgerException(LedgerErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LedgerErrorCode getErrorCode() {
        return errorCode;
    }

    public static LedgerException notFound(String entity, UUID id) {
        return new LedgerException(LedgerErrorCode.NOT_FOUND, entity + " not found: " + id);
    }

    public static LedgerException invalidRequest(String message) {
        return new LedgerException(LedgerErrorCode.INVALID_REQUEST, message);
    }
}
