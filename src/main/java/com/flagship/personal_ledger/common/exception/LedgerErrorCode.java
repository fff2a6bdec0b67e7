package com.flagship.personal_ledger.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes reported to callers.
 *
 * Ownership and invariant violations are final. The caller corrects the request
 * instead of retrying it.
 */
public enum LedgerErrorCode {
    NOT_FOUND("not_found", HttpStatus.NOT_FOUND),
    INVALID_ACCOUNTS("invalid_accounts", HttpStatus.BAD_REQUEST),
    NOT_A_TRANSFER("not_a_transfer", HttpStatus.CONFLICT),
    ORPHAN_PAIR("orphan_pair", HttpStatus.CONFLICT),
    INVALID_SCHEDULE("invalid_schedule", HttpStatus.BAD_REQUEST),
    INVALID_RANGE("invalid_range", HttpStatus.BAD_REQUEST),
    INVALID_TARGET("invalid_target", HttpStatus.BAD_REQUEST),
    SYSTEM_CATEGORY_IMMUTABLE("system_category_immutable", HttpStatus.CONFLICT),
    TRANSFER_LEG_IMMUTABLE("transfer_leg_immutable", HttpStatus.CONFLICT),
    INVALID_STATE("invalid_state", HttpStatus.CONFLICT),
    INVALID_REQUEST("invalid_request", HttpStatus.BAD_REQUEST),
    UNAUTHENTICATED("unauthenticated", HttpStatus.UNAUTHORIZED);

    private final String code;
    private final HttpStatus status;

    LedgerErrorCode(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public HttpStatus status() {
        return status;
    }
}
