package org.rewardledger.exception;

import org.springframework.http.HttpStatus;

// Raison d'échec exposée à l'appelant ; toute erreur annule l'opération entière
public enum LedgerError {
    ALREADY_REGISTERED(HttpStatus.CONFLICT),
    NOT_REGISTERED(HttpStatus.NOT_FOUND),
    NOTHING_STAKED(HttpStatus.BAD_REQUEST),
    INSUFFICIENT_TOKEN_BALANCE(HttpStatus.BAD_REQUEST),
    INSUFFICIENT_STAKE(HttpStatus.BAD_REQUEST),
    INSUFFICIENT_CLAIMABLE(HttpStatus.BAD_REQUEST),
    REGISTRY_RANGE_EXCEEDED(HttpStatus.BAD_REQUEST),
    INVALID_AMOUNT(HttpStatus.BAD_REQUEST),
    INVALID_IDENTITY(HttpStatus.BAD_REQUEST),
    INVALID_REFERRAL_TABLE(HttpStatus.BAD_REQUEST),
    EXTERNAL_LEDGER_FAILURE(HttpStatus.BAD_REQUEST),
    ARITHMETIC_OVERFLOW(HttpStatus.BAD_REQUEST),
    CONTRACT_CALLER(HttpStatus.FORBIDDEN),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    OPERATIONS_PAUSED(HttpStatus.LOCKED),
    WITHDRAWALS_PAUSED(HttpStatus.LOCKED),
    REENTRANT_CALL(HttpStatus.CONFLICT);

    private final HttpStatus status;

    LedgerError(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
