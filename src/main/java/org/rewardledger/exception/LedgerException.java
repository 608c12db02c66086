package org.rewardledger.exception;

public class LedgerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final LedgerError error;

    public LedgerException(LedgerError error, String message) {
        super(message);
        this.error = error;
    }

    public LedgerError getError() {
        return error;
    }
}
