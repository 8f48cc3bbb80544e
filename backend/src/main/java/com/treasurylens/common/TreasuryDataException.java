package com.treasurylens.common;

/**
 * Base for all typed data-layer failures. Callers branch on {@link #getKind()}.
 */
public class TreasuryDataException extends RuntimeException {

    private final ErrorKind kind;

    public TreasuryDataException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TreasuryDataException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
