package com.astrazeneca.tbltransfer.exception;

/**
 * Base class of all failures raised by the transfer machinery. Each subclass is bound to one {@link ErrorKind}.
 */
public abstract class TblTransferException extends RuntimeException {
    private final ErrorKind kind;

    protected TblTransferException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected TblTransferException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
