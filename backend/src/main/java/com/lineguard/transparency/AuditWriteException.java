package com.lineguard.transparency;

import lombok.Getter;

/**
 * The audit trail could not be written. Fatal for the operation that tried to write it.
 */
@Getter
public class AuditWriteException extends RuntimeException {

    public static final String AUDIT_WRITE_FAILED = "AUDIT_WRITE_FAILED";

    private final String errorCode = AUDIT_WRITE_FAILED;

    public AuditWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
