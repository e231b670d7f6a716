package com.legalai.docversion.exception;

/**
 * Raised when a diff computation is interrupted before it completes.
 * No partial result is ever persisted.
 */
public class DiffCancelledException extends RuntimeException {

    public DiffCancelledException(String message) {
        super(message);
    }

    public DiffCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
