package com.legalai.docversion.exception;

/**
 * Base type for lookups of versions or comparisons that do not exist.
 * Kept distinct from generic failures so callers can map it to a 404.
 */
public abstract class NotFoundException extends RuntimeException {

    protected NotFoundException(String message) {
        super(message);
    }
}
