package com.legalai.docversion.exception;

public class ComparisonTimeoutException extends RuntimeException {

    public ComparisonTimeoutException(String message) {
        super(message);
    }
}
