package com.legalai.docversion.exception;

public class ComparisonNotFoundException extends NotFoundException {

    public ComparisonNotFoundException(String message) {
        super(message);
    }
}
