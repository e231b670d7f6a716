package com.legalai.docversion.model;

public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
