package com.legalai.docversion.model;

public enum ChangeType {
    ADDITION("addition"),
    DELETION("deletion"),
    MODIFICATION("modification");

    private final String value;

    ChangeType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
