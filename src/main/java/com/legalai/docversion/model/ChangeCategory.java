package com.legalai.docversion.model;

public enum ChangeCategory {
    FINANCIAL("financial"),
    RIGHTS("rights"),
    OBLIGATIONS("obligations"),
    PRIVACY("privacy"),
    LEGAL("legal");

    private final String value;

    ChangeCategory(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
