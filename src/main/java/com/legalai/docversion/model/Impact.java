package com.legalai.docversion.model;

public enum Impact {
    FAVORABLE("favorable"),
    UNFAVORABLE("unfavorable"),
    NEUTRAL("neutral");

    private final String value;

    Impact(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
