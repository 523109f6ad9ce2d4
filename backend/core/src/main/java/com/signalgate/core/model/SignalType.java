package com.signalgate.core.model;

public enum SignalType {
    FUNDING("Funding"),
    PRODUCT_LAUNCH("Product launch"),
    INNOVATION("Innovation"),
    ACQUISITION("Acquisition"),
    IPO("IPO"),
    GENERAL("General");

    private final String label;

    SignalType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
