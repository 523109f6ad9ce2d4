package com.signalgate.core.model;

public enum Tier {
    FREE,
    PREMIUM
}
