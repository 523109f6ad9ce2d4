package com.signalgate.lifecycle.dispatch;

public record ScanReport(int considered, int sent, int withheld, int failed) {
    public static ScanReport empty() {
        return new ScanReport(0, 0, 0, 0);
    }
}
