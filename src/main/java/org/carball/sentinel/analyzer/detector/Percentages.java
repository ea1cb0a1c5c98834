package org.carball.sentinel.analyzer.detector;

final class Percentages {

    private Percentages() {
    }

    static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    static double clamp(double pct) {
        return Math.max(0.0, Math.min(100.0, pct));
    }
}
