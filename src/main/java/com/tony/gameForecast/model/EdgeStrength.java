package com.tony.gameForecast.model;

public enum EdgeStrength {
    WEAK, MODERATE, STRONG;

    public static EdgeStrength of(double edge) {
        double abs = Math.abs(edge);
        if (abs < 1.5) return WEAK;
        if (abs < 3.0) return MODERATE;
        return STRONG;
    }
}
