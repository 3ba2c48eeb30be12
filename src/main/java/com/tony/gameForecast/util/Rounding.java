package com.tony.gameForecast.util;

public final class Rounding {

    private Rounding() {
    }

    /**
     * Arrondit au multiple de {@code step} le plus proche (0.5, 0.1, 1...).
     * Un pas nul ou négatif laisse la valeur intacte.
     */
    public static double toStep(double value, double step) {
        if (step <= 0) return value;
        double rounded = Math.round(value / step) * step;
        // Nettoie les artefacts flottants (ex: 2.3000000000000003)
        return Math.round(rounded * 1e6) / 1e6;
    }

    public static double toDecimals(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
