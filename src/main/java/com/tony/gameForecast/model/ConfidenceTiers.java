package com.tony.gameForecast.model;

/**
 * Métadonnées de confiance attachées à une prédiction (lecture seule, n'influence jamais le pick).
 */
public record ConfidenceTiers(
        ConfidenceTier spread,
        ConfidenceTier total,
        ConfidenceTier moneyline,
        double spreadEdge,
        double totalEdge,
        double moneylineEdge) {
}
