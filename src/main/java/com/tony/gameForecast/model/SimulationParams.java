package com.tony.gameForecast.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Jeu de constantes du modèle, un par essai de l'optimiseur.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SimulationParams {
    double ratingToPoints;     // Points pour 100 points Elo
    double homeAdvantage;      // Points
    double spreadShrinkage;    // 0 = aucun rétrécissement, 0.5 = spread divisé par deux
    double ratingCap;          // Points, 0 = pas de plafond
    double minSpread;          // On ne parie que si |spread| >= minSpread
    double maxSpread;          // ... et |spread| <= maxSpread
    double statsRegression;    // 0-1
    double weatherCoefficient;

    public boolean isBettable(double predictedSpread) {
        double abs = Math.abs(predictedSpread);
        return abs >= minSpread && abs <= maxSpread;
    }
}
