package com.tony.gameForecast.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class PredictionRecord {
    String gameId;

    double homeScore;
    double awayScore;

    double spread;              // Extérieur - domicile, négatif = domicile favori
    double total;               // Domicile + extérieur
    double homeWinProbability;  // 0-1

    ConfidenceTiers confidence;

    public Pick moneylinePick() {
        return homeWinProbability > 0.5 ? Pick.HOME : Pick.AWAY;
    }
}
