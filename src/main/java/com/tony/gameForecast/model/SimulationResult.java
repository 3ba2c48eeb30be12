package com.tony.gameForecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tony.gameForecast.util.Rounding;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SimulationResult {
    SimulationParams params;
    GradingMode gradingMode;

    int totalGames;   // Matchs rejoués
    int wins;
    int losses;
    int pushes;
    double profit;    // En unités de mise, cote -110

    @JsonProperty
    public int totalGraded() {
        return wins + losses + pushes;
    }

    @JsonProperty
    public double winPct() {
        int decided = wins + losses;
        return decided == 0 ? 0.0 : Rounding.toStep(wins * 100.0 / decided, 0.1);
    }
}
