package com.tony.gameForecast.model.dto;

import com.tony.gameForecast.model.GradingMode;
import com.tony.gameForecast.model.SimulationResult;
import com.tony.gameForecast.model.Sport;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class OptimizationReport {
    Sport sport;
    GradingMode gradingMode;
    int configurationsTested;
    int qualifiedConfigurations;   // Au-dessus de l'échantillon minimum

    SimulationResult baseline;
    List<SimulationResult> topResults;   // Triés par profit, sans quasi-doublons

    // Parmi les configurations au-dessus du point mort (null si aucune)
    SimulationResult bestByWinPct;
    SimulationResult bestByProfit;
    SimulationResult bestByVolume;
}
