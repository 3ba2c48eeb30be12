package com.tony.gameForecast.model.dto;

import com.tony.gameForecast.model.Sport;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ThresholdReport {
    Sport sport;
    int totalGames;            // Matchs avec une ligne de marché
    int minGames;
    FilterStats baseline;
    List<FilterStats> bySpread;  // Filtres qualifiés, triés par % ATS
    List<FilterStats> byTotal;   // Filtres qualifiés, triés par % over/under
    List<FilterStats> all;
}
