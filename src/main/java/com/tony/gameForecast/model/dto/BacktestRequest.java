package com.tony.gameForecast.model.dto;

import com.tony.gameForecast.model.Game;
import com.tony.gameForecast.model.MarketLine;
import com.tony.gameForecast.model.SimulationParams;
import com.tony.gameForecast.model.Sport;
import com.tony.gameForecast.model.Team;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
public class BacktestRequest {
    @NotNull(message = "Le sport est requis")
    private Sport sport;

    @Valid
    private List<Team> teams = new ArrayList<>();

    @NotEmpty(message = "Au moins un match est requis")
    @Valid
    private List<Game> games = new ArrayList<>();

    @Valid
    private List<MarketLine> marketLines = new ArrayList<>();

    // Ratings reportés de la saison précédente (1500 par défaut)
    private Map<String, Double> initialRatings = new HashMap<>();

    // null = constantes du profil du sport
    private SimulationParams params;
}
