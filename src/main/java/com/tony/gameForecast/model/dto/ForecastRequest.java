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
import java.util.List;

@Data
public class ForecastRequest {
    @NotNull(message = "Le sport est requis")
    private Sport sport;

    // État courant : rating et moyennes de points
    @Valid
    private List<Team> teams = new ArrayList<>();

    @NotEmpty(message = "Au moins un match est requis")
    @Valid
    private List<Game> games = new ArrayList<>();

    @Valid
    private List<MarketLine> marketLines = new ArrayList<>();

    private SimulationParams params;
}
