package com.tony.gameForecast.model.dto;

import com.tony.gameForecast.model.Game;
import com.tony.gameForecast.model.GradingMode;
import com.tony.gameForecast.model.MarketLine;
import com.tony.gameForecast.model.SimulationParams;
import com.tony.gameForecast.model.Sport;
import com.tony.gameForecast.model.TunableParameter;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
public class OptimizationRequest {
    @NotNull(message = "Le sport est requis")
    private Sport sport;

    @NotEmpty(message = "Au moins un match est requis")
    @Valid
    private List<Game> games = new ArrayList<>();

    @Valid
    private List<MarketLine> marketLines = new ArrayList<>();

    // Ligne du modèle par défaut, comme le backtest historique
    private GradingMode gradingMode = GradingMode.MODEL_LINE;

    // null = profil du sport sans rétrécissement ni plafond
    private SimulationParams baseline;

    // null ou vide = recherche standard
    @Valid
    private List<GridBlock> grid;

    @Data
    public static class GridBlock {
        @NotBlank(message = "Chaque bloc doit être nommé")
        private String name;

        @NotEmpty(message = "Un bloc doit faire varier au moins un paramètre")
        private Map<TunableParameter, @NotEmpty List<@NotNull Double>> values = new LinkedHashMap<>();
    }
}
