package com.tony.gameForecast.model.dto;

import com.tony.gameForecast.model.Game;
import com.tony.gameForecast.model.MarketLine;

import java.util.List;

public record ImportedSeason(List<Game> games, List<MarketLine> marketLines, int skippedRows) {
}
