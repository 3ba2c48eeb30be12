package com.tony.gameForecast.model.dto;

import com.tony.gameForecast.model.EdgeStrength;
import com.tony.gameForecast.model.Market;
import com.tony.gameForecast.model.MarketLine;
import com.tony.gameForecast.model.Pick;
import com.tony.gameForecast.model.PredictionRecord;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class GameForecast {
    String gameId;
    LocalDateTime gameTime;
    String homeTeam;
    String awayTeam;
    double homeRating;
    double awayRating;

    PredictionRecord prediction;
    MarketLine marketLine;

    // null sans ligne de marché
    Double edgeSpread;   // Marché - prédit : positif = domicile sous-évalué
    Double edgeTotal;    // Prédit - marché : positif = over
    EdgeStrength edgeStrength;

    Market recommendedMarket;   // null = pas de pari
    Pick recommendedPick;
}
