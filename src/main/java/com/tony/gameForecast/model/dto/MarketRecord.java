package com.tony.gameForecast.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tony.gameForecast.model.GradedBet;
import com.tony.gameForecast.model.LineSource;
import com.tony.gameForecast.model.Market;
import com.tony.gameForecast.util.Rounding;

import java.util.List;

/**
 * Bilan d'un marché pour une source de ligne donnée.
 */
public record MarketRecord(Market market, LineSource lineSource, int wins, int losses, int pushes) {

    public static MarketRecord tally(Market market, LineSource lineSource, List<GradedBet> bets) {
        int wins = 0;
        int losses = 0;
        int pushes = 0;
        for (GradedBet bet : bets) {
            if (bet.isWin()) wins++;
            else if (bet.isLoss()) losses++;
            else pushes++;
        }
        return new MarketRecord(market, lineSource, wins, losses, pushes);
    }

    @JsonProperty
    public int graded() {
        return wins + losses + pushes;
    }

    // Les pushes sont exclus du pourcentage ; 0 si aucun pari décidé
    @JsonProperty
    public double winPct() {
        int decided = wins + losses;
        return decided == 0 ? 0.0 : Rounding.toStep(wins * 100.0 / decided, 0.1);
    }
}
