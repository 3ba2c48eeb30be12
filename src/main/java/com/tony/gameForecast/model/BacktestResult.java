package com.tony.gameForecast.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Une ligne du journal de backtest (un match). Jamais modifiée après création.
 */
@Value
@Builder
public class BacktestResult {
    String gameId;
    LocalDateTime gameTime;
    Integer week;
    String homeTeam;
    String awayTeam;

    // État avant match
    double homeRating;
    double awayRating;

    PredictionRecord prediction;
    MarketLine marketLine;

    int actualHomeScore;
    int actualAwayScore;

    GradedBet spread;
    GradedBet moneyline;
    GradedBet total;

    public int actualMargin() {
        return actualHomeScore - actualAwayScore;
    }

    public int actualTotal() {
        return actualHomeScore + actualAwayScore;
    }

    public double ratingGap() {
        return Math.abs(homeRating - awayRating);
    }

    public boolean hasMarketSpread() {
        return marketLine != null && marketLine.hasSpread();
    }

    public GradedBet bet(Market market) {
        return switch (market) {
            case SPREAD -> spread;
            case MONEYLINE -> moneyline;
            case TOTAL -> total;
        };
    }
}
