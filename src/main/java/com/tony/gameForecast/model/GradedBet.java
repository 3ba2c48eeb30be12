package com.tony.gameForecast.model;

/**
 * Résultat d'un pari sur un marché, avec la ligne utilisée et sa provenance.
 */
public record GradedBet(Market market, Pick pick, Double line, LineSource lineSource, BetOutcome outcome) {

    public boolean isWin() {
        return outcome == BetOutcome.WIN;
    }

    public boolean isLoss() {
        return outcome == BetOutcome.LOSS;
    }

    public boolean isPush() {
        return outcome == BetOutcome.PUSH;
    }
}
