package com.tony.gameForecast.model;

/**
 * Ligne contre laquelle un pari a été évalué.
 * Les bilans de sources différentes ne sont jamais agrégés ensemble.
 */
public enum LineSource {
    /** Ligne du bookmaker (spread ou total). */
    MARKET,
    /** Spread prédit par le modèle lui-même (backtest auto-référentiel). */
    MODEL,
    /** Total moyen de référence du sport. */
    BASELINE,
    /** Moneyline : aucune ligne. */
    NONE
}
