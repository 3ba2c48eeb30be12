package com.tony.gameForecast.model;

public enum BetOutcome {
    WIN,
    LOSS,
    PUSH // Mise remboursée, comptée à part
}
