package com.tony.gameForecast.model.dto;

/**
 * Écart Elo avant match (domicile - extérieur) et marge réelle (domicile - extérieur).
 */
public record CalibrationPoint(String gameId, double ratingDiff, int margin) {
}
