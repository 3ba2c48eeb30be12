package com.tony.gameForecast.model;

/**
 * État d'une équipe au moment de prédire un match : rating et moyennes de points (null = inconnues).
 */
public record TeamForm(String teamId, double rating, Double pointsScored, Double pointsAllowed) {

    public static TeamForm of(Team team) {
        return new TeamForm(team.getId(), team.ratingOrDefault(), team.getPointsScored(), team.getPointsAllowed());
    }
}
