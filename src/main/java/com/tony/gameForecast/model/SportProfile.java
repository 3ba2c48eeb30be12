package com.tony.gameForecast.model;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Paramètres algorithmiques d'un sport.
 * Les valeurs par défaut sont celles de la NFL ; {@link #defaultsFor(Sport)} donne les profils calibrés.
 */
@Data
@NoArgsConstructor
public class SportProfile {

    // --- Modèle de score ---
    private double leagueAveragePoints = 22.0;   // Points moyens par équipe et par match
    private double ratingToPoints = 5.93;        // Points de spread pour 100 points Elo
    private double homeAdvantage = 2.28;         // Avantage domicile en points
    private double spreadShrinkage = 0.55;       // Rétrécissement du spread vers 0
    private double ratingCap = 4.0;              // Ajustement Elo max en points (0 = pas de plafond)
    private double statsRegression = 0.3;        // Régression des moyennes vers la moyenne ligue
    private double weatherCoefficient = 1.5;     // Points retirés du total par point d'impact météo

    // --- Modèle Elo ---
    private double probabilityHomeAdvantage = 48.0; // En points Elo, pour la probabilité de victoire
    private double ratingHomeAdvantage = 48.0;      // En points Elo, pour la mise à jour
    private double kFactor = 20.0;
    private boolean marginOfVictoryScaling = true;
    private boolean tiesAllowed = true;

    // --- Arrondis ---
    private double scoreGranularity = 0.1;
    private double lineGranularity = 0.5;

    // --- Paris ---
    private double baselineTotal = 44.0;         // Total de repli sans ligne de marché
    private double maxBettableSpread = 20.0;

    // --- Seuils de confiance (edge) ---
    private double spreadHighEdge = 2.5;
    private double spreadMediumEdge = 1.0;
    private double totalHighEdge = 4.0;
    private double totalMediumEdge = 2.0;
    private double moneylineHighEdge = 15.0;
    private double moneylineMediumEdge = 7.0;

    public static SportProfile defaultsFor(Sport sport) {
        SportProfile profile = new SportProfile();
        switch (sport) {
            case NFL -> {
                // Défauts de la classe
            }
            case NBA -> {
                profile.setLeagueAveragePoints(112.0);
                profile.setRatingToPoints(4.0);
                profile.setHomeAdvantage(3.0);
                profile.setRatingCap(20.0);
                profile.setWeatherCoefficient(0.0);
                profile.setTiesAllowed(false);
                profile.setLineGranularity(0.1);
                profile.setBaselineTotal(224.0);
                profile.setTotalHighEdge(5.0);
            }
            case NHL -> {
                profile.setLeagueAveragePoints(3.1);
                profile.setRatingToPoints(1.8);
                profile.setHomeAdvantage(0.25);
                profile.setSpreadShrinkage(0.15);
                profile.setRatingCap(3.0);
                profile.setWeatherCoefficient(0.0);
                profile.setTiesAllowed(false);
                profile.setBaselineTotal(6.0);
                profile.setMaxBettableSpread(5.0);
                profile.setSpreadHighEdge(0.5);
                profile.setSpreadMediumEdge(0.2);
                profile.setTotalHighEdge(0.5);
                profile.setTotalMediumEdge(0.2);
                profile.setMoneylineHighEdge(12.0);
                profile.setMoneylineMediumEdge(5.0);
            }
            case CBB -> {
                profile.setLeagueAveragePoints(72.0);
                profile.setRatingToPoints(6.0);
                profile.setHomeAdvantage(4.5);
                profile.setSpreadShrinkage(0.4);
                profile.setRatingCap(20.0);
                profile.setWeatherCoefficient(0.0);
                profile.setTiesAllowed(false);
                profile.setLineGranularity(0.1);
                profile.setBaselineTotal(144.0);
                profile.setMaxBettableSpread(40.0);
                profile.setTotalHighEdge(5.0);
                profile.setTotalMediumEdge(3.0);
            }
        }
        return profile;
    }

    /**
     * Paramètres de simulation correspondant au modèle en production pour ce sport.
     */
    public SimulationParams toSimulationParams() {
        return SimulationParams.builder()
                .ratingToPoints(ratingToPoints)
                .homeAdvantage(homeAdvantage)
                .spreadShrinkage(spreadShrinkage)
                .ratingCap(ratingCap)
                .minSpread(0.0)
                .maxSpread(maxBettableSpread)
                .statsRegression(statsRegression)
                .weatherCoefficient(weatherCoefficient)
                .build();
    }
}
