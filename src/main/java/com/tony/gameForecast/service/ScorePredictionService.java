package com.tony.gameForecast.service;

import com.tony.gameForecast.model.PredictionRecord;
import com.tony.gameForecast.model.SimulationParams;
import com.tony.gameForecast.model.SportProfile;
import com.tony.gameForecast.model.TeamForm;
import com.tony.gameForecast.util.Rounding;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Modèle de score : moyennes offensives/défensives régressées + ajustement Elo + avantage du terrain.
 * Fonction pure, sans effet de bord.
 */
@Service
@RequiredArgsConstructor
public class ScorePredictionService {

    private final EloService eloService;

    public PredictionRecord predict(String gameId, TeamForm home, TeamForm away, Double weatherImpact,
                                    SimulationParams params, SportProfile profile) {
        double leagueAvg = profile.getLeagueAveragePoints();
        double regression = params.getStatsRegression();

        // 1. Régression des moyennes vers la moyenne ligue
        double homeOffense = regress(home.pointsScored(), leagueAvg, regression);
        double homeDefense = regress(home.pointsAllowed(), leagueAvg, regression);
        double awayOffense = regress(away.pointsScored(), leagueAvg, regression);
        double awayDefense = regress(away.pointsAllowed(), leagueAvg, regression);

        // 2. Confrontation attaque vs défense
        double homeScore = (homeOffense + awayDefense) / 2.0;
        double awayScore = (awayOffense + homeDefense) / 2.0;

        // 3. Ajustement Elo, réparti entre les deux équipes
        double adjustment = ratingAdjustment(home.rating() - away.rating(), params);
        homeScore += adjustment;
        awayScore -= adjustment;

        // 4. Avantage du terrain
        homeScore += params.getHomeAdvantage() / 2.0;
        awayScore -= params.getHomeAdvantage() / 2.0;

        // 5. Météo : retirée du total, moitié de chaque côté
        if (weatherImpact != null) {
            double weatherPoints = weatherImpact * params.getWeatherCoefficient();
            homeScore -= weatherPoints / 2.0;
            awayScore -= weatherPoints / 2.0;
        }

        double predictedHome = Rounding.toStep(Math.max(0.0, homeScore), profile.getScoreGranularity());
        double predictedAway = Rounding.toStep(Math.max(0.0, awayScore), profile.getScoreGranularity());

        // Spread rétréci vers 0 pour limiter la sur-confiance
        double rawSpread = predictedAway - predictedHome;
        double spread = Rounding.toStep(rawSpread * (1.0 - params.getSpreadShrinkage()), profile.getLineGranularity());
        double total = Rounding.toStep(predictedHome + predictedAway, profile.getLineGranularity());

        return PredictionRecord.builder()
                .gameId(gameId)
                .homeScore(predictedHome)
                .awayScore(predictedAway)
                .spread(spread)
                .total(total)
                .homeWinProbability(eloService.homeWinProbability(home.rating(), away.rating(), profile))
                .build();
    }

    /**
     * Points ajoutés au domicile (et retirés à l'extérieur) pour un écart Elo donné.
     */
    double ratingAdjustment(double ratingDiff, SimulationParams params) {
        double adjustment = ratingDiff * params.getRatingToPoints() / 100.0 / 2.0;
        if (params.getRatingCap() > 0) {
            double half = params.getRatingCap() / 2.0;
            adjustment = Math.max(-half, Math.min(half, adjustment));
        }
        return adjustment;
    }

    private double regress(Double average, double leagueAvg, double regression) {
        double value = average != null ? average : leagueAvg;
        return value * (1.0 - regression) + leagueAvg * regression;
    }
}
