package com.tony.gameForecast.service;

import com.tony.gameForecast.model.SportProfile;
import com.tony.gameForecast.util.Rounding;
import org.springframework.stereotype.Service;

@Service
public class EloService {

    /**
     * Espérance de victoire domicile (0-1), avantage du terrain exprimé en points Elo.
     */
    public double expectedHomeScore(double homeRating, double awayRating, double homeAdvantageRating) {
        return 1.0 / (1.0 + Math.pow(10.0, (awayRating - homeRating - homeAdvantageRating) / 400.0));
    }

    /**
     * Probabilité de victoire domicile publiée avec une prédiction (3 décimales).
     */
    public double homeWinProbability(double homeRating, double awayRating, SportProfile profile) {
        return Rounding.toDecimals(expectedHomeScore(homeRating, awayRating, profile.getProbabilityHomeAdvantage()), 3);
    }

    /**
     * Multiplicateur logarithmique : une large victoire pèse plus, sans exploser sur un écrasement.
     */
    public double marginMultiplier(int margin) {
        if (margin == 0) return 1.0;
        return Math.log(Math.abs(margin) + 1) * 0.7 + 0.8;
    }

    /**
     * Met à jour les ratings des deux équipes après un match réel.
     * @param store Ratings de l'exécution en cours
     * @param homeTeamId L'équipe domicile
     * @param awayTeamId L'équipe extérieur
     * @param homeScore Points domicile
     * @param awayScore Points extérieur
     * @param profile Paramètres Elo du sport (K, avantage du terrain, marge de victoire)
     */
    public void updateRatings(RatingStore store, String homeTeamId, String awayTeamId,
                              int homeScore, int awayScore, SportProfile profile) {
        double homeRating = store.get(homeTeamId);
        double awayRating = store.get(awayTeamId);

        double actualHome = 0.5;
        if (homeScore > awayScore) actualHome = 1.0;
        else if (homeScore < awayScore) actualHome = 0.0;

        double expectedHome = expectedHomeScore(homeRating, awayRating, profile.getRatingHomeAdvantage());

        double k = profile.getKFactor();
        if (profile.isMarginOfVictoryScaling()) {
            k *= marginMultiplier(homeScore - awayScore);
        }

        // Nouveau = Ancien + K * (Réel - Attendu), arrondi au point Elo
        store.set(homeTeamId, (double) Math.round(homeRating + k * (actualHome - expectedHome)));
        store.set(awayTeamId, (double) Math.round(awayRating + k * ((1.0 - actualHome) - (1.0 - expectedHome))));
    }
}
