package com.tony.gameForecast.service;

import com.tony.gameForecast.model.BetOutcome;
import com.tony.gameForecast.model.GradedBet;
import com.tony.gameForecast.model.LineSource;
import com.tony.gameForecast.model.Market;
import com.tony.gameForecast.model.MarketLine;
import com.tony.gameForecast.model.Pick;
import com.tony.gameForecast.model.PredictionRecord;
import com.tony.gameForecast.model.SportProfile;
import org.springframework.stereotype.Service;

/**
 * Correction des paris (spread, moneyline, total). Aucun état.
 * Sans ligne de marché : spread contre la ligne du modèle, total contre le total de référence du sport.
 */
@Service
public class GradingService {

    // Les lignes sont au demi-point ou au dixième : en dessous, c'est une égalité
    private static final double EPSILON = 1e-9;

    public GradedBet gradeSpread(PredictionRecord prediction, int homeScore, int awayScore, MarketLine marketLine) {
        if (marketLine != null && marketLine.hasSpread()) {
            return gradeSpread(prediction.getSpread(), marketLine.getSpread(), LineSource.MARKET, homeScore - awayScore);
        }
        return gradeSpread(prediction.getSpread(), prediction.getSpread(), LineSource.MODEL, homeScore - awayScore);
    }

    /**
     * @param predictedSpread Spread du modèle (extérieur - domicile)
     * @param line Ligne jouée, du point de vue domicile
     * @param actualMargin Domicile - extérieur
     */
    public GradedBet gradeSpread(double predictedSpread, double line, LineSource source, int actualMargin) {
        // Contre sa propre ligne, le modèle prend le favori qu'il prédit ; contre le marché, le côté sous-évalué
        boolean pickHome = source == LineSource.MODEL ? predictedSpread < 0 : predictedSpread < line;
        Pick pick = pickHome ? Pick.HOME : Pick.AWAY;

        double cover = actualMargin + line;
        BetOutcome outcome;
        if (Math.abs(cover) < EPSILON) outcome = BetOutcome.PUSH;
        else outcome = (cover > 0) == pickHome ? BetOutcome.WIN : BetOutcome.LOSS;

        return new GradedBet(Market.SPREAD, pick, line, source, outcome);
    }

    public GradedBet gradeMoneyline(PredictionRecord prediction, int homeScore, int awayScore) {
        Pick pick = prediction.moneylinePick();
        BetOutcome outcome;
        if (homeScore == awayScore) outcome = BetOutcome.PUSH;
        else outcome = (homeScore > awayScore) == (pick == Pick.HOME) ? BetOutcome.WIN : BetOutcome.LOSS;
        return new GradedBet(Market.MONEYLINE, pick, null, LineSource.NONE, outcome);
    }

    public GradedBet gradeTotal(PredictionRecord prediction, int homeScore, int awayScore,
                                MarketLine marketLine, SportProfile profile) {
        boolean market = marketLine != null && marketLine.hasTotal();
        double line = market ? marketLine.getTotal() : profile.getBaselineTotal();
        LineSource source = market ? LineSource.MARKET : LineSource.BASELINE;

        boolean over = prediction.getTotal() > line;
        double diff = (homeScore + awayScore) - line;

        BetOutcome outcome;
        if (Math.abs(diff) < EPSILON) outcome = BetOutcome.PUSH;
        else outcome = (diff > 0) == over ? BetOutcome.WIN : BetOutcome.LOSS;

        return new GradedBet(Market.TOTAL, over ? Pick.OVER : Pick.UNDER, line, source, outcome);
    }
}
