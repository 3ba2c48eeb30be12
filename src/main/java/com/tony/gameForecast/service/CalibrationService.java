package com.tony.gameForecast.service;

import com.tony.gameForecast.model.Game;
import com.tony.gameForecast.model.Sport;
import com.tony.gameForecast.model.dto.CalibrationPoint;
import com.tony.gameForecast.model.dto.CalibrationResult;
import com.tony.gameForecast.util.Rounding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Régression linéaire (moindres carrés) de la marge réelle sur l'écart Elo avant match.
 * marge = pente * écart + ordonnée  =>  ratingToPoints = pente * 100, homeAdvantage = ordonnée.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CalibrationService {

    private static final int RECENT_POINTS = 20;

    private final BacktestingService backtestingService;

    public CalibrationResult calibrate(Sport sport, List<Game> games, Map<String, Double> initialRatings) {
        List<CalibrationPoint> points = backtestingService.collectCalibrationPoints(sport, games, initialRatings);
        log.info("📐 Calibration {} sur {} matchs", sport, points.size());

        CalibrationResult result = calibrate(sport, points);
        if (result.isDegenerate()) {
            log.warn("Calibration {} impossible (échantillon trop petit ou écarts Elo constants)", sport);
        } else {
            log.info("📈 {} : {} pts / 100 Elo, avantage domicile {} pts, R² = {}",
                    sport, result.getRatingToPoints(), result.getHomeAdvantage(), result.getRSquared());
        }
        return result;
    }

    public CalibrationResult calibrate(Sport sport, List<CalibrationPoint> points) {
        SimpleRegression regression = new SimpleRegression();
        for (CalibrationPoint p : points) {
            regression.addData(p.ratingDiff(), p.margin());
        }

        double slope = 0.0;
        double intercept = 0.0;
        double rSquared = 0.0;

        // Variance nulle sur l'écart Elo (ex: tout le monde à 1500) => pas de droite
        if (regression.getN() >= 2 && regression.getXSumSquares() > 0) {
            slope = regression.getSlope();
            intercept = regression.getIntercept();
            double ssTot = regression.getTotalSumSquares();
            rSquared = ssTot > 0 ? 1.0 - regression.getSumSquaredErrors() / ssTot : 0.0;
        }

        int n = points.size();
        double avgGap = points.stream().mapToDouble(p -> Math.abs(p.ratingDiff())).average().orElse(0.0);
        double avgMargin = points.stream().mapToDouble(CalibrationPoint::margin).average().orElse(0.0);
        long homeWins = points.stream().filter(p -> p.margin() > 0).count();

        return CalibrationResult.builder()
                .sport(sport)
                .sampleSize(n)
                .ratingToPoints(Rounding.toDecimals(slope * 100.0, 2))
                .homeAdvantage(Rounding.toDecimals(intercept, 2))
                .rSquared(Rounding.toDecimals(rSquared, 3))
                .averageRatingGap(Rounding.toDecimals(avgGap, 1))
                .averageMargin(Rounding.toDecimals(avgMargin, 2))
                .homeWinPct(n == 0 ? 0.0 : Rounding.toDecimals(homeWins * 100.0 / n, 1))
                .recentPoints(List.copyOf(points.subList(Math.max(0, n - RECENT_POINTS), n)))
                .build();
    }
}
