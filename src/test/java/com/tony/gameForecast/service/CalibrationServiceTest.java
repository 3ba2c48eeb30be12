package com.tony.gameForecast.service;

import com.tony.gameForecast.model.Game;
import com.tony.gameForecast.model.Sport;
import com.tony.gameForecast.model.dto.CalibrationPoint;
import com.tony.gameForecast.model.dto.CalibrationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CalibrationServiceTest {

    @Mock
    private BacktestingService backtestingService;

    @InjectMocks
    private CalibrationService calibrationService;

    @Test
    @DisplayName("Données parfaitement linéaires : pente 5 pts / 100 Elo, ordonnée 2, R² = 1")
    void shouldRecoverLinearRelationship() {
        List<CalibrationPoint> points = new ArrayList<>();
        for (int diff = -200; diff <= 200; diff += 20) {
            // marge = 0.05 * écart + 2
            points.add(new CalibrationPoint("g" + diff, diff, diff / 20 + 2));
        }

        CalibrationResult result = calibrationService.calibrate(Sport.NFL, points);

        assertThat(result.getRatingToPoints()).isCloseTo(5.0, within(1e-9));
        assertThat(result.getHomeAdvantage()).isCloseTo(2.0, within(1e-9));
        assertThat(result.getRSquared()).isCloseTo(1.0, within(1e-9));
        assertThat(result.getSampleSize()).isEqualTo(21);
        assertThat(result.getRecentPoints()).hasSize(20);
        assertThat(result.getRecentPoints().get(19).gameId()).isEqualTo("g200");
        assertThat(result.isDegenerate()).isFalse();
    }

    @Test
    @DisplayName("Écart Elo constant : régression impossible, pente et ordonnée à 0")
    void constantRatingDiffIsDegenerate() {
        List<CalibrationPoint> points = List.of(
                new CalibrationPoint("g1", 0, 3),
                new CalibrationPoint("g2", 0, -7),
                new CalibrationPoint("g3", 0, 10));

        CalibrationResult result = calibrationService.calibrate(Sport.NFL, points);

        assertThat(result.getRatingToPoints()).isZero();
        assertThat(result.getHomeAdvantage()).isZero();
        assertThat(result.getRSquared()).isZero();
        assertThat(result.isDegenerate()).isTrue();
        assertThat(result.getAverageMargin()).isEqualTo(2.0);
        assertThat(result.getHomeWinPct()).isEqualTo(66.7);
    }

    @Test
    @DisplayName("Moins de deux points : aucune erreur")
    void tooFewPoints() {
        CalibrationResult empty = calibrationService.calibrate(Sport.NBA, List.of());
        CalibrationResult single = calibrationService.calibrate(Sport.NBA, List.of(new CalibrationPoint("g1", 40, 6)));

        assertThat(empty.getSampleSize()).isZero();
        assertThat(empty.getHomeWinPct()).isZero();
        assertThat(single.isDegenerate()).isTrue();
        assertThat(single.getAverageRatingGap()).isEqualTo(40.0);
    }

    @Test
    @DisplayName("Marges constantes : R² nul plutôt qu'une division par zéro")
    void constantMarginsGiveZeroRSquared() {
        List<CalibrationPoint> points = List.of(
                new CalibrationPoint("g1", -50, 3),
                new CalibrationPoint("g2", 0, 3),
                new CalibrationPoint("g3", 50, 3));

        CalibrationResult result = calibrationService.calibrate(Sport.NFL, points);

        assertThat(result.getRatingToPoints()).isZero();
        assertThat(result.getHomeAdvantage()).isEqualTo(3.0);
        assertThat(result.getRSquared()).isZero();
    }

    @Test
    @DisplayName("La calibration d'une saison passe par la rejoue chronologique")
    void shouldCollectPointsFromBacktest() {
        List<Game> games = List.of(TestGames.finalGame("g1", "A", "B", 0, 24, 20));
        List<CalibrationPoint> points = List.of(
                new CalibrationPoint("g1", -100, -4),
                new CalibrationPoint("g2", 100, 8));
        when(backtestingService.collectCalibrationPoints(Sport.NFL, games, Map.of())).thenReturn(points);

        CalibrationResult result = calibrationService.calibrate(Sport.NFL, games, Map.of());

        assertThat(result.getRatingToPoints()).isCloseTo(6.0, within(1e-9));
        assertThat(result.getHomeAdvantage()).isCloseTo(2.0, within(1e-9));
        verify(backtestingService, times(1)).collectCalibrationPoints(Sport.NFL, games, Map.of());
    }
}
