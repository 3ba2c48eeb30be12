package com.tony.gameForecast.service;

import com.tony.gameForecast.model.SimulationParams;
import com.tony.gameForecast.model.TunableParameter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class NearDuplicateFilterTest {

    private final NearDuplicateFilter<SimulationParams> filter = new NearDuplicateFilter<>(Map.of(
            TunableParameter.SPREAD_SHRINKAGE, 0.05,
            TunableParameter.RATING_CAP, 1.0,
            TunableParameter.MAX_SPREAD, 1.0), Function.identity());

    @Test
    @DisplayName("Quasi-doublon seulement si tous les paramètres surveillés sont proches")
    void nearDuplicateNeedsAllParametersClose() {
        SimulationParams a = params(0.30, 4, 8, 5.93);

        assertThat(filter.isNearDuplicate(a, params(0.32, 4.5, 8.5, 7.0))).isTrue();
        assertThat(filter.isNearDuplicate(a, params(0.35, 4, 8, 5.93))).isFalse();
        assertThat(filter.isNearDuplicate(a, params(0.30, 5, 8, 5.93))).isFalse();
    }

    @Test
    @DisplayName("Garde le premier de chaque groupe, dans l'ordre du classement, jusqu'à la limite")
    void selectShouldKeepDiverseTopResults() {
        List<SimulationParams> ranked = List.of(
                params(0.30, 4, 8, 5.93),
                params(0.31, 4, 8, 4.0),
                params(0.45, 0, 12, 5.93),
                params(0.20, 6, 5, 5.93),
                params(0.10, 8, 3, 5.93));

        assertThat(filter.select(ranked, 10)).containsExactly(ranked.get(0), ranked.get(2), ranked.get(3), ranked.get(4));
        assertThat(filter.select(ranked, 2)).containsExactly(ranked.get(0), ranked.get(2));
    }

    @Test
    @DisplayName("Sans tolérance, rien n'est écarté")
    void noToleranceKeepsEverything() {
        NearDuplicateFilter<SimulationParams> none = new NearDuplicateFilter<>(Map.of(), Function.identity());
        SimulationParams a = params(0.3, 4, 8, 5.93);

        assertThat(none.select(List.of(a, a), 5)).hasSize(2);
    }

    private SimulationParams params(double shrinkage, double cap, double maxSpread, double ratingToPoints) {
        return SimulationParams.builder()
                .ratingToPoints(ratingToPoints)
                .homeAdvantage(2.28)
                .spreadShrinkage(shrinkage)
                .ratingCap(cap)
                .maxSpread(maxSpread)
                .statsRegression(0.3)
                .build();
    }
}
