package com.tony.gameForecast.service;

import com.tony.gameForecast.model.SimulationParams;
import com.tony.gameForecast.model.Sport;
import com.tony.gameForecast.model.SportProfile;
import com.tony.gameForecast.model.TunableParameter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterGridTest {

    private final SimulationParams baseline = SportProfile.defaultsFor(Sport.NFL).toSimulationParams().toBuilder()
            .spreadShrinkage(0.0).ratingCap(0.0).build();

    @Test
    @DisplayName("Valeurs nulles ou absentes : bloc refusé")
    void shouldRejectMissingValues() {
        ParameterGrid.Block block = ParameterGrid.Block.named("custom");

        assertThatThrownBy(() -> block.with(TunableParameter.RATING_CAP, (List<Double>) null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("RATING_CAP");
        assertThatThrownBy(() -> block.with(TunableParameter.RATING_CAP, Arrays.asList(2.0, null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(block.getValues()).isEmpty();
    }

    @Test
    @DisplayName("Un bloc est le produit cartésien de ses listes de valeurs")
    void blockShouldExpandToCartesianProduct() {
        ParameterGrid grid = new ParameterGrid(List.of(ParameterGrid.Block.named("combo")
                .with(TunableParameter.SPREAD_SHRINKAGE, 0.2, 0.3)
                .with(TunableParameter.MAX_SPREAD, 5, 7, 10)));

        List<SimulationParams> candidates = grid.candidates(baseline);

        assertThat(candidates).hasSize(1 + 6);
        assertThat(candidates.get(0)).isEqualTo(baseline);
        assertThat(candidates.get(1).getSpreadShrinkage()).isEqualTo(0.2);
        assertThat(candidates.get(1).getMaxSpread()).isEqualTo(5.0);
        assertThat(candidates.get(6).getSpreadShrinkage()).isEqualTo(0.3);
        assertThat(candidates.get(6).getMaxSpread()).isEqualTo(10.0);
        // Les autres paramètres restent ceux de la baseline
        assertThat(candidates).allSatisfy(c -> assertThat(c.getRatingToPoints()).isEqualTo(5.93));
    }

    @Test
    @DisplayName("Les doublons exacts entre blocs sont fusionnés")
    void shouldCollapseExactDuplicates() {
        ParameterGrid grid = new ParameterGrid(List.of(
                ParameterGrid.Block.named("a").with(TunableParameter.RATING_CAP, 0, 4),
                ParameterGrid.Block.named("b").with(TunableParameter.RATING_CAP, 4, 6)));

        List<SimulationParams> candidates = grid.candidates(baseline);

        assertThat(candidates).extracting(SimulationParams::getRatingCap).containsExactly(0.0, 4.0, 6.0);
    }

    @Test
    @DisplayName("Recherche standard : baseline en tête, balayages, combinaisons et affinage, sans doublon")
    void standardGrid() {
        ParameterGrid grid = ParameterGrid.standard();
        List<SimulationParams> candidates = grid.candidates(baseline);

        assertThat(grid.getBlocks()).extracting(ParameterGrid.Block::getName)
                .contains("spread-shrinkage", "deep-search", "home-advantage");
        assertThat(candidates.get(0)).isEqualTo(baseline);
        assertThat(new HashSet<>(candidates)).hasSameSizeAs(candidates);
        // 4 x 3 x 3 combinaisons pour l'affinage
        assertThat(candidates).filteredOn(c -> c.getSpreadShrinkage() == 0.15).hasSize(9);
        assertThat(candidates.size()).isGreaterThan(80);
    }
}
