package com.tony.gameForecast.service;

import com.tony.gameForecast.model.Sport;
import com.tony.gameForecast.model.SportProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EloServiceTest {

    private final EloService eloService = new EloService();
    private final SportProfile nfl = SportProfile.defaultsFor(Sport.NFL);

    @Test
    @DisplayName("Deux équipes égales sans avantage du terrain : 50%")
    void expectedScoreIsEvenWithoutHomeAdvantage() {
        assertThat(eloService.expectedHomeScore(1500, 1500, 0)).isEqualTo(0.5);
        assertThat(eloService.expectedHomeScore(1500, 1500, 48)).isCloseTo(0.5686, within(1e-4));
    }

    @Test
    @DisplayName("Victoire domicile 24-20 : +17 / -17 avec le multiplicateur de marge")
    void shouldUpdateBothTeamsAfterHomeWin() {
        RatingStore store = new RatingStore();

        eloService.updateRatings(store, "A", "B", 24, 20, nfl);

        assertThat(store.get("A")).isEqualTo(1517.0);
        assertThat(store.get("B")).isEqualTo(1483.0);
    }

    @Test
    @DisplayName("Un nul coûte des points au favori domicile")
    void tieShouldMoveRatingsTowardUnderdog() {
        RatingStore store = new RatingStore();

        eloService.updateRatings(store, "H", "A", 20, 20, nfl);

        assertThat(store.get("H")).isEqualTo(1499.0);
        assertThat(store.get("A")).isEqualTo(1501.0);
    }

    @Test
    @DisplayName("Sans marge de victoire, K reste fixe")
    void shouldUseFlatKWithoutMarginScaling() {
        SportProfile flat = SportProfile.defaultsFor(Sport.NFL);
        flat.setMarginOfVictoryScaling(false);
        RatingStore store = new RatingStore();

        eloService.updateRatings(store, "H", "A", 20, 24, flat);

        assertThat(store.get("H")).isEqualTo(1489.0);
        assertThat(store.get("A")).isEqualTo(1511.0);
    }

    @Test
    @DisplayName("Multiplicateur de marge : 1 pour un nul, logarithmique sinon")
    void marginMultiplier() {
        assertThat(eloService.marginMultiplier(0)).isEqualTo(1.0);
        assertThat(eloService.marginMultiplier(-4)).isEqualTo(eloService.marginMultiplier(4));
        assertThat(eloService.marginMultiplier(4)).isCloseTo(Math.log(5) * 0.7 + 0.8, within(1e-12));
    }

    @Test
    @DisplayName("Les ratings reportés servent de point de départ")
    void shouldStartFromCarriedOverRatings() {
        RatingStore store = new RatingStore(Map.of("A", 1600.0));

        assertThat(store.get("A")).isEqualTo(1600.0);
        assertThat(store.get("UNKNOWN")).isEqualTo(1500.0);
        assertThat(store.contains("UNKNOWN")).isFalse();
    }
}
