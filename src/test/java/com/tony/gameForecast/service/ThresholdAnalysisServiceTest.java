package com.tony.gameForecast.service;

import com.tony.gameForecast.config.ForecastProperties;
import com.tony.gameForecast.model.Game;
import com.tony.gameForecast.model.LineSource;
import com.tony.gameForecast.model.MarketLine;
import com.tony.gameForecast.model.Sport;
import com.tony.gameForecast.model.dto.FilterStats;
import com.tony.gameForecast.model.dto.ThresholdReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.tony.gameForecast.service.TestGames.line;
import static org.assertj.core.api.Assertions.assertThat;

class ThresholdAnalysisServiceTest {

    private ThresholdAnalysisService thresholdService;

    @BeforeEach
    void setUp() {
        ForecastProperties properties = new ForecastProperties();
        thresholdService = new ThresholdAnalysisService(TestGames.backtestingService(properties), properties);
    }

    @Test
    @DisplayName("Seuls les matchs avec ligne de marché sont analysés")
    void shouldOnlyUseMarketGradedGames() {
        List<Game> season = TestGames.season(40, 17);
        List<MarketLine> lines = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            lines.add(line(season.get(i).getId(), i % 2 == 0 ? -3.0 : 2.5, 44.0));
        }

        ThresholdReport report = thresholdService.analyze(Sport.NFL, season, lines, null, null, 5);

        assertThat(report.getTotalGames()).isEqualTo(30);
        assertThat(report.getBaseline().getGames()).isEqualTo(30);
        assertThat(report.getBaseline().getSpread().graded()).isEqualTo(30);

        FilterStats favorites = byName(report, "Favoris uniquement");
        FilterStats underdogs = byName(report, "Outsiders uniquement");
        assertThat(favorites.getGames() + underdogs.getGames()).isEqualTo(30);
        assertThat(favorites.getSpreadProfit())
                .isEqualTo(favorites.getSpread().wins() * 100.0 - favorites.getSpread().losses() * 110.0);
    }

    @Test
    @DisplayName("Classement par % ATS parmi les filtres assez fournis")
    void shouldRankQualifiedFilters() {
        List<Game> season = TestGames.season(40, 23);
        List<MarketLine> lines = season.stream().map(g -> line(g.getId(), -2.5, 45.0)).toList();

        ThresholdReport report = thresholdService.analyze(Sport.NFL, season, lines, null, null, 10);

        List<FilterStats> ranked = report.getBySpread();
        assertThat(ranked).hasSizeLessThanOrEqualTo(10).allSatisfy(s -> assertThat(s.getGames()).isGreaterThanOrEqualTo(10));
        for (int i = 1; i < ranked.size(); i++) {
            assertThat(ranked.get(i).getSpread().winPct()).isLessThanOrEqualTo(ranked.get(i - 1).getSpread().winPct());
        }
        assertThat(report.getAll()).extracting(FilterStats::getName).contains("Écart Elo >= 50", "Edge spread >= 2.5");
    }

    @Test
    @DisplayName("Total : seuls les matchs avec un total de marché sont comptés")
    void totalRecordIgnoresBaselineGradedGames() {
        List<Game> season = TestGames.season(10, 3);
        List<MarketLine> lines = new ArrayList<>();
        for (int i = 0; i < season.size(); i++) {
            lines.add(line(season.get(i).getId(), -3.0, i < 4 ? 44.0 : null));
        }

        ThresholdReport report = thresholdService.analyze(Sport.NFL, season, lines, null, null, 1);

        assertThat(report.getTotalGames()).isEqualTo(10);
        assertThat(report.getBaseline().getSpread().graded()).isEqualTo(10);
        assertThat(report.getBaseline().getTotal().lineSource()).isEqualTo(LineSource.MARKET);
        assertThat(report.getBaseline().getTotal().graded()).isEqualTo(4);
        assertThat(report.getBaseline().getMoneyline().graded()).isEqualTo(10);
        assertThat(report.getByTotal()).allSatisfy(s -> assertThat(s.getTotal().graded()).isBetween(1, 4));
    }

    @Test
    @DisplayName("Aucune ligne : rapport vide sans erreur")
    void noLinesGivesEmptyReport() {
        ThresholdReport report = thresholdService.analyze(Sport.NFL, TestGames.season(10, 1), List.of(), null, null, null);

        assertThat(report.getTotalGames()).isZero();
        assertThat(report.getMinGames()).isEqualTo(ThresholdAnalysisService.DEFAULT_MIN_GAMES);
        assertThat(report.getBySpread()).isEmpty();
        assertThat(report.getBaseline().getSpread().winPct()).isZero();
    }

    private FilterStats byName(ThresholdReport report, String name) {
        return report.getAll().stream().filter(s -> s.getName().equals(name)).findFirst().orElseThrow();
    }
}
