package com.tony.gameForecast.service;

import com.tony.gameForecast.config.ForecastProperties;
import com.tony.gameForecast.model.ConfidenceTier;
import com.tony.gameForecast.model.EdgeStrength;
import com.tony.gameForecast.model.Game;
import com.tony.gameForecast.model.GameStatus;
import com.tony.gameForecast.model.Market;
import com.tony.gameForecast.model.MarketLine;
import com.tony.gameForecast.model.Pick;
import com.tony.gameForecast.model.Sport;
import com.tony.gameForecast.model.Team;
import com.tony.gameForecast.model.dto.GameForecast;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tony.gameForecast.service.TestGames.KICKOFF;
import static com.tony.gameForecast.service.TestGames.line;
import static org.assertj.core.api.Assertions.assertThat;

class GameForecastServiceTest {

    private GameForecastService forecastService;
    private final List<Team> teams = List.of(
            Team.builder().id("H").abbreviation("KC").build(),
            Team.builder().id("A").abbreviation("BUF").build(),
            Team.builder().id("S").abbreviation("SF").rating(1650.0).build());

    @BeforeEach
    void setUp() {
        forecastService = new GameForecastService(new ScorePredictionService(new EloService()),
                new ConfidenceTierService(), new ForecastProperties());
    }

    @Test
    @DisplayName("Edge spread >= 2.5 : pari spread du côté sous-évalué")
    void shouldRecommendSpread() {
        GameForecast forecast = single(upcoming("g1", "H", "A"), line("g1", -4.5, 44.0));

        assertThat(forecast.getHomeTeam()).isEqualTo("KC");
        assertThat(forecast.getPrediction().getSpread()).isEqualTo(-1.0);
        assertThat(forecast.getEdgeSpread()).isEqualTo(-3.5);
        assertThat(forecast.getEdgeTotal()).isEqualTo(0.0);
        assertThat(forecast.getEdgeStrength()).isEqualTo(EdgeStrength.STRONG);
        assertThat(forecast.getRecommendedMarket()).isEqualTo(Market.SPREAD);
        assertThat(forecast.getRecommendedPick()).isEqualTo(Pick.AWAY);
        assertThat(forecast.getPrediction().getConfidence().spread()).isEqualTo(ConfidenceTier.HIGH);
    }

    @Test
    @DisplayName("Spread aligné, total éloigné : pari sur le total")
    void shouldRecommendTotal() {
        GameForecast forecast = single(upcoming("g1", "H", "A"), line("g1", -2.0, 40.0));

        assertThat(forecast.getEdgeSpread()).isEqualTo(-1.0);
        assertThat(forecast.getEdgeTotal()).isEqualTo(4.0);
        assertThat(forecast.getRecommendedMarket()).isEqualTo(Market.TOTAL);
        assertThat(forecast.getRecommendedPick()).isEqualTo(Pick.OVER);
    }

    @Test
    @DisplayName("Sans ligne : moneyline seulement si le favori dépasse 60%")
    void moneylineOnlyForClearFavorites() {
        GameForecast even = single(upcoming("g1", "H", "A"), null);
        GameForecast lopsided = single(upcoming("g2", "S", "A"), null);

        assertThat(even.getEdgeSpread()).isNull();
        assertThat(even.getEdgeStrength()).isEqualTo(EdgeStrength.WEAK);
        assertThat(even.getRecommendedMarket()).isNull();

        assertThat(lopsided.getPrediction().getHomeWinProbability()).isGreaterThan(0.6);
        assertThat(lopsided.getRecommendedMarket()).isEqualTo(Market.MONEYLINE);
        assertThat(lopsided.getRecommendedPick()).isEqualTo(Pick.HOME);
    }

    @Test
    @DisplayName("Les matchs terminés sont ignorés, les autres triés par date")
    void shouldSkipFinalGamesAndSort() {
        Game later = upcoming("late", "H", "A").toBuilder().gameTime(KICKOFF.plusDays(3)).build();
        Game played = TestGames.finalGame("done", "H", "A", -7, 20, 17);
        Game unknownTeam = upcoming("early", "NEW", "A");

        List<GameForecast> forecasts = forecastService.forecast(Sport.NFL, teams, List.of(later, played, unknownTeam), null, null);

        assertThat(forecasts).extracting(GameForecast::getGameId).containsExactly("early", "late");
        assertThat(forecasts.get(0).getHomeRating()).isEqualTo(1500.0);
        assertThat(forecasts.get(0).getHomeTeam()).isEqualTo("NEW");
    }

    @Test
    @DisplayName("Plusieurs lignes : la ligne figée l'emporte, comme en backtest")
    void lockedLineWins() {
        MarketLine locked = line("g1", -3.0, 45.0).toBuilder().lockedAt(KICKOFF.minusHours(1)).build();
        MarketLine later = line("g1", -6.0, 41.0).toBuilder().capturedAt(KICKOFF.plusMinutes(5)).build();

        List<GameForecast> forecasts = forecastService.forecast(Sport.NFL, teams, List.of(upcoming("g1", "H", "A")),
                List.of(locked, later), null);

        assertThat(forecasts.get(0).getMarketLine()).isEqualTo(locked);
        assertThat(forecasts.get(0).getEdgeSpread()).isEqualTo(-2.0);
    }

    @Test
    @DisplayName("Force de l'edge : faible < 1.5 <= modéré < 3 <= fort")
    void edgeStrength() {
        assertThat(EdgeStrength.of(1.49)).isEqualTo(EdgeStrength.WEAK);
        assertThat(EdgeStrength.of(-1.5)).isEqualTo(EdgeStrength.MODERATE);
        assertThat(EdgeStrength.of(3.0)).isEqualTo(EdgeStrength.STRONG);
    }

    private GameForecast single(Game game, MarketLine line) {
        List<GameForecast> forecasts = forecastService.forecast(Sport.NFL, teams, List.of(game),
                line == null ? List.of() : List.of(line), null);
        assertThat(forecasts).hasSize(1);
        return forecasts.get(0);
    }

    private Game upcoming(String id, String home, String away) {
        return Game.builder().id(id).homeTeamId(home).awayTeamId(away).gameTime(KICKOFF).status(GameStatus.SCHEDULED).build();
    }
}
