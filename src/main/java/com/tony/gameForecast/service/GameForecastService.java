package com.tony.gameForecast.service;

import com.tony.gameForecast.config.ForecastProperties;
import com.tony.gameForecast.model.EdgeStrength;
import com.tony.gameForecast.model.Game;
import com.tony.gameForecast.model.Market;
import com.tony.gameForecast.model.MarketLine;
import com.tony.gameForecast.model.Pick;
import com.tony.gameForecast.model.PredictionRecord;
import com.tony.gameForecast.model.RatingDefaults;
import com.tony.gameForecast.model.SimulationParams;
import com.tony.gameForecast.model.Sport;
import com.tony.gameForecast.model.SportProfile;
import com.tony.gameForecast.model.Team;
import com.tony.gameForecast.model.TeamForm;
import com.tony.gameForecast.model.dto.GameForecast;
import com.tony.gameForecast.util.Rounding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Prédictions des matchs à venir à partir de l'état courant des équipes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameForecastService {

    private static final double BET_EDGE = 2.5;          // Points d'écart avec le marché
    private static final double MONEYLINE_FAVORITE = 0.6; // Probabilité mini pour un pari moneyline
    private static final double MONEYLINE_UNDERDOG = 0.4;

    private final ScorePredictionService predictionService;
    private final ConfidenceTierService confidenceTierService;
    private final ForecastProperties properties;

    /**
     * @param params Constantes à utiliser, ou null pour celles du profil du sport
     */
    public List<GameForecast> forecast(Sport sport, List<Team> teams, List<Game> games,
                                       List<MarketLine> marketLines, SimulationParams params) {
        SportProfile profile = properties.profile(sport);
        SimulationParams effective = params != null ? params : profile.toSimulationParams();

        Map<String, Team> teamsById = teams == null ? Map.of() : teams.stream()
                .collect(Collectors.toMap(Team::getId, Function.identity(), (a, b) -> b, HashMap::new));
        Map<String, MarketLine> linesByGame = MarketLines.byGame(marketLines);

        List<GameForecast> forecasts = games.stream()
                .filter(g -> {
                    if (g.isFinal()) log.debug("Match {} déjà terminé, pas de prédiction", g.getId());
                    return !g.isFinal();
                })
                .sorted(Comparator.comparing(Game::getGameTime, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(Game::getId))
                .map(g -> forecastGame(g, teamsById, linesByGame.get(g.getId()), effective, profile))
                .toList();

        log.info("🔮 {} prédictions {} générées", forecasts.size(), sport);
        return forecasts;
    }

    GameForecast forecastGame(Game game, Map<String, Team> teamsById, MarketLine line,
                              SimulationParams params, SportProfile profile) {
        TeamForm home = form(game.getHomeTeamId(), teamsById);
        TeamForm away = form(game.getAwayTeamId(), teamsById);

        PredictionRecord prediction = predictionService.predict(game.getId(), home, away, game.getWeatherImpact(), params, profile);
        prediction = confidenceTierService.withTiers(prediction, line, profile);

        Double edgeSpread = line != null && line.hasSpread()
                ? Rounding.toDecimals(line.getSpread() - prediction.getSpread(), 2) : null;
        Double edgeTotal = line != null && line.hasTotal()
                ? Rounding.toDecimals(prediction.getTotal() - line.getTotal(), 2) : null;

        double strongest = Math.max(abs(edgeSpread), abs(edgeTotal));

        GameForecast.GameForecastBuilder builder = GameForecast.builder()
                .gameId(game.getId())
                .gameTime(game.getGameTime())
                .homeTeam(displayName(game.getHomeTeamId(), teamsById))
                .awayTeam(displayName(game.getAwayTeamId(), teamsById))
                .homeRating(home.rating())
                .awayRating(away.rating())
                .prediction(prediction)
                .marketLine(line)
                .edgeSpread(edgeSpread)
                .edgeTotal(edgeTotal)
                .edgeStrength(EdgeStrength.of(strongest));

        // Priorité : spread, puis total, puis moneyline si favori net
        if (abs(edgeSpread) >= BET_EDGE) {
            builder.recommendedMarket(Market.SPREAD).recommendedPick(edgeSpread > 0 ? Pick.HOME : Pick.AWAY);
        } else if (abs(edgeTotal) >= BET_EDGE) {
            builder.recommendedMarket(Market.TOTAL).recommendedPick(edgeTotal > 0 ? Pick.OVER : Pick.UNDER);
        } else if (prediction.getHomeWinProbability() >= MONEYLINE_FAVORITE) {
            builder.recommendedMarket(Market.MONEYLINE).recommendedPick(Pick.HOME);
        } else if (prediction.getHomeWinProbability() <= MONEYLINE_UNDERDOG) {
            builder.recommendedMarket(Market.MONEYLINE).recommendedPick(Pick.AWAY);
        }
        return builder.build();
    }

    private TeamForm form(String teamId, Map<String, Team> teamsById) {
        Team team = teamsById.get(teamId);
        if (team == null) {
            log.warn("Équipe {} inconnue, rating et moyennes par défaut", teamId);
            return new TeamForm(teamId, RatingDefaults.INITIAL_RATING, null, null);
        }
        return TeamForm.of(team);
    }

    private String displayName(String teamId, Map<String, Team> teamsById) {
        Team team = teamsById.get(teamId);
        return team != null ? team.displayName() : teamId;
    }

    private double abs(Double value) {
        return value == null ? 0.0 : Math.abs(value);
    }
}
