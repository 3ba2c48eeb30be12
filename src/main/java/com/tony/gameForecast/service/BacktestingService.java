package com.tony.gameForecast.service;

import com.tony.gameForecast.config.ForecastProperties;
import com.tony.gameForecast.model.BacktestResult;
import com.tony.gameForecast.model.Game;
import com.tony.gameForecast.model.GradedBet;
import com.tony.gameForecast.model.GradingMode;
import com.tony.gameForecast.model.LineSource;
import com.tony.gameForecast.model.Market;
import com.tony.gameForecast.model.MarketLine;
import com.tony.gameForecast.model.PredictionRecord;
import com.tony.gameForecast.model.SimulationParams;
import com.tony.gameForecast.model.SimulationResult;
import com.tony.gameForecast.model.Sport;
import com.tony.gameForecast.model.SportProfile;
import com.tony.gameForecast.model.Team;
import com.tony.gameForecast.model.TeamForm;
import com.tony.gameForecast.model.dto.BacktestReport;
import com.tony.gameForecast.model.dto.BacktestSummary;
import com.tony.gameForecast.model.dto.CalibrationPoint;
import com.tony.gameForecast.model.dto.MarketRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rejoue une saison match par match, dans l'ordre chronologique.
 * Pour le match N, ratings et moyennes ne dépendent que des matchs strictement antérieurs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestingService {

    private static final Comparator<Game> CHRONOLOGICAL =
            Comparator.comparing(Game::getGameTime).thenComparing(Game::getId);

    private final ScorePredictionService predictionService;
    private final EloService eloService;
    private final GradingService gradingService;
    private final ConfidenceTierService confidenceTierService;
    private final ForecastProperties properties;

    /**
     * Backtest complet avec journal et résumé dans les logs.
     */
    public BacktestReport runBacktest(Sport sport, List<Team> teams, List<Game> games, List<MarketLine> marketLines,
                                      Map<String, Double> initialRatings, SimulationParams params) {
        log.info("🔁 Backtest {} : {} matchs, {} lignes de marché", sport, size(games), size(marketLines));

        BacktestReport report = replay(sport, teams, games, marketLines, initialRatings, params);

        BacktestSummary summary = report.getSummary();
        if (summary.getTotalGames() > 0) {
            log.info("📊 --- RÉSULTATS DU BACKTEST {} ---", sport);
            log.info("🏟️  Matchs évalués : {} (ignorés : {})", summary.getTotalGames(), summary.getSkippedGames());
            for (MarketRecord r : summary.getRecords()) {
                if (r.graded() == 0) continue;
                log.info("🎯 {} [{}] : {}-{}-{} ({}%)", r.market(), r.lineSource(),
                        r.wins(), r.losses(), r.pushes(), r.winPct());
            }
        } else {
            log.warn("Aucun match terminé exploitable ({} ignorés).", summary.getSkippedGames());
        }
        return report;
    }

    /**
     * Même rejoue que {@link #runBacktest}, sans logs (utilisée par l'optimiseur).
     */
    public BacktestReport replay(Sport sport, List<Team> teams, List<Game> games, List<MarketLine> marketLines,
                                 Map<String, Double> initialRatings, SimulationParams params) {
        SportProfile profile = properties.profile(sport);
        Map<String, String> names = teamNames(teams);
        Map<String, MarketLine> linesByGame = MarketLines.byGame(marketLines);

        List<Game> ordered = chronological(games, profile);
        int skipped = size(games) - ordered.size();

        RatingStore store = new RatingStore(initialRatings);
        ScoringLedger ledger = new ScoringLedger();
        List<BacktestResult> results = new ArrayList<>(ordered.size());

        for (Game game : ordered) {
            String homeId = game.getHomeTeamId();
            String awayId = game.getAwayTeamId();
            int homeScore = game.getHomeScore();
            int awayScore = game.getAwayScore();

            // 1. État avant match
            double homeRating = store.get(homeId);
            double awayRating = store.get(awayId);
            TeamForm home = new TeamForm(homeId, homeRating, ledger.pointsScored(homeId), ledger.pointsAllowed(homeId));
            TeamForm away = new TeamForm(awayId, awayRating, ledger.pointsScored(awayId), ledger.pointsAllowed(awayId));

            // 2. Prédiction
            MarketLine line = linesByGame.get(game.getId());
            PredictionRecord prediction = predictionService.predict(game.getId(), home, away, game.getWeatherImpact(), params, profile);
            prediction = confidenceTierService.withTiers(prediction, line, profile);

            // 3. Correction
            results.add(BacktestResult.builder()
                    .gameId(game.getId())
                    .gameTime(game.getGameTime())
                    .week(game.getWeek())
                    .homeTeam(names.getOrDefault(homeId, homeId))
                    .awayTeam(names.getOrDefault(awayId, awayId))
                    .homeRating(homeRating)
                    .awayRating(awayRating)
                    .prediction(prediction)
                    .marketLine(line)
                    .actualHomeScore(homeScore)
                    .actualAwayScore(awayScore)
                    .spread(gradingService.gradeSpread(prediction, homeScore, awayScore, line))
                    .moneyline(gradingService.gradeMoneyline(prediction, homeScore, awayScore))
                    .total(gradingService.gradeTotal(prediction, homeScore, awayScore, line, profile))
                    .build());

            log.debug("{} {}-{} : prédit {}-{}, spread {}", game.getId(), homeScore, awayScore,
                    prediction.getHomeScore(), prediction.getAwayScore(), prediction.getSpread());

            // 4. Mise à jour APRÈS le match
            eloService.updateRatings(store, homeId, awayId, homeScore, awayScore, profile);
            ledger.record(homeId, awayId, homeScore, awayScore);
        }

        return BacktestReport.builder()
                .sport(sport)
                .results(results)
                .summary(summarize(results, skipped))
                .finalRatings(store.snapshot())
                .build();
    }

    /**
     * Un essai de l'optimiseur : rejoue depuis zéro et compte les paris spread dans la fenêtre [minSpread, maxSpread].
     */
    public SimulationResult simulate(Sport sport, List<Game> games, List<MarketLine> marketLines,
                                     SimulationParams params, GradingMode mode) {
        BacktestReport report = replay(sport, List.of(), games, marketLines, null, params);
        ForecastProperties.Optimizer settings = properties.getOptimizer();

        int wins = 0;
        int losses = 0;
        int pushes = 0;
        for (BacktestResult result : report.getResults()) {
            double predictedSpread = result.getPrediction().getSpread();
            if (!params.isBettable(predictedSpread)) continue;

            GradedBet bet;
            if (mode == GradingMode.MARKET_LINE) {
                if (!result.hasMarketSpread()) continue;
                bet = gradingService.gradeSpread(predictedSpread, result.getMarketLine().getSpread(),
                        LineSource.MARKET, result.actualMargin());
            } else {
                bet = gradingService.gradeSpread(predictedSpread, predictedSpread, LineSource.MODEL, result.actualMargin());
            }

            if (bet.isWin()) wins++;
            else if (bet.isLoss()) losses++;
            else pushes++;
        }

        return SimulationResult.builder()
                .params(params)
                .gradingMode(mode)
                .totalGames(report.getResults().size())
                .wins(wins)
                .losses(losses)
                .pushes(pushes)
                .profit(wins * settings.getStake() - losses * settings.getRisk())
                .build();
    }

    /**
     * Passe chronologique sur les ratings seuls : (écart Elo avant match, marge réelle) par match.
     */
    public List<CalibrationPoint> collectCalibrationPoints(Sport sport, List<Game> games, Map<String, Double> initialRatings) {
        SportProfile profile = properties.profile(sport);
        RatingStore store = new RatingStore(initialRatings);
        List<CalibrationPoint> points = new ArrayList<>();

        for (Game game : chronological(games, profile)) {
            double diff = store.get(game.getHomeTeamId()) - store.get(game.getAwayTeamId());
            points.add(new CalibrationPoint(game.getId(), diff, game.actualMargin()));
            eloService.updateRatings(store, game.getHomeTeamId(), game.getAwayTeamId(),
                    game.getHomeScore(), game.getAwayScore(), profile);
        }
        return points;
    }

    /**
     * Matchs exploitables, triés par date puis identifiant.
     */
    List<Game> chronological(List<Game> games, SportProfile profile) {
        if (games == null) return List.of();
        List<Game> valid = new ArrayList<>();
        for (Game game : games) {
            String reason = rejectionReason(game, profile);
            if (reason == null) {
                valid.add(game);
            } else {
                log.debug("Match {} ignoré : {}", game.getId(), reason);
            }
        }
        valid.sort(CHRONOLOGICAL);
        return valid;
    }

    private String rejectionReason(Game game, SportProfile profile) {
        if (game.getGameTime() == null) return "date manquante";
        if (!game.isFinal()) return "non terminé";
        if (!game.hasScores()) return "score manquant";
        if (game.getHomeTeamId().equals(game.getAwayTeamId())) return "équipe contre elle-même";
        if (game.isTie() && !profile.isTiesAllowed()) return "match nul impossible dans ce sport";
        return null;
    }

    private BacktestSummary summarize(List<BacktestResult> results, int skipped) {
        List<MarketRecord> records = List.of(
                record(results, Market.SPREAD, LineSource.MARKET),
                record(results, Market.SPREAD, LineSource.MODEL),
                record(results, Market.MONEYLINE, LineSource.NONE),
                record(results, Market.TOTAL, LineSource.MARKET),
                record(results, Market.TOTAL, LineSource.BASELINE));

        return BacktestSummary.builder()
                .totalGames(results.size())
                .skippedGames(skipped)
                .records(records)
                .build();
    }

    private MarketRecord record(List<BacktestResult> results, Market market, LineSource source) {
        List<GradedBet> bets = results.stream()
                .map(r -> r.bet(market))
                .filter(b -> b.lineSource() == source)
                .toList();
        return MarketRecord.tally(market, source, bets);
    }

    private Map<String, String> teamNames(List<Team> teams) {
        Map<String, String> names = new HashMap<>();
        if (teams != null) {
            for (Team team : teams) names.put(team.getId(), team.displayName());
        }
        return names;
    }

    private int size(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
