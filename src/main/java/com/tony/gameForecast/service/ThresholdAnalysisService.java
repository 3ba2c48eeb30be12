package com.tony.gameForecast.service;

import com.tony.gameForecast.config.ForecastProperties;
import com.tony.gameForecast.model.BacktestResult;
import com.tony.gameForecast.model.Game;
import com.tony.gameForecast.model.GradedBet;
import com.tony.gameForecast.model.LineSource;
import com.tony.gameForecast.model.Market;
import com.tony.gameForecast.model.MarketLine;
import com.tony.gameForecast.model.Pick;
import com.tony.gameForecast.model.SimulationParams;
import com.tony.gameForecast.model.Sport;
import com.tony.gameForecast.model.SportProfile;
import com.tony.gameForecast.model.dto.BacktestReport;
import com.tony.gameForecast.model.dto.FilterStats;
import com.tony.gameForecast.model.dto.MarketRecord;
import com.tony.gameForecast.model.dto.ThresholdReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Cherche les sous-ensembles de matchs où le modèle bat le marché (favoris, gros écarts Elo, gros edge...).
 * Seuls les matchs corrigés contre une ligne de marché sont analysés.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ThresholdAnalysisService {

    public static final int DEFAULT_MIN_GAMES = 20;
    private static final int TOP_FILTERS = 10;

    private final BacktestingService backtestingService;
    private final ForecastProperties properties;

    public ThresholdReport analyze(Sport sport, List<Game> games, List<MarketLine> marketLines,
                                   Map<String, Double> initialRatings, SimulationParams params, Integer minGames) {
        SportProfile profile = properties.profile(sport);
        SimulationParams effective = params != null ? params : profile.toSimulationParams();
        int threshold = minGames != null ? minGames : DEFAULT_MIN_GAMES;

        BacktestReport report = backtestingService.replay(sport, List.of(), games, marketLines, initialRatings, effective);
        List<BacktestResult> graded = report.getResults().stream()
                .filter(BacktestResult::hasMarketSpread)
                .toList();

        log.info("🔎 Analyse des seuils {} sur {} matchs avec ligne de marché", sport, graded.size());

        List<FilterStats> all = filters(profile).stream()
                .map(f -> stats(f.name(), f.description(), graded.stream().filter(f.predicate()).toList()))
                .toList();

        List<FilterStats> bySpread = rank(all, threshold, FilterStats::getSpread);
        List<FilterStats> byTotal = rank(all, threshold, FilterStats::getTotal);

        return ThresholdReport.builder()
                .sport(sport)
                .totalGames(graded.size())
                .minGames(threshold)
                .baseline(stats("Tous les matchs", "Aucun filtre", graded))
                .bySpread(bySpread)
                .byTotal(byTotal)
                .all(all)
                .build();
    }

    private List<FilterStats> rank(List<FilterStats> all, int minGames, Function<FilterStats, MarketRecord> market) {
        return all.stream()
                .filter(s -> market.apply(s).graded() >= minGames)
                .sorted(Comparator.comparingDouble((FilterStats s) -> market.apply(s).winPct()).reversed())
                .limit(TOP_FILTERS)
                .toList();
    }

    private FilterStats stats(String name, String description, List<BacktestResult> results) {
        MarketRecord spread = tally(results, Market.SPREAD);
        double stake = properties.getOptimizer().getStake();
        double risk = properties.getOptimizer().getRisk();
        return FilterStats.builder()
                .name(name)
                .description(description)
                .games(results.size())
                .spread(spread)
                .moneyline(tally(results, Market.MONEYLINE))
                .total(tally(results, Market.TOTAL))
                .spreadProfit(spread.wins() * stake - spread.losses() * risk)
                .build();
    }

    // Seuls les paris corrigés contre le marché comptent ; un total sans ligne (baseline) est écarté
    private MarketRecord tally(List<BacktestResult> results, Market market) {
        LineSource source = market == Market.MONEYLINE ? LineSource.NONE : LineSource.MARKET;
        List<GradedBet> bets = results.stream()
                .map(r -> r.bet(market))
                .filter(b -> b.lineSource() == source)
                .toList();
        return MarketRecord.tally(market, source, bets);
    }

    /**
     * Filtres testés. Les seuils d'edge suivent les paliers de confiance du sport.
     */
    List<ThresholdFilter> filters(SportProfile profile) {
        List<ThresholdFilter> filters = new ArrayList<>();

        filters.add(new ThresholdFilter("Favoris uniquement", "Le modèle prend le favori du marché",
                this::picksFavorite));
        filters.add(new ThresholdFilter("Outsiders uniquement", "Le modèle prend l'outsider du marché",
                r -> !picksFavorite(r)));

        for (int gap : new int[]{50, 75, 100, 125}) {
            filters.add(new ThresholdFilter("Écart Elo >= " + gap, "Écart Elo avant match d'au moins " + gap,
                    r -> r.ratingGap() >= gap));
        }

        for (double edge : new double[]{profile.getSpreadMediumEdge(), profile.getSpreadHighEdge()}) {
            filters.add(new ThresholdFilter("Edge spread >= " + edge, "Au moins " + edge + " points d'écart avec le marché",
                    r -> spreadEdge(r) >= edge));
        }

        filters.add(new ThresholdFilter("Favori net (>60%)", "Probabilité de victoire du favori supérieure à 60%",
                r -> favoriteProbability(r) > 0.60));
        filters.add(new ThresholdFilter("Très net favori (>65%)", "Probabilité de victoire du favori supérieure à 65%",
                r -> favoriteProbability(r) > 0.65));

        for (int gap : new int[]{50, 75}) {
            filters.add(new ThresholdFilter("Favori + écart Elo >= " + gap, "Pick favori et écart Elo d'au moins " + gap,
                    r -> picksFavorite(r) && r.ratingGap() >= gap));
        }

        filters.add(new ThresholdFilter("Elo aligné sur le marché", "Le favori Elo est aussi le favori du marché",
                this::aligned));
        filters.add(new ThresholdFilter("Elo aligné + écart >= 50", "Favori Elo = favori du marché, écart d'au moins 50",
                r -> aligned(r) && r.ratingGap() >= 50));

        for (double edge : new double[]{profile.getTotalMediumEdge(), profile.getTotalHighEdge()}) {
            filters.add(new ThresholdFilter("Edge total >= " + edge, "Au moins " + edge + " points d'écart sur le total",
                    r -> r.getMarketLine().hasTotal()
                            && Math.abs(r.getPrediction().getTotal() - r.getMarketLine().getTotal()) >= edge));
        }
        return filters;
    }

    private boolean picksFavorite(BacktestResult r) {
        double market = r.getMarketLine().getSpread();
        boolean pickHome = r.getSpread().pick() == Pick.HOME;
        return pickHome ? market < 0 : market > 0;
    }

    private boolean aligned(BacktestResult r) {
        boolean eloHome = r.getHomeRating() > r.getAwayRating();
        boolean marketHome = r.getMarketLine().getSpread() < 0;
        return eloHome == marketHome;
    }

    private double spreadEdge(BacktestResult r) {
        return Math.abs(r.getPrediction().getSpread() - r.getMarketLine().getSpread());
    }

    private double favoriteProbability(BacktestResult r) {
        double p = r.getPrediction().getHomeWinProbability();
        return Math.max(p, 1.0 - p);
    }

    record ThresholdFilter(String name, String description, Predicate<BacktestResult> predicate) {
    }
}
