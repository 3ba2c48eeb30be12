package com.tony.gameForecast.service;

import com.tony.gameForecast.config.ForecastProperties;
import com.tony.gameForecast.model.Game;
import com.tony.gameForecast.model.GradingMode;
import com.tony.gameForecast.model.MarketLine;
import com.tony.gameForecast.model.SimulationParams;
import com.tony.gameForecast.model.SimulationResult;
import com.tony.gameForecast.model.Sport;
import com.tony.gameForecast.model.dto.OptimizationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Recherche sur grille des constantes du modèle.
 * Chaque candidat rejoue la saison depuis zéro (ratings remis à 1500), les essais tournent en parallèle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParameterOptimizationService {

    private final BacktestingService backtestingService;
    private final ForecastProperties properties;

    public OptimizationReport optimize(Sport sport, List<Game> games, List<MarketLine> marketLines, GradingMode mode) {
        SimulationParams baseline = baseline(sport);
        return optimize(sport, games, marketLines, baseline, ParameterGrid.standard(), mode);
    }

    public OptimizationReport optimize(Sport sport, List<Game> games, List<MarketLine> marketLines,
                                       SimulationParams baseline, ParameterGrid grid, GradingMode mode) {
        ForecastProperties.Optimizer settings = properties.getOptimizer();
        List<SimulationParams> candidates = grid.candidates(baseline);

        log.info("🧮 Optimisation {} : {} configurations, {} matchs, ligne {}", sport, candidates.size(),
                games == null ? 0 : games.size(), mode);

        List<SimulationResult> results = runTrials(sport, games, marketLines, candidates, mode, settings.getParallelism());

        // Tri stable : à profit égal, l'ordre de déclaration de la grille est conservé
        List<SimulationResult> qualified = results.stream()
                .filter(r -> r.totalGraded() >= settings.getMinSampleSize())
                .sorted(Comparator.comparingDouble(SimulationResult::getProfit).reversed())
                .toList();

        List<SimulationResult> top = new NearDuplicateFilter<>(settings.getDuplicateTolerances(), SimulationResult::getParams)
                .select(qualified, settings.getTopResults());

        SimulationResult bestByWinPct = qualified.stream()
                .max(Comparator.comparingDouble(SimulationResult::winPct)).orElse(null);
        SimulationResult bestByProfit = qualified.isEmpty() ? null : qualified.get(0);
        SimulationResult bestByVolume = qualified.stream()
                .filter(r -> r.winPct() >= settings.getBreakEvenWinPct())
                .max(Comparator.comparingInt(SimulationResult::totalGraded)).orElse(null);

        if (bestByProfit != null) {
            log.info("🏆 Meilleur profit : {} ({}-{}-{}, {}%)", bestByProfit.getProfit(),
                    bestByProfit.getWins(), bestByProfit.getLosses(), bestByProfit.getPushes(), bestByProfit.winPct());
        } else {
            log.warn("Aucune configuration n'atteint l'échantillon minimum de {} paris", settings.getMinSampleSize());
        }

        return OptimizationReport.builder()
                .sport(sport)
                .gradingMode(mode)
                .configurationsTested(results.size())
                .qualifiedConfigurations(qualified.size())
                .baseline(results.get(0))
                .topResults(top)
                .bestByWinPct(bestByWinPct)
                .bestByProfit(bestByProfit)
                .bestByVolume(bestByVolume)
                .build();
    }

    /**
     * Point de départ de la recherche : le profil du sport, sans rétrécissement ni plafond.
     */
    public SimulationParams baseline(Sport sport) {
        return properties.profile(sport).toSimulationParams().toBuilder()
                .spreadShrinkage(0.0)
                .ratingCap(0.0)
                .minSpread(0.0)
                .build();
    }

    private List<SimulationResult> runTrials(Sport sport, List<Game> games, List<MarketLine> marketLines,
                                             List<SimulationParams> candidates, GradingMode mode, int parallelism) {
        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, parallelism), r -> {
            Thread t = new Thread(r, "optimizer-trial-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try {
            List<Future<SimulationResult>> futures = new ArrayList<>(candidates.size());
            for (SimulationParams params : candidates) {
                futures.add(executor.submit(() -> backtestingService.simulate(sport, games, marketLines, params, mode)));
            }

            // Résultats collectés dans l'ordre des candidats
            List<SimulationResult> results = new ArrayList<>(futures.size());
            for (Future<SimulationResult> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Optimisation interrompue", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Échec d'un essai d'optimisation", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }
}
