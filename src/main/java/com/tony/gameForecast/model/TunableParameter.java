package com.tony.gameForecast.model;

import java.util.function.BiFunction;
import java.util.function.ToDoubleFunction;

/**
 * Paramètres que l'optimiseur sait faire varier.
 */
public enum TunableParameter {
    RATING_TO_POINTS(SimulationParams::getRatingToPoints, (p, v) -> p.toBuilder().ratingToPoints(v).build()),
    HOME_ADVANTAGE(SimulationParams::getHomeAdvantage, (p, v) -> p.toBuilder().homeAdvantage(v).build()),
    SPREAD_SHRINKAGE(SimulationParams::getSpreadShrinkage, (p, v) -> p.toBuilder().spreadShrinkage(v).build()),
    RATING_CAP(SimulationParams::getRatingCap, (p, v) -> p.toBuilder().ratingCap(v).build()),
    MIN_SPREAD(SimulationParams::getMinSpread, (p, v) -> p.toBuilder().minSpread(v).build()),
    MAX_SPREAD(SimulationParams::getMaxSpread, (p, v) -> p.toBuilder().maxSpread(v).build()),
    STATS_REGRESSION(SimulationParams::getStatsRegression, (p, v) -> p.toBuilder().statsRegression(v).build()),
    WEATHER_COEFFICIENT(SimulationParams::getWeatherCoefficient, (p, v) -> p.toBuilder().weatherCoefficient(v).build());

    private final ToDoubleFunction<SimulationParams> reader;
    private final BiFunction<SimulationParams, Double, SimulationParams> writer;

    TunableParameter(ToDoubleFunction<SimulationParams> reader,
                     BiFunction<SimulationParams, Double, SimulationParams> writer) {
        this.reader = reader;
        this.writer = writer;
    }

    public double valueOf(SimulationParams params) {
        return reader.applyAsDouble(params);
    }

    public SimulationParams apply(SimulationParams params, double value) {
        return writer.apply(params, value);
    }
}
