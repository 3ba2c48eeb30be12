package com.tony.gameForecast.service;

import com.tony.gameForecast.model.MarketLine;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Choix de la ligne de marché retenue pour chaque match, commun au backtest et aux prédictions.
 */
final class MarketLines {

    // Figée d'abord, puis figée le plus tard, puis capturée le plus tard ; valeurs en dernier recours
    static final Comparator<MarketLine> PREFERENCE = Comparator
            .comparing(MarketLine::isLocked)
            .thenComparing(MarketLine::getLockedAt, Comparator.nullsFirst(Comparator.<LocalDateTime>naturalOrder()))
            .thenComparing(MarketLine::getCapturedAt, Comparator.nullsFirst(Comparator.<LocalDateTime>naturalOrder()))
            .thenComparing(MarketLine::getSpread, Comparator.nullsFirst(Comparator.<Double>naturalOrder()))
            .thenComparing(MarketLine::getTotal, Comparator.nullsFirst(Comparator.<Double>naturalOrder()));

    private MarketLines() {
    }

    static Map<String, MarketLine> byGame(List<MarketLine> lines) {
        if (lines == null) return Map.of();
        return lines.stream()
                .collect(Collectors.toMap(MarketLine::getGameId, Function.identity(), BinaryOperator.maxBy(PREFERENCE)));
    }
}
