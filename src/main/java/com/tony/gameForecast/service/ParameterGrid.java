package com.tony.gameForecast.service;

import com.tony.gameForecast.model.SimulationParams;
import com.tony.gameForecast.model.TunableParameter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Grille de recherche déclarative : chaque bloc est un produit cartésien de valeurs appliqué sur la baseline.
 */
public class ParameterGrid {

    private final List<Block> blocks;

    public ParameterGrid(List<Block> blocks) {
        this.blocks = List.copyOf(blocks);
    }

    public List<Block> getBlocks() {
        return blocks;
    }

    /**
     * Recherche standard : balayages simples, combinaisons prometteuses puis affinage ("deep search").
     */
    public static ParameterGrid standard() {
        List<Block> blocks = new ArrayList<>();

        // Balayages un paramètre à la fois
        blocks.add(Block.named("spread-shrinkage").with(TunableParameter.SPREAD_SHRINKAGE, 0.1, 0.2, 0.3, 0.4, 0.5));
        blocks.add(Block.named("rating-cap").with(TunableParameter.RATING_CAP, 4, 6, 8, 10));
        blocks.add(Block.named("max-spread").with(TunableParameter.MAX_SPREAD, 3, 5, 7, 10));
        blocks.add(Block.named("min-spread").with(TunableParameter.MIN_SPREAD, 1, 2, 3));

        // Combinaisons
        blocks.add(Block.named("shrinkage-x-max-spread")
                .with(TunableParameter.SPREAD_SHRINKAGE, 0.2, 0.3, 0.4)
                .with(TunableParameter.MAX_SPREAD, 5, 7, 10));
        blocks.add(Block.named("cap-x-shrinkage")
                .with(TunableParameter.RATING_CAP, 4, 6, 8)
                .with(TunableParameter.SPREAD_SHRINKAGE, 0.2, 0.3));
        blocks.add(Block.named("rating-to-points-x-shrinkage")
                .with(TunableParameter.RATING_TO_POINTS, 4, 5, 7, 8)
                .with(TunableParameter.SPREAD_SHRINKAGE, 0, 0.2, 0.3));
        blocks.add(Block.named("home-advantage").with(TunableParameter.HOME_ADVANTAGE, 1.5, 2, 2.5, 3));

        // Affinage autour des meilleurs résultats
        blocks.add(Block.named("deep-search")
                .with(TunableParameter.SPREAD_SHRINKAGE, 0.15, 0.25, 0.35, 0.45)
                .with(TunableParameter.RATING_CAP, 0, 5, 7)
                .with(TunableParameter.MAX_SPREAD, 6, 8, 12));

        blocks.add(Block.named("weather").with(TunableParameter.WEATHER_COEFFICIENT, 0, 0.75, 1.5, 2.25));
        return new ParameterGrid(blocks);
    }

    /**
     * Candidats dans l'ordre de déclaration, baseline en tête, doublons exacts supprimés.
     */
    public List<SimulationParams> candidates(SimulationParams baseline) {
        Set<SimulationParams> candidates = new LinkedHashSet<>();
        candidates.add(baseline);
        for (Block block : blocks) {
            candidates.addAll(block.expand(baseline));
        }
        return new ArrayList<>(candidates);
    }

    public static final class Block {
        private final String name;
        private final Map<TunableParameter, List<Double>> values = new LinkedHashMap<>();

        private Block(String name) {
            this.name = name;
        }

        public static Block named(String name) {
            return new Block(name);
        }

        public Block with(TunableParameter parameter, double... options) {
            List<Double> list = new ArrayList<>(options.length);
            for (double option : options) list.add(option);
            return with(parameter, list);
        }

        public Block with(TunableParameter parameter, List<Double> options) {
            if (options == null || options.isEmpty() || options.stream().anyMatch(Objects::isNull)) {
                throw new IllegalArgumentException("Bloc " + name + " : valeurs manquantes pour " + parameter);
            }
            values.put(parameter, List.copyOf(options));
            return this;
        }

        public String getName() {
            return name;
        }

        public Map<TunableParameter, List<Double>> getValues() {
            return values;
        }

        /**
         * Produit cartésien des listes de valeurs, appliqué sur la baseline.
         */
        List<SimulationParams> expand(SimulationParams baseline) {
            List<SimulationParams> combos = List.of(baseline);
            for (Map.Entry<TunableParameter, List<Double>> entry : values.entrySet()) {
                if (entry.getValue().isEmpty()) continue;
                List<SimulationParams> next = new ArrayList<>();
                for (SimulationParams combo : combos) {
                    for (Double value : entry.getValue()) {
                        next.add(entry.getKey().apply(combo, value));
                    }
                }
                combos = next;
            }
            return combos;
        }
    }
}
