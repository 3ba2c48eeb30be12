package com.tony.gameForecast.service;

import com.tony.gameForecast.model.SimulationParams;
import com.tony.gameForecast.model.TunableParameter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Garde une liste de résultats variée : un candidat est écarté si chaque paramètre surveillé
 * est à moins de sa tolérance d'un résultat déjà retenu.
 */
public class NearDuplicateFilter<T> {

    private final Map<TunableParameter, Double> tolerances;
    private final Function<T, SimulationParams> paramsOf;

    public NearDuplicateFilter(Map<TunableParameter, Double> tolerances, Function<T, SimulationParams> paramsOf) {
        this.tolerances = new LinkedHashMap<>(tolerances);
        this.paramsOf = paramsOf;
    }

    /**
     * @param ranked Résultats déjà triés du meilleur au moins bon
     * @param limit Nombre maximum de résultats retenus
     */
    public List<T> select(List<T> ranked, int limit) {
        List<T> kept = new ArrayList<>();
        for (T candidate : ranked) {
            if (kept.size() >= limit) break;
            boolean duplicate = kept.stream().anyMatch(k -> isNearDuplicate(paramsOf.apply(k), paramsOf.apply(candidate)));
            if (!duplicate) kept.add(candidate);
        }
        return kept;
    }

    public boolean isNearDuplicate(SimulationParams a, SimulationParams b) {
        if (tolerances.isEmpty()) return false;
        return tolerances.entrySet().stream()
                .allMatch(e -> Math.abs(e.getKey().valueOf(a) - e.getKey().valueOf(b)) < e.getValue());
    }
}
