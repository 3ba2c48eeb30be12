package com.tony.gameForecast.service;

import com.tony.gameForecast.model.RatingDefaults;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ratings d'une seule exécution (backtest, essai d'optimisation).
 * Jamais partagé entre deux exécutions : chaque passe part d'une instance neuve.
 */
public class RatingStore {

    private final Map<String, Double> ratings = new HashMap<>();

    public RatingStore() {
    }

    /**
     * Départ avec des ratings reportés d'une saison précédente.
     */
    public RatingStore(Map<String, Double> initialRatings) {
        if (initialRatings != null) {
            initialRatings.forEach((teamId, rating) -> {
                if (teamId != null && rating != null) ratings.put(teamId, rating);
            });
        }
    }

    public double get(String teamId) {
        return ratings.getOrDefault(teamId, RatingDefaults.INITIAL_RATING);
    }

    public void set(String teamId, double rating) {
        ratings.put(teamId, rating);
    }

    public boolean contains(String teamId) {
        return ratings.containsKey(teamId);
    }

    /**
     * Copie triée par identifiant d'équipe.
     */
    public Map<String, Double> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(new TreeMap<>(ratings)));
    }
}
