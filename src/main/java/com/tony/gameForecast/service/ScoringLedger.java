package com.tony.gameForecast.service;

import java.util.HashMap;
import java.util.Map;

/**
 * Moyennes de points glissantes pendant une rejoue chronologique.
 * Seuls les matchs déjà enregistrés comptent : aucune fuite du futur.
 */
public class ScoringLedger {

    private final Map<String, Tally> tallies = new HashMap<>();

    public void record(String homeTeamId, String awayTeamId, int homeScore, int awayScore) {
        tally(homeTeamId).add(homeScore, awayScore);
        tally(awayTeamId).add(awayScore, homeScore);
    }

    // null tant que l'équipe n'a pas joué (le prédicteur retombe sur la moyenne ligue)
    public Double pointsScored(String teamId) {
        Tally t = tallies.get(teamId);
        return t == null ? null : t.scored / t.games;
    }

    public Double pointsAllowed(String teamId) {
        Tally t = tallies.get(teamId);
        return t == null ? null : t.allowed / t.games;
    }

    public int gamesPlayed(String teamId) {
        Tally t = tallies.get(teamId);
        return t == null ? 0 : t.games;
    }

    private Tally tally(String teamId) {
        return tallies.computeIfAbsent(teamId, id -> new Tally());
    }

    private static class Tally {
        private double scored;
        private double allowed;
        private int games;

        void add(int pointsFor, int pointsAgainst) {
            scored += pointsFor;
            allowed += pointsAgainst;
            games++;
        }
    }
}
