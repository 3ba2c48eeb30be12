package com.tony.gameForecast.config;

import com.tony.gameForecast.model.Sport;
import com.tony.gameForecast.model.SportProfile;
import com.tony.gameForecast.model.TunableParameter;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "forecast")
@Data
public class ForecastProperties {

    // --- Profils par sport ---
    private Sports sports = new Sports();

    // --- Optimiseur ---
    private Optimizer optimizer = new Optimizer();

    public SportProfile profile(Sport sport) {
        return sports.get(sport);
    }

    /**
     * Chaque profil part des constantes calibrées du sport ; le fichier ne surcharge que les clés présentes.
     */
    @Data
    public static class Sports {
        private SportProfile nfl = SportProfile.defaultsFor(Sport.NFL);
        private SportProfile nba = SportProfile.defaultsFor(Sport.NBA);
        private SportProfile nhl = SportProfile.defaultsFor(Sport.NHL);
        private SportProfile cbb = SportProfile.defaultsFor(Sport.CBB);

        public SportProfile get(Sport sport) {
            return switch (sport) {
                case NFL -> nfl;
                case NBA -> nba;
                case NHL -> nhl;
                case CBB -> cbb;
            };
        }
    }

    @Data
    public static class Optimizer {
        private int minSampleSize = 50;
        private int topResults = 20;
        private double breakEvenWinPct = 52.4;   // -110 : 110 / 210
        private int parallelism = 4;
        private double stake = 100.0;            // Gain d'un pari gagné
        private double risk = 110.0;             // Perte d'un pari perdu
        private Map<TunableParameter, Double> duplicateTolerances = defaultTolerances();

        private static Map<TunableParameter, Double> defaultTolerances() {
            Map<TunableParameter, Double> tolerances = new LinkedHashMap<>();
            tolerances.put(TunableParameter.SPREAD_SHRINKAGE, 0.05);
            tolerances.put(TunableParameter.RATING_CAP, 1.0);
            tolerances.put(TunableParameter.MAX_SPREAD, 1.0);
            return tolerances;
        }
    }
}
