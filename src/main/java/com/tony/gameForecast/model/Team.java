package com.tony.gameForecast.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Équipe telle que fournie par le service d'ingestion.
 * Le rating et les moyennes sont l'état courant ; pendant un backtest l'état vit dans le RatingStore.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Team {
    @NotBlank(message = "L'identifiant de l'équipe est requis")
    String id;

    String abbreviation;

    @Builder.Default
    Double rating = RatingDefaults.INITIAL_RATING;

    // Moyennes par match (null = pas encore de match joué)
    Double pointsScored;
    Double pointsAllowed;

    @Builder.Default
    Integer gamesPlayed = 0;

    public String displayName() {
        return abbreviation != null && !abbreviation.isBlank() ? abbreviation : id;
    }

    public double ratingOrDefault() {
        return rating != null ? rating : RatingDefaults.INITIAL_RATING;
    }
}
