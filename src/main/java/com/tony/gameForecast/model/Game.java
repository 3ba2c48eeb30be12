package com.tony.gameForecast.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;

/**
 * Match fourni par le collaborateur externe. Immuable une fois terminé.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Game {
    @NotBlank(message = "L'identifiant du match est requis")
    String id;

    @NotBlank(message = "L'équipe domicile est requise")
    String homeTeamId;

    @NotBlank(message = "L'équipe extérieur est requise")
    String awayTeamId;

    LocalDateTime gameTime;

    @NotNull(message = "Le statut du match est requis")
    GameStatus status;

    Integer homeScore;
    Integer awayScore;

    // Impact météo déjà exprimé en points (matchs en extérieur uniquement)
    Double weatherImpact;

    Integer season;
    Integer week;

    @JsonIgnore
    public boolean isFinal() {
        return status == GameStatus.FINAL;
    }

    public boolean hasScores() {
        return homeScore != null && awayScore != null;
    }

    @JsonIgnore
    public boolean isTie() {
        return hasScores() && homeScore.equals(awayScore);
    }

    public int actualMargin() {
        return homeScore - awayScore;
    }

    public int actualTotal() {
        return homeScore + awayScore;
    }
}
