package com.tony.gameForecast.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;

/**
 * Ligne de marché (consensus bookmakers) pour un match.
 * Spread du point de vue domicile : négatif = domicile favori.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MarketLine {
    @NotBlank(message = "La ligne doit référencer un match")
    String gameId;

    Double spread;
    Double total;

    LocalDateTime capturedAt;
    LocalDateTime lockedAt; // Ligne figée ~1h avant le coup d'envoi

    public boolean hasSpread() {
        return spread != null;
    }

    public boolean hasTotal() {
        return total != null && total > 0;
    }

    @JsonIgnore
    public boolean isLocked() {
        return lockedAt != null;
    }
}
