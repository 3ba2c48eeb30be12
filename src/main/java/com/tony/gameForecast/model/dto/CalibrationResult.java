package com.tony.gameForecast.model.dto;

import com.tony.gameForecast.model.Sport;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CalibrationResult {
    Sport sport;
    int sampleSize;

    double ratingToPoints;   // Pente x 100
    double homeAdvantage;    // Ordonnée à l'origine
    double rSquared;

    double averageRatingGap;
    double averageMargin;
    double homeWinPct;

    List<CalibrationPoint> recentPoints;

    public boolean isDegenerate() {
        return ratingToPoints == 0.0 && homeAdvantage == 0.0;
    }
}
