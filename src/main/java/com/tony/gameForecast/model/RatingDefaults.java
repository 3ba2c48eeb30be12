package com.tony.gameForecast.model;

public final class RatingDefaults {

    public static final double INITIAL_RATING = 1500.0;

    private RatingDefaults() {
    }
}
