package com.tony.gameForecast.model;

public enum GradingMode {
    MODEL_LINE,
    MARKET_LINE
}
