package com.tony.gameForecast.model;

public enum GameStatus {
    SCHEDULED,
    FINAL
}
