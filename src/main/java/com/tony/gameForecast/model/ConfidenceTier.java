package com.tony.gameForecast.model;

public enum ConfidenceTier {
    HIGH,
    MEDIUM,
    LOW
}
