package com.tony.gameForecast.model;

public enum Market {
    SPREAD,
    MONEYLINE,
    TOTAL
}
