package com.tony.gameForecast.model;

public enum Pick {
    HOME,
    AWAY,
    OVER,
    UNDER
}
