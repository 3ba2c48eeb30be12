package com.tony.gameForecast.model;

public enum Sport {
    NFL,
    NBA,
    NHL,
    CBB // Basket universitaire (NCAA)
}
