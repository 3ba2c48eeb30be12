package com.tony.gameForecast.model.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FilterStats {
    String name;
    String description;
    int games;
    MarketRecord spread;
    MarketRecord moneyline;
    MarketRecord total;
    double spreadProfit;   // Cote -110
}
