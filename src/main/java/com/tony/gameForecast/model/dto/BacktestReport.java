package com.tony.gameForecast.model.dto;

import com.tony.gameForecast.model.BacktestResult;
import com.tony.gameForecast.model.Sport;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class BacktestReport {
    Sport sport;
    List<BacktestResult> results;
    BacktestSummary summary;
    Map<String, Double> finalRatings;
}
