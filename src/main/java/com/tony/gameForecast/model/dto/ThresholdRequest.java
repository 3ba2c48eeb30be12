package com.tony.gameForecast.model.dto;

import jakarta.validation.constraints.Min;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class ThresholdRequest extends BacktestRequest {
    @Min(value = 1, message = "L'échantillon minimum doit être positif")
    private Integer minGames;
}
