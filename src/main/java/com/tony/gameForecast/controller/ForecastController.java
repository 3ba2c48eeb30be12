package com.tony.gameForecast.controller;

import com.tony.gameForecast.config.ForecastProperties;
import com.tony.gameForecast.model.Sport;
import com.tony.gameForecast.model.SportProfile;
import com.tony.gameForecast.model.dto.ForecastRequest;
import com.tony.gameForecast.model.dto.GameForecast;
import com.tony.gameForecast.service.GameForecastService;
import com.tony.gameForecast.service.GameImportService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/forecasts")
@RequiredArgsConstructor
public class ForecastController {
    private final GameForecastService forecastService;
    private final GameImportService importService;
    private final ForecastProperties properties;

    @PostMapping
    public ResponseEntity<List<GameForecast>> forecast(@Valid @RequestBody ForecastRequest request) {
        importService.checkConsistency(request.getGames());
        return ResponseEntity.ok(forecastService.forecast(request.getSport(), request.getTeams(),
                request.getGames(), request.getMarketLines(), request.getParams()));
    }

    // Constantes en production pour un sport
    @GetMapping("/profiles/{sport}")
    public ResponseEntity<SportProfile> profile(@PathVariable Sport sport) {
        return ResponseEntity.ok(properties.profile(sport));
    }
}
