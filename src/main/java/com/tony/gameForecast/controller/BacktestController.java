package com.tony.gameForecast.controller;

import com.tony.gameForecast.config.ForecastProperties;
import com.tony.gameForecast.model.SimulationParams;
import com.tony.gameForecast.model.Sport;
import com.tony.gameForecast.model.dto.BacktestReport;
import com.tony.gameForecast.model.dto.BacktestRequest;
import com.tony.gameForecast.model.dto.CalibrationResult;
import com.tony.gameForecast.model.dto.ImportedSeason;
import com.tony.gameForecast.model.dto.OptimizationReport;
import com.tony.gameForecast.model.dto.OptimizationRequest;
import com.tony.gameForecast.model.dto.ThresholdReport;
import com.tony.gameForecast.model.dto.ThresholdRequest;
import com.tony.gameForecast.service.BacktestingService;
import com.tony.gameForecast.service.CalibrationService;
import com.tony.gameForecast.service.GameImportService;
import com.tony.gameForecast.service.ParameterGrid;
import com.tony.gameForecast.service.ParameterOptimizationService;
import com.tony.gameForecast.service.ThresholdAnalysisService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/backtest")
@RequiredArgsConstructor
@Slf4j
public class BacktestController {
    private final BacktestingService backtestingService;
    private final CalibrationService calibrationService;
    private final ParameterOptimizationService optimizationService;
    private final ThresholdAnalysisService thresholdAnalysisService;
    private final GameImportService importService;
    private final ForecastProperties properties;

    @PostMapping
    public ResponseEntity<BacktestReport> runBacktest(@Valid @RequestBody BacktestRequest request) {
        importService.checkConsistency(request.getGames());
        return ResponseEntity.ok(backtestingService.runBacktest(request.getSport(), request.getTeams(),
                request.getGames(), request.getMarketLines(), request.getInitialRatings(), paramsOf(request)));
    }

    @PostMapping("/calibrate")
    public ResponseEntity<CalibrationResult> calibrate(@Valid @RequestBody BacktestRequest request) {
        importService.checkConsistency(request.getGames());
        return ResponseEntity.ok(calibrationService.calibrate(request.getSport(), request.getGames(), request.getInitialRatings()));
    }

    @PostMapping("/optimize")
    public ResponseEntity<OptimizationReport> optimize(@Valid @RequestBody OptimizationRequest request) {
        importService.checkConsistency(request.getGames());
        SimulationParams baseline = request.getBaseline() != null
                ? request.getBaseline() : optimizationService.baseline(request.getSport());
        return ResponseEntity.ok(optimizationService.optimize(request.getSport(), request.getGames(),
                request.getMarketLines(), baseline, gridOf(request), request.getGradingMode()));
    }

    @PostMapping("/thresholds")
    public ResponseEntity<ThresholdReport> thresholds(@Valid @RequestBody ThresholdRequest request) {
        importService.checkConsistency(request.getGames());
        return ResponseEntity.ok(thresholdAnalysisService.analyze(request.getSport(), request.getGames(),
                request.getMarketLines(), request.getInitialRatings(), request.getParams(), request.getMinGames()));
    }

    // Import CSV d'une saison puis backtest avec les constantes du profil
    @PostMapping("/import")
    public ResponseEntity<BacktestReport> importAndBacktest(
            @RequestPart("file") MultipartFile file,
            @RequestParam Sport sport,
            @RequestParam(defaultValue = "false") boolean strict) throws IOException {

        ImportedSeason season;
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            season = importService.importSeason(reader, strict);
        }
        log.info("📥 {} : {} matchs importés depuis {}", sport, season.games().size(), file.getOriginalFilename());

        return ResponseEntity.ok(backtestingService.runBacktest(sport, List.of(), season.games(), season.marketLines(),
                Map.of(), properties.profile(sport).toSimulationParams()));
    }

    private SimulationParams paramsOf(BacktestRequest request) {
        return request.getParams() != null ? request.getParams() : properties.profile(request.getSport()).toSimulationParams();
    }

    private ParameterGrid gridOf(OptimizationRequest request) {
        if (request.getGrid() == null || request.getGrid().isEmpty()) return ParameterGrid.standard();
        return new ParameterGrid(request.getGrid().stream()
                .map(b -> {
                    ParameterGrid.Block block = ParameterGrid.Block.named(b.getName());
                    b.getValues().forEach(block::with);
                    return block;
                })
                .toList());
    }
}
