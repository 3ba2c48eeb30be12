package com.tony.gameForecast.model.dto;

import com.tony.gameForecast.model.LineSource;
import com.tony.gameForecast.model.Market;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@Builder
public class BacktestSummary {
    int totalGames;     // Matchs évalués
    int skippedGames;   // Non terminés, sans score, sans date ou nuls interdits
    List<MarketRecord> records;

    public Optional<MarketRecord> record(Market market, LineSource source) {
        return records.stream()
                .filter(r -> r.market() == market && r.lineSource() == source)
                .findFirst();
    }
}
