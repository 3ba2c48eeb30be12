package com.tony.gameForecast.service;

import com.tony.gameForecast.model.ConfidenceTier;
import com.tony.gameForecast.model.ConfidenceTiers;
import com.tony.gameForecast.model.MarketLine;
import com.tony.gameForecast.model.PredictionRecord;
import com.tony.gameForecast.model.SportProfile;
import com.tony.gameForecast.util.Rounding;
import org.springframework.stereotype.Service;

/**
 * Niveaux de confiance par marché. Métadonnée pure : ne modifie jamais un pick.
 */
@Service
public class ConfidenceTierService {

    public ConfidenceTiers tiers(PredictionRecord prediction, MarketLine marketLine, SportProfile profile) {
        // Sans ligne de marché, l'edge vaut 0 (=> LOW)
        double spreadEdge = marketLine != null && marketLine.hasSpread()
                ? Math.abs(prediction.getSpread() - marketLine.getSpread()) : 0.0;
        double totalEdge = marketLine != null && marketLine.hasTotal()
                ? Math.abs(prediction.getTotal() - marketLine.getTotal()) : 0.0;
        double moneylineEdge = Math.abs(prediction.getHomeWinProbability() - 0.5) * 100.0;

        return new ConfidenceTiers(
                tier(spreadEdge, profile.getSpreadHighEdge(), profile.getSpreadMediumEdge()),
                tier(totalEdge, profile.getTotalHighEdge(), profile.getTotalMediumEdge()),
                tier(moneylineEdge, profile.getMoneylineHighEdge(), profile.getMoneylineMediumEdge()),
                Rounding.toDecimals(spreadEdge, 2),
                Rounding.toDecimals(totalEdge, 2),
                Rounding.toDecimals(moneylineEdge, 2));
    }

    public PredictionRecord withTiers(PredictionRecord prediction, MarketLine marketLine, SportProfile profile) {
        return prediction.toBuilder().confidence(tiers(prediction, marketLine, profile)).build();
    }

    ConfidenceTier tier(double edge, double high, double medium) {
        if (edge >= high) return ConfidenceTier.HIGH;
        if (edge >= medium) return ConfidenceTier.MEDIUM;
        return ConfidenceTier.LOW;
    }
}
