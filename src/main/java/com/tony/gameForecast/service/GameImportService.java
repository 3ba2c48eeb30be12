package com.tony.gameForecast.service;

import com.opencsv.bean.CsvBindByName;
import com.opencsv.bean.CsvToBeanBuilder;
import com.tony.gameForecast.exception.InvalidGameDataException;
import com.tony.gameForecast.model.Game;
import com.tony.gameForecast.model.GameStatus;
import com.tony.gameForecast.model.MarketLine;
import com.tony.gameForecast.model.dto.ImportedSeason;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.Reader;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Import CSV d'une saison historique (matchs + lignes de clôture).
 * Colonnes : GameId, Date, Season, Week, Home, Away, HomeScore, AwayScore, Status, Spread, Total, Weather.
 */
@Service
@Slf4j
public class GameImportService {

    /**
     * @param strict true : la première ligne incohérente fait échouer l'import ; false : elle est ignorée
     */
    public ImportedSeason importSeason(Reader reader, boolean strict) {
        List<GameRow> rows;
        try {
            rows = new CsvToBeanBuilder<GameRow>(reader)
                    .withType(GameRow.class).withSeparator(',').withIgnoreLeadingWhiteSpace(true).build().parse();
        } catch (RuntimeException e) {
            throw new InvalidGameDataException("CSV illisible : " + e.getMessage(), e);
        }

        List<Game> games = new ArrayList<>();
        List<MarketLine> lines = new ArrayList<>();
        int skipped = 0;
        int lineNumber = 1;

        for (GameRow row : rows) {
            lineNumber++;
            try {
                Game game = toGame(row, lineNumber);
                games.add(game);
                if (row.getSpread() != null || row.getTotal() != null) {
                    lines.add(MarketLine.builder()
                            .gameId(game.getId())
                            .spread(row.getSpread())
                            .total(row.getTotal())
                            .capturedAt(game.getGameTime())
                            .build());
                }
            } catch (InvalidGameDataException e) {
                if (strict) throw e;
                log.warn("⚠️ Ligne ignorée : {}", e.getMessage());
                skipped++;
            }
        }

        log.info("📥 Import terminé : {} matchs, {} lignes de marché, {} lignes ignorées", games.size(), lines.size(), skipped);
        return new ImportedSeason(games, lines, skipped);
    }

    /**
     * Vérifie la cohérence de matchs reçus en JSON (mêmes règles que l'import CSV strict).
     */
    public void checkConsistency(List<Game> games) {
        for (Game game : games) {
            if (game.getHomeTeamId().equals(game.getAwayTeamId())) {
                throw new InvalidGameDataException("Match " + game.getId() + " : " + game.getHomeTeamId() + " joue contre elle-même");
            }
            if (game.isFinal() && !game.hasScores()) {
                throw new InvalidGameDataException("Match " + game.getId() + " terminé sans score");
            }
        }
    }

    Game toGame(GameRow row, int lineNumber) {
        if (isBlank(row.getGameId()) || isBlank(row.getHomeTeam()) || isBlank(row.getAwayTeam())) {
            throw new InvalidGameDataException("ligne " + lineNumber + " : identifiant ou équipe manquant");
        }
        if (row.getHomeTeam().equals(row.getAwayTeam())) {
            throw new InvalidGameDataException("ligne " + lineNumber + " : " + row.getHomeTeam() + " joue contre elle-même");
        }

        boolean hasScores = row.getHomeScore() != null && row.getAwayScore() != null;
        GameStatus status;
        if (isBlank(row.getStatus())) {
            status = hasScores ? GameStatus.FINAL : GameStatus.SCHEDULED;
        } else {
            try {
                status = GameStatus.valueOf(row.getStatus().trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new InvalidGameDataException("ligne " + lineNumber + " : statut inconnu " + row.getStatus(), e);
            }
        }
        if (status == GameStatus.FINAL && !hasScores) {
            throw new InvalidGameDataException("ligne " + lineNumber + " : match " + row.getGameId() + " terminé sans score");
        }

        return Game.builder()
                .id(row.getGameId().trim())
                .homeTeamId(row.getHomeTeam().trim())
                .awayTeamId(row.getAwayTeam().trim())
                .gameTime(parseDate(row.getDate(), lineNumber))
                .status(status)
                .homeScore(row.getHomeScore())
                .awayScore(row.getAwayScore())
                .weatherImpact(row.getWeather())
                .season(row.getSeason())
                .week(row.getWeek())
                .build();
    }

    // "2024-09-08T13:00" ou "2024-09-08" (minuit)
    private LocalDateTime parseDate(String value, int lineNumber) {
        if (isBlank(value)) return null;
        String trimmed = value.trim();
        try {
            return trimmed.contains("T") ? LocalDateTime.parse(trimmed) : LocalDate.parse(trimmed).atStartOfDay();
        } catch (DateTimeParseException e) {
            throw new InvalidGameDataException("ligne " + lineNumber + " : date illisible " + value, e);
        }
    }

    private boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Data
    public static class GameRow {
        @CsvBindByName(column = "GameId") private String gameId;
        @CsvBindByName(column = "Date") private String date;
        @CsvBindByName(column = "Season") private Integer season;
        @CsvBindByName(column = "Week") private Integer week;
        @CsvBindByName(column = "Home") private String homeTeam;
        @CsvBindByName(column = "Away") private String awayTeam;
        @CsvBindByName(column = "HomeScore") private Integer homeScore;
        @CsvBindByName(column = "AwayScore") private Integer awayScore;
        @CsvBindByName(column = "Status") private String status;
        @CsvBindByName(column = "Spread") private Double spread;
        @CsvBindByName(column = "Total") private Double total;
        @CsvBindByName(column = "Weather") private Double weather;
    }
}
