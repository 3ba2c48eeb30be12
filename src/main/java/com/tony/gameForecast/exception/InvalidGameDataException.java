package com.tony.gameForecast.exception;

/**
 * Données de match incohérentes (équipe contre elle-même, match terminé sans score, date illisible...).
 */
public class InvalidGameDataException extends RuntimeException {

    public InvalidGameDataException(String message) {
        super(message);
    }

    public InvalidGameDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
